package org.springaicommunity.github.request;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitHubUrls Tests")
class GitHubUrlsTest {

	@ParameterizedTest(name = "{0} + {1}")
	@CsvSource({ "https://api.github.com, /user, https://api.github.com/user",
			"https://api.github.com/, user, https://api.github.com/user",
			"https://api.github.com//, //user, https://api.github.com/user",
			"https://ghe.example.com/api/v3, repos/o/r, https://ghe.example.com/api/v3/repos/o/r",
			"https://api.github.com, http://example.com/a, http://example.com/a",
			"https://api.github.com, HTTPS://Example.com/A, HTTPS://Example.com/A" })
	@DisplayName("Should join base and path with exactly one slash")
	void shouldJoin(String base, String path, String expected) {
		assertThat(GitHubUrls.join(base, path)).isEqualTo(expected);
	}

	@Test
	@DisplayName("Should not treat other schemes as absolute")
	void shouldOnlyTreatHttpAsAbsolute() {
		assertThat(GitHubUrls.isAbsolute("ftp://example.com")).isFalse();
		assertThat(GitHubUrls.isAbsolute("/https://x")).isFalse();
		assertThat(GitHubUrls.join("https://api.github.com", "ftp://x")).isEqualTo("https://api.github.com/ftp://x");
	}

	@Test
	@DisplayName("Should append encoded query parameters")
	void shouldAppendQuery() {
		Map<String, List<String>> query = new LinkedHashMap<>();
		query.put("q", List.of("a b&c"));
		query.put("sort", List.of("created"));

		assertThat(GitHubUrls.withQuery("https://x/search", query)).isEqualTo("https://x/search?q=a+b%26c&sort=created");
		assertThat(GitHubUrls.withQuery("https://x/search?page=2", query))
			.isEqualTo("https://x/search?page=2&q=a+b%26c&sort=created");
		assertThat(GitHubUrls.withQuery("https://x", Map.of())).isEqualTo("https://x");
	}

}
