package org.springaicommunity.github.request;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitHubResponse Tests")
class GitHubResponseTest {

	private static final URI ISSUES = URI.create("https://api.github.com/repos/o/r/issues");

	private static GitHubResponse withLinks(String... links) {
		return GitHubResponse.buffered("GET", ISSUES, 200, GitHubResponse.toHeaders(Map.of("Link", List.of(links))),
				new byte[0]);
	}

	@Nested
	@DisplayName("Link Header Parsing")
	class LinkParsingTest {

		@Test
		@DisplayName("Should parse every relation of a GitHub Link header")
		void shouldParseRelations() {
			GitHubResponse response = withLinks("<https://api.github.com/repositories/1/issues?page=2>; rel=\"next\", "
					+ "<https://api.github.com/repositories/1/issues?page=5>; rel=\"last\"");

			assertThat(response.links()).containsExactly(
					Map.entry("next", "https://api.github.com/repositories/1/issues?page=2"),
					Map.entry("last", "https://api.github.com/repositories/1/issues?page=5"));
			assertThat(response.nextPageUrl()).contains("https://api.github.com/repositories/1/issues?page=2");
		}

		@Test
		@DisplayName("Should accept unquoted and multi-valued relations")
		void shouldAcceptUnquotedAndMultipleRelations() {
			GitHubResponse response = withLinks("<https://x/2>; rel=next; title=\"two\"",
					"<https://x/1>; rel=\"first prev\"");

			assertThat(response.links()).containsEntry("next", "https://x/2")
				.containsEntry("first", "https://x/1")
				.containsEntry("prev", "https://x/1");
		}

		@Test
		@DisplayName("Should have no next page without a Link header")
		void shouldHaveNoNextPageWithoutLinks() {
			GitHubResponse response = GitHubResponse.buffered("GET", ISSUES, 200, GitHubResponse.toHeaders(Map.of()),
					new byte[0]);

			assertThat(response.links()).isEmpty();
			assertThat(response.nextPageUrl()).isEmpty();
		}

		@Test
		@DisplayName("Should ignore links without a relation")
		void shouldIgnoreLinksWithoutRelation() {
			assertThat(withLinks("<https://x/2>; title=\"no rel\"").links()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Body Access")
	class BodyAccessTest {

		@Test
		@DisplayName("Should read a streamed body once and buffer it")
		void shouldBufferStreamedBody() {
			GitHubResponse response = GitHubResponse.streamed("GET", ISSUES, 200, GitHubResponse.toHeaders(Map.of()),
					new ByteArrayInputStream("héllo".getBytes(StandardCharsets.UTF_8)));

			assertThat(response.text()).isEqualTo("héllo");
			assertThat(response.text()).isEqualTo("héllo");
			assertThat(response.bodyStream()).hasBinaryContent("héllo".getBytes(StandardCharsets.UTF_8));
		}

		@Test
		@DisplayName("Should hand out a streamed body only once")
		void shouldHandOutStreamOnce() throws IOException {
			GitHubResponse response = GitHubResponse.streamed("GET", ISSUES, 200, GitHubResponse.toHeaders(Map.of()),
					new ByteArrayInputStream(new byte[] { 1, 2 }));

			try (InputStream in = response.bodyStream()) {
				assertThat(in.readAllBytes()).containsExactly(1, 2);
			}
			assertThatThrownBy(response::bytes).isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should report read failures as retryable transport errors")
		void shouldWrapReadFailures() {
			InputStream broken = new InputStream() {
				@Override
				public int read() throws IOException {
					throw new IOException("connection reset");
				}
			};
			GitHubResponse response = GitHubResponse.streamed("GET", ISSUES, 200, GitHubResponse.toHeaders(Map.of()),
					broken);

			assertThatThrownBy(response::text).isInstanceOf(TransportException.class)
				.hasMessageContaining("connection reset")
				.satisfies(e -> assertThat(((TransportException) e).isRetryable()).isTrue());
		}

		@Test
		@DisplayName("Should classify status codes and read headers case-insensitively")
		void shouldExposeStatusAndHeaders() {
			GitHubResponse response = GitHubResponse.buffered("POST", ISSUES, 201,
					GitHubResponse.toHeaders(Map.of("ETag", List.of("\"abc\""))), new byte[0]);

			assertThat(response.isSuccessful()).isTrue();
			assertThat(response.header("etag")).contains("\"abc\"");
			assertThat(response.rateLimit()).isEmpty();
			assertThat(response).hasToString("GitHubResponse[POST " + ISSUES + " -> 201]");
		}

	}

}
