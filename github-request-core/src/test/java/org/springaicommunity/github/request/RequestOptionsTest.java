package org.springaicommunity.github.request;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RequestOptions Tests")
class RequestOptionsTest {

	@Test
	@DisplayName("Should collect query values as strings, expanding iterables and skipping nulls")
	void shouldCollectQueryValues() {
		RequestOptions options = RequestOptions.builder()
			.query("per_page", 100)
			.query("labels", List.of("bug", "docs"))
			.query("since", null)
			.build();

		assertThat(options.getQuery()).containsExactly(Map.entry("per_page", List.of("100")),
				Map.entry("labels", List.of("bug", "docs")));
	}

	@Test
	@DisplayName("toBuilder() should copy without sharing state")
	void toBuilderShouldCopy() {
		RequestOptions original = RequestOptions.builder()
			.query("state", "open")
			.header("Accept", "text/plain")
			.timeout(Duration.ofSeconds(3))
			.stream(true)
			.build();

		RequestOptions copy = original.toBuilder().clearQuery().header("X-Extra", "1").build();

		assertThat(original.getQuery()).containsOnlyKeys("state");
		assertThat(original.getHeaders()).containsOnlyKeys("Accept");
		assertThat(copy.getQuery()).isEmpty();
		assertThat(copy.getHeaders()).containsOnlyKeys("Accept", "X-Extra");
		assertThat(copy.getTimeout()).isEqualTo(Duration.ofSeconds(3));
		assertThat(copy.isStream()).isTrue();
	}

	@Test
	@DisplayName("Should reject both a JSON and a raw body")
	void shouldRejectTwoBodies() {
		assertThatThrownBy(() -> RequestOptions.builder().json(Map.of()).data(new byte[1]).build())
			.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("none() should carry nothing")
	void noneShouldBeEmpty() {
		RequestOptions none = RequestOptions.none();

		assertThat(none.getQuery()).isEmpty();
		assertThat(none.getHeaders()).isEmpty();
		assertThat(none.getJson()).isNull();
		assertThat(none.getData()).isNull();
		assertThat(none.isStream()).isFalse();
	}

}
