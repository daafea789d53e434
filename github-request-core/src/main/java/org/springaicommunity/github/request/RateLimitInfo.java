package org.springaicommunity.github.request;

import java.net.http.HttpHeaders;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Rate limit information from the GitHub API.
 *
 * <p>
 * GitHub reports the state of the caller's primary rate limit on every response through
 * the {@code X-RateLimit-*} headers.
 *
 * @param limit the maximum number of requests allowed per hour
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Extract rate limit information from response headers.
	 * @param headers response headers
	 * @return the rate limit, or empty if the response carries no
	 * {@code X-RateLimit-Remaining} header
	 */
	public static Optional<RateLimitInfo> fromHeaders(HttpHeaders headers) {
		OptionalLong remaining = parseLong(headers, "X-RateLimit-Remaining");
		if (remaining.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new RateLimitInfo((int) parseLong(headers, "X-RateLimit-Limit").orElse(-1),
				(int) remaining.getAsLong(), parseLong(headers, "X-RateLimit-Reset").orElse(-1),
				(int) parseLong(headers, "X-RateLimit-Used").orElse(-1)));
	}

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

	static OptionalLong parseLong(HttpHeaders headers, String name) {
		Optional<String> value = headers.firstValue(name);
		if (value.isEmpty()) {
			return OptionalLong.empty();
		}
		try {
			return OptionalLong.of(Long.parseLong(value.get().trim()));
		}
		catch (NumberFormatException e) {
			return OptionalLong.empty();
		}
	}

}
