package org.springaicommunity.github.request;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.regex.Pattern;

/**
 * Decides whether a request attempt should be retried and how long to wait first.
 *
 * <p>
 * Retried outcomes:
 * <ul>
 * <li>transport failures, unless the request itself is malformed</li>
 * <li>403 responses that signal a rate limit, through a {@code Retry-After} header or a
 * body mentioning "rate limit"</li>
 * <li>responses whose status is in {@link RetryConfig#retryStatuses()}</li>
 * </ul>
 *
 * <p>
 * The wait is the backoff computed by {@link RetryConfig#backoff}, raised to the
 * server's own hint when {@code Retry-After} or an exhausted primary rate limit's
 * {@code x-ratelimit-reset} asks for longer. A retry whose wait would overrun
 * {@link RetryConfig#totalWait()} is not attempted.
 *
 * <p>
 * Instances hold no per-request state and may be shared between threads.
 */
public class RetryPolicy {

	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	private static final Pattern DELTA_SECONDS = Pattern.compile("\\d{1,18}");

	private static final long MAX_EPOCH_SECOND = Instant.MAX.getEpochSecond();

	private static final long MIN_EPOCH_SECOND = Instant.MIN.getEpochSecond();

	/**
	 * Upper bound on a delay requested by the server, well within what {@link Sleeper} can
	 * express in milliseconds.
	 */
	static final Duration MAX_SERVER_WAIT = Duration.ofDays(365);

	private final RetryConfig config;

	private final InstantSource clock;

	private final DoubleSupplier random;

	public RetryPolicy(RetryConfig config) {
		this(config, InstantSource.system(), () -> ThreadLocalRandom.current().nextDouble());
	}

	/**
	 * Fully configurable policy.
	 * @param config retry settings
	 * @param clock time source used to interpret absolute reset times (mainly for
	 * testing)
	 * @param random source of jitter in {@code [0, 1)} (mainly for testing)
	 */
	public RetryPolicy(RetryConfig config, InstantSource clock, DoubleSupplier random) {
		this.config = config;
		this.clock = clock;
		this.random = random;
	}

	public RetryConfig getConfig() {
		return config;
	}

	/**
	 * Evaluate the outcome of an attempt.
	 * @param outcome what happened on the attempt
	 * @param attempt 1-based number of the attempt that produced {@code outcome}
	 * @param elapsed time since the first attempt started
	 * @return the decision
	 */
	public RetryDecision evaluate(AttemptOutcome outcome, int attempt, Duration elapsed) {
		GitHubResponse response = null;
		if (outcome instanceof AttemptOutcome.TransportFailure failure) {
			if (!failure.isRetryable()) {
				return new RetryDecision.GiveUp("request cannot be sent: " + failure.error().getMessage());
			}
		}
		else if (outcome instanceof AttemptOutcome.Response received) {
			response = received.response();
			if (response.statusCode() < 400) {
				return new RetryDecision.Success();
			}
			if (!isRetryable(response)) {
				return new RetryDecision.GiveUp("status " + response.statusCode() + " is not retryable");
			}
		}

		if (attempt > config.maxRetries()) {
			logger.debug("Retries exhausted after {} attempts", attempt);
			return new RetryDecision.GiveUp("retries exhausted after " + attempt + " attempts");
		}

		Duration wait = config.backoff(attempt, random);
		if (response != null) {
			Duration hint = serverRequestedWait(response);
			if (hint.compareTo(wait) > 0) {
				logger.debug("Server asked to wait {} instead of backoff {}", hint, wait);
				wait = hint;
			}
		}

		Duration totalWait = config.totalWait();
		if (totalWait != null && elapsed.plus(wait).compareTo(totalWait) > 0) {
			logger.debug("Waiting {} after {} would exceed the total retry budget of {}", wait, elapsed, totalWait);
			return new RetryDecision.GiveUp("waiting " + wait + " would exceed total retry wait of " + totalWait);
		}
		return new RetryDecision.Retry(wait);
	}

	private boolean isRetryable(GitHubResponse response) {
		int status = response.statusCode();
		if (status == 403) {
			if (response.header("Retry-After").isPresent()) {
				logger.debug("Server responded with 403 and Retry-After header");
				return true;
			}
			if (mentionsRateLimit(response.text())) {
				logger.debug("Server responded with 403 rate limit message");
				return true;
			}
		}
		return config.retryStatuses().contains(status);
	}

	/**
	 * The longest wait the response asks for, or zero when it carries no usable hint.
	 */
	Duration serverRequestedWait(GitHubResponse response) {
		Instant now = clock.instant();
		Duration wait = Duration.ZERO;

		Optional<Duration> retryAfter = response.header("Retry-After").flatMap(value -> parseRetryAfter(value, now));
		if (retryAfter.isPresent() && retryAfter.get().compareTo(wait) > 0) {
			wait = retryAfter.get();
		}

		OptionalLong remaining = RateLimitInfo.parseLong(response.headers(), "x-ratelimit-remaining");
		OptionalLong reset = RateLimitInfo.parseLong(response.headers(), "x-ratelimit-reset");
		if (remaining.isPresent() && remaining.getAsLong() == 0 && reset.isPresent()) {
			Duration untilReset = untilReset(reset.getAsLong(), now);
			if (untilReset.compareTo(wait) > 0) {
				logger.debug("Primary rate limit exceeded; waiting for reset at epoch {}", reset.getAsLong());
				wait = untilReset;
			}
		}
		return wait;
	}

	private static Duration untilReset(long epochSecond, Instant now) {
		if (epochSecond > MAX_EPOCH_SECOND || epochSecond < MIN_EPOCH_SECOND) {
			logger.debug("Ignoring out-of-range x-ratelimit-reset: {}", epochSecond);
			return Duration.ZERO;
		}
		Duration wait = Duration.between(now, Instant.ofEpochSecond(epochSecond));
		return wait.compareTo(MAX_SERVER_WAIT) > 0 ? MAX_SERVER_WAIT : wait;
	}

	static Optional<Duration> parseRetryAfter(String value, Instant now) {
		String trimmed = value.trim();
		if (DELTA_SECONDS.matcher(trimmed).matches()) {
			long seconds = Long.parseLong(trimmed);
			return Optional.of(seconds > MAX_SERVER_WAIT.getSeconds() ? MAX_SERVER_WAIT : Duration.ofSeconds(seconds));
		}
		try {
			Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
			Duration wait = Duration.between(now, at);
			return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
		}
		catch (DateTimeParseException e) {
			logger.debug("Ignoring malformed Retry-After header: {}", value);
			return Optional.empty();
		}
	}

	static boolean mentionsRateLimit(String body) {
		return body.toLowerCase(Locale.ROOT).contains("rate limit");
	}

}
