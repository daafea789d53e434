package org.springaicommunity.github.request;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Set;
import java.util.function.DoubleSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Retry and backoff settings for {@link RetryPolicy}.
 *
 * <p>
 * Defaults:
 * <ul>
 * <li>maxRetries: 10</li>
 * <li>backoffFactor: 1.0 second, backoffBase: 1.25, backoffJitter: 0</li>
 * <li>backoffMax: 120 seconds</li>
 * <li>totalWait: 300 seconds</li>
 * <li>retryStatuses: 500-599</li>
 * </ul>
 *
 * @param maxRetries number of attempts allowed after the first one
 * @param backoffFactor scale of the backoff curve, in seconds
 * @param backoffBase exponential growth rate of the backoff curve
 * @param backoffJitter upper bound, in seconds, of the random amount added to each
 * backoff
 * @param backoffMax cap on a single computed backoff
 * @param totalWait time budget for the whole retry sequence, measured from the first
 * attempt, or {@code null} for no budget
 * @param retryStatuses response statuses that are always retried
 */
public record RetryConfig(int maxRetries, double backoffFactor, double backoffBase, double backoffJitter,
		Duration backoffMax, @Nullable Duration totalWait, Set<Integer> retryStatuses) {

	public static final Set<Integer> SERVER_ERROR_STATUSES = IntStream.range(500, 600)
		.boxed()
		.collect(Collectors.toUnmodifiableSet());

	public RetryConfig {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative");
		}
		if (backoffFactor < 0 || backoffBase < 0 || backoffJitter < 0) {
			throw new IllegalArgumentException("backoff parameters must be non-negative");
		}
		if (backoffMax.isNegative()) {
			throw new IllegalArgumentException("backoffMax must be non-negative");
		}
		if (totalWait != null && totalWait.isNegative()) {
			throw new IllegalArgumentException("totalWait must be non-negative");
		}
		retryStatuses = Set.copyOf(retryStatuses);
	}

	public static RetryConfig defaults() {
		return builder().build();
	}

	/**
	 * A configuration that never retries.
	 */
	public static RetryConfig noRetries() {
		return builder().maxRetries(0).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder().maxRetries(maxRetries)
			.backoffFactor(backoffFactor)
			.backoffBase(backoffBase)
			.backoffJitter(backoffJitter)
			.backoffMax(backoffMax)
			.totalWait(totalWait)
			.retryStatuses(retryStatuses);
	}

	/**
	 * Compute the backoff before the retry that follows attempt number {@code attempt}
	 * (1-based).
	 *
	 * <p>
	 * The first retry waits a flat {@code backoffFactor * 0.1}; later ones follow
	 * {@code backoffFactor * backoffBase^(attempt - 1)} plus up to {@code backoffJitter}
	 * of random jitter, capped at {@code backoffMax}.
	 * @param attempt the attempt that just failed
	 * @param random source of uniformly distributed values in {@code [0, 1)}
	 * @return the wait before the next attempt
	 */
	public Duration backoff(int attempt, DoubleSupplier random) {
		double seconds;
		if (attempt < 2) {
			seconds = backoffFactor * 0.1;
		}
		else {
			seconds = backoffFactor * Math.pow(backoffBase, attempt - 1);
			if (backoffJitter > 0) {
				seconds += random.getAsDouble() * backoffJitter;
			}
			seconds = Math.min(seconds, backoffMax.toNanos() / 1e9);
		}
		return toDuration(seconds);
	}

	static Duration toDuration(double seconds) {
		if (!(seconds > 0)) {
			return Duration.ZERO;
		}
		return Duration.ofNanos(Math.round(seconds * 1e9));
	}

	/**
	 * Builder for {@link RetryConfig}.
	 */
	public static final class Builder {

		private int maxRetries = 10;

		private double backoffFactor = 1.0;

		private double backoffBase = 1.25;

		private double backoffJitter = 0.0;

		private Duration backoffMax = Duration.ofSeconds(120);

		private @Nullable Duration totalWait = Duration.ofSeconds(300);

		private Set<Integer> retryStatuses = SERVER_ERROR_STATUSES;

		private Builder() {
		}

		/**
		 * Set the maximum number of retries after the first attempt.
		 * @param maxRetries maximum retries (default: 10)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * @param backoffFactor backoff scale in seconds (default: 1.0)
		 * @return this builder
		 */
		public Builder backoffFactor(double backoffFactor) {
			this.backoffFactor = backoffFactor;
			return this;
		}

		/**
		 * @param backoffBase exponential base (default: 1.25)
		 * @return this builder
		 */
		public Builder backoffBase(double backoffBase) {
			this.backoffBase = backoffBase;
			return this;
		}

		/**
		 * @param backoffJitter maximum random seconds added to a backoff (default: 0)
		 * @return this builder
		 */
		public Builder backoffJitter(double backoffJitter) {
			this.backoffJitter = backoffJitter;
			return this;
		}

		/**
		 * @param backoffMax cap on a computed backoff (default: 120 seconds)
		 * @return this builder
		 */
		public Builder backoffMax(Duration backoffMax) {
			this.backoffMax = backoffMax;
			return this;
		}

		/**
		 * Set the overall retry budget. Pass {@code null} to retry without a time limit.
		 * @param totalWait retry budget (default: 300 seconds)
		 * @return this builder
		 */
		public Builder totalWait(@Nullable Duration totalWait) {
			this.totalWait = totalWait;
			return this;
		}

		/**
		 * @param retryStatuses statuses retried unconditionally (default: 500-599)
		 * @return this builder
		 */
		public Builder retryStatuses(Set<Integer> retryStatuses) {
			this.retryStatuses = retryStatuses;
			return this;
		}

		/**
		 * Build the RetryConfig.
		 * @return configured RetryConfig
		 * @throws IllegalArgumentException if any setting is negative
		 */
		public RetryConfig build() {
			return new RetryConfig(maxRetries, backoffFactor, backoffBase, backoffJitter, backoffMax, totalWait,
					retryStatuses);
		}

	}

}
