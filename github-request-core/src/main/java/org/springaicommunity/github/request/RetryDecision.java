package org.springaicommunity.github.request;

import java.time.Duration;

/**
 * What {@link RetryPolicy} decided after an attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp, RetryDecision.Success {

	/**
	 * Sleep for {@code delay}, then send the request again.
	 */
	record Retry(Duration delay) implements RetryDecision {

		public Retry {
			if (delay.isNegative()) {
				throw new IllegalArgumentException("delay must not be negative");
			}
		}

	}

	/**
	 * Stop and surface the last outcome to the caller.
	 */
	record GiveUp(String reason) implements RetryDecision {
	}

	/**
	 * The attempt succeeded.
	 */
	record Success() implements RetryDecision {
	}

}
