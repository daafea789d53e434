package org.springaicommunity.github.request;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Spaces out mutating requests (POST, PATCH, PUT, DELETE) made through one client.
 *
 * <p>
 * GitHub recommends waiting at least one second between mutating requests to stay clear
 * of its secondary rate limits. Each call to {@link #reserve} claims the next free send
 * slot, at least {@code mutationDelay} after the previously claimed one, and returns how
 * long the caller has to sleep before sending. Slots are claimed under the throttle's
 * monitor, so threads sharing a client never send two mutations closer together than the
 * delay.
 */
public class MutationThrottle {

	private final Duration mutationDelay;

	private @Nullable Instant lastMutation;

	public MutationThrottle(Duration mutationDelay) {
		if (mutationDelay.isNegative()) {
			throw new IllegalArgumentException("mutationDelay must be non-negative");
		}
		this.mutationDelay = mutationDelay;
	}

	public Duration getMutationDelay() {
		return mutationDelay;
	}

	/**
	 * Claim a send slot.
	 * @param mutating whether the request about to be sent is mutating; non-mutating
	 * requests are never delayed and do not touch the throttle
	 * @param now the current time
	 * @return how long to sleep before sending, zero if the request may go immediately
	 */
	public synchronized Duration reserve(boolean mutating, Instant now) {
		if (!mutating) {
			return Duration.ZERO;
		}
		Instant slot = now;
		if (lastMutation != null) {
			Instant earliest = lastMutation.plus(mutationDelay);
			if (earliest.isAfter(now)) {
				slot = earliest;
			}
		}
		lastMutation = slot;
		return Duration.between(now, slot);
	}

	/**
	 * Time at which the most recent mutating request was (or is scheduled to be) sent.
	 */
	public synchronized @Nullable Instant getLastMutation() {
		return lastMutation;
	}

}
