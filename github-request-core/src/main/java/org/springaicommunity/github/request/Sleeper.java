package org.springaicommunity.github.request;

import java.time.Duration;

/**
 * Blocks the calling thread. Injected into {@link RequestDispatcher} so tests can observe
 * and skip backoff and mutation-delay sleeps.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper SYSTEM = duration -> {
		if (duration.getSeconds() >= Long.MAX_VALUE / 1000) {
			Thread.sleep(Long.MAX_VALUE);
		}
		else {
			Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
		}
	};

	void sleep(Duration duration) throws InterruptedException;

}
