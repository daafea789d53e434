package org.springaicommunity.github.request;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MutationThrottle Tests")
class MutationThrottleTest {

	private static final Instant T0 = MutableClock.START;

	@Test
	@DisplayName("The first mutation should never wait")
	void firstMutationShouldNotWait() {
		MutationThrottle throttle = new MutationThrottle(Duration.ofSeconds(1));

		assertThat(throttle.reserve(true, T0)).isZero();
		assertThat(throttle.getLastMutation()).isEqualTo(T0);
	}

	@Test
	@DisplayName("Back-to-back mutations should be spaced by the delay")
	void backToBackMutationsShouldBeSpaced() {
		MutationThrottle throttle = new MutationThrottle(Duration.ofSeconds(1));

		throttle.reserve(true, T0);

		assertThat(throttle.reserve(true, T0.plusMillis(300))).isEqualTo(Duration.ofMillis(700));
		assertThat(throttle.getLastMutation()).isEqualTo(T0.plusSeconds(1));
	}

	@Test
	@DisplayName("Mutations after the delay has passed should not wait")
	void laterMutationsShouldNotWait() {
		MutationThrottle throttle = new MutationThrottle(Duration.ofSeconds(1));

		throttle.reserve(true, T0);

		assertThat(throttle.reserve(true, T0.plusSeconds(5))).isZero();
		assertThat(throttle.getLastMutation()).isEqualTo(T0.plusSeconds(5));
	}

	@Test
	@DisplayName("Reservations made at the same instant should queue up")
	void simultaneousReservationsShouldQueue() {
		MutationThrottle throttle = new MutationThrottle(Duration.ofSeconds(1));

		assertThat(throttle.reserve(true, T0)).isZero();
		assertThat(throttle.reserve(true, T0)).isEqualTo(Duration.ofSeconds(1));
		assertThat(throttle.reserve(true, T0)).isEqualTo(Duration.ofSeconds(2));
	}

	@Test
	@DisplayName("Reads should neither wait nor consume a slot")
	void readsShouldBeUnaffected() {
		MutationThrottle throttle = new MutationThrottle(Duration.ofSeconds(1));

		assertThat(throttle.reserve(false, T0)).isZero();
		assertThat(throttle.getLastMutation()).isNull();

		throttle.reserve(true, T0);
		assertThat(throttle.reserve(false, T0)).isZero();
		assertThat(throttle.getLastMutation()).isEqualTo(T0);
	}

	@Test
	@DisplayName("A zero delay should never wait")
	void zeroDelayShouldNeverWait() {
		MutationThrottle throttle = new MutationThrottle(Duration.ZERO);

		assertThat(throttle.reserve(true, T0)).isZero();
		assertThat(throttle.reserve(true, T0)).isZero();
	}

	@Test
	@DisplayName("Should reject a negative delay")
	void shouldRejectNegativeDelay() {
		assertThatThrownBy(() -> new MutationThrottle(Duration.ofMillis(-1)))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Concurrent reservations should each get a distinct slot")
	void concurrentReservationsShouldGetDistinctSlots() throws Exception {
		MutationThrottle throttle = new MutationThrottle(Duration.ofSeconds(1));
		int threads = 8;
		CountDownLatch start = new CountDownLatch(1);
		List<Duration> waits = Collections.synchronizedList(new ArrayList<>());
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int i = 0; i < threads; i++) {
				futures.add(executor.submit(() -> {
					start.await();
					waits.add(throttle.reserve(true, T0));
					return null;
				}));
			}
			start.countDown();
			for (Future<?> future : futures) {
				future.get(10, TimeUnit.SECONDS);
			}
		}
		finally {
			executor.shutdownNow();
		}

		assertThat(waits).extracting(Duration::toSeconds)
			.containsExactlyInAnyOrder(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L);
	}

}
