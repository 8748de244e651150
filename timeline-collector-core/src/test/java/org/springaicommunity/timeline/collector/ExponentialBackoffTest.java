package org.springaicommunity.timeline.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExponentialBackoff Tests")
class ExponentialBackoffTest {

	private CollectorContext context;

	@BeforeEach
	void setUp() {
		context = new CollectorContext(new CollectorProperties(), new FakeTicker(), new CancellationToken(),
				new Random(42));
	}

	@Test
	@DisplayName("Should double the delay until the cap without jitter")
	void shouldDoubleUntilCap() {
		ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 0, context);

		List<Long> delays = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			delays.add(backoff.nextDelay().toSeconds());
		}

		assertThat(delays).containsExactly(1L, 2L, 4L, 8L, 16L, 32L, 60L, 60L);
		assertThat(backoff.attempt()).isEqualTo(8);
	}

	@Test
	@DisplayName("Should never decrease and never exceed the cap with jitter")
	void shouldBeMonotonicWithJitter() {
		ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofMinutes(1), 1.0, context);

		Duration previous = Duration.ZERO;
		for (int attempt = 1; attempt <= 20; attempt++) {
			Duration delay = backoff.nextDelay();
			long floor = Math.min(1000L << Math.min(attempt - 1, 20), 60_000L);
			assertThat(delay).isGreaterThanOrEqualTo(previous)
				.isLessThanOrEqualTo(Duration.ofMinutes(1))
				.isGreaterThanOrEqualTo(Duration.ofMillis(floor));
			previous = delay;
		}
	}

	@Test
	@DisplayName("Should start over at the base delay after reset")
	void shouldResetToBase() {
		ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofMinutes(1), 0.25,
				context);
		backoff.nextDelay();
		backoff.nextDelay();
		backoff.nextDelay();

		backoff.reset();

		assertThat(backoff.attempt()).isZero();
		assertThat(backoff.nextDelay()).isBetween(Duration.ofSeconds(1), Duration.ofMillis(1250));
	}

	@Test
	@DisplayName("Should reject a cap below the base delay or an out-of-range jitter factor")
	void shouldRejectInvalidArguments() {
		assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(10), Duration.ofSeconds(1), 0, context))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ExponentialBackoff(Duration.ZERO, Duration.ofSeconds(1), 0, context))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 1.5, context))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
