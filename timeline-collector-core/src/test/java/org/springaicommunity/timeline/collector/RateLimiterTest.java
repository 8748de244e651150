package org.springaicommunity.timeline.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RateLimiter}, driven by a virtual clock.
 */
@DisplayName("RateLimiter Tests")
class RateLimiterTest {

	private FakeTicker ticker;

	private CancellationToken cancellation;

	private CollectorContext context;

	@BeforeEach
	void setUp() {
		ticker = new FakeTicker();
		cancellation = new CancellationToken();
		context = new CollectorContext(new CollectorProperties(), ticker, cancellation, new Random(7));
	}

	private RateLimiter limiter(RateLimiterConfig config) {
		return new RateLimiter("test", config, context);
	}

	@Nested
	@DisplayName("Spacing Tests")
	class SpacingTest {

		@Test
		@DisplayName("Should not wait before the first call")
		void shouldNotWaitBeforeFirstCall() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ofSeconds(1), 10, Duration.ofMinutes(1)));

			limiter.acquire();

			assertThat(ticker.sleeps()).isEmpty();
			assertThat(limiter.requestCount()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should wait the full minimum delay between back-to-back calls")
		void shouldWaitMinimumDelay() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ofSeconds(1), 10, Duration.ofMinutes(1)));

			limiter.acquire();
			limiter.acquire();

			assertThat(ticker.sleeps()).containsExactly(Duration.ofSeconds(1));
		}

		@Test
		@DisplayName("Should only wait for the remainder of the minimum delay")
		void shouldWaitOnlyForRemainder() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ofSeconds(1), 10, Duration.ofMinutes(1)));

			limiter.acquire();
			ticker.advance(Duration.ofMillis(400));
			limiter.acquire();

			assertThat(ticker.sleeps()).containsExactly(Duration.ofMillis(600));
		}

		@Test
		@DisplayName("Should not wait when the caller was slower than the minimum delay")
		void shouldNotWaitWhenCallerIsSlow() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ofSeconds(1), 10, Duration.ofMinutes(1)));

			limiter.acquire();
			ticker.advance(Duration.ofSeconds(5));
			limiter.acquire();

			assertThat(ticker.sleeps()).isEmpty();
		}

		@Test
		@DisplayName("Should add bounded jitter on top of the spacing")
		void shouldAddBoundedJitter() {
			RateLimiter limiter = limiter(RateLimiterConfig.fallbackDefaults());

			limiter.acquire();
			ticker.sleeps().clear();
			for (int i = 0; i < 20; i++) {
				limiter.acquire();
			}

			assertThat(ticker.sleeps()).hasSize(20)
				.allSatisfy(wait -> assertThat(wait).isBetween(Duration.ofSeconds(3), Duration.ofSeconds(5)));
		}

	}

	@Nested
	@DisplayName("Window Budget Tests")
	class WindowBudgetTest {

		@Test
		@DisplayName("Should wait out the window plus buffer once the budget is used")
		void shouldWaitOutWindow() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ZERO, 3, Duration.ofMinutes(1)));

			limiter.acquire();
			limiter.acquire();
			limiter.acquire();
			assertThat(ticker.sleeps()).isEmpty();

			limiter.acquire();

			assertThat(ticker.sleeps()).containsExactly(Duration.ofSeconds(61));
			assertThat(limiter.requestCount()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should never allow more calls than the budget in any window")
		void shouldHonorBudgetInEveryWindow() {
			Duration window = Duration.ofMinutes(1);
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ofMillis(200), 5, window));
			List<Long> callTimes = new ArrayList<>();

			for (int i = 0; i < 40; i++) {
				limiter.acquire();
				callTimes.add(ticker.currentTimeMillis());
				ticker.advance(Duration.ofMillis(50));
			}

			for (long start : callTimes) {
				long inWindow = callTimes.stream().filter(t -> t >= start && t < start + window.toMillis()).count();
				assertThat(inWindow).isLessThanOrEqualTo(5);
			}
		}

		@Test
		@DisplayName("Should keep the budget across the boundary of two windows")
		void shouldHonorBudgetAcrossWindowBoundary() {
			Duration window = Duration.ofMinutes(1);
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ZERO, 5, window));
			List<Long> callTimes = new ArrayList<>();

			limiter.acquire();
			callTimes.add(ticker.currentTimeMillis());
			ticker.advance(Duration.ofSeconds(50));
			for (int i = 0; i < 4; i++) {
				limiter.acquire();
				callTimes.add(ticker.currentTimeMillis());
			}
			ticker.advance(Duration.ofSeconds(10));
			for (int i = 0; i < 5; i++) {
				limiter.acquire();
				callTimes.add(ticker.currentTimeMillis());
			}

			assertThat(ticker.sleeps()).containsExactly(Duration.ofSeconds(51));
			for (long start : callTimes) {
				long inWindow = callTimes.stream().filter(t -> t >= start && t < start + window.toMillis()).count();
				assertThat(inWindow).isLessThanOrEqualTo(5);
			}
		}

		@Test
		@DisplayName("Should report the spent budget until the oldest call leaves the window")
		void shouldReportRateLimited() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ZERO, 2, Duration.ofMinutes(1)));
			assertThat(limiter.isRateLimited()).isFalse();

			limiter.acquire();
			limiter.acquire();
			assertThat(limiter.isRateLimited()).isTrue();

			ticker.advance(Duration.ofMinutes(1));
			assertThat(limiter.isRateLimited()).isFalse();
		}

		@Test
		@DisplayName("Should start a fresh window when the previous one expired")
		void shouldStartFreshWindow() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ZERO, 2, Duration.ofMinutes(1)));

			limiter.acquire();
			limiter.acquire();
			ticker.advance(Duration.ofMinutes(2));
			limiter.acquire();

			assertThat(ticker.sleeps()).isEmpty();
			assertThat(limiter.requestCount()).isEqualTo(1);
		}

	}

	@Nested
	@DisplayName("Throttling Signal Tests")
	class ThrottlingSignalTest {

		@Test
		@DisplayName("Should wait a full window and reset the budget on a rate-limit signal")
		void shouldWaitFullWindow() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ZERO, 2, Duration.ofMinutes(15)));
			limiter.acquire();
			limiter.acquire();

			limiter.handleRateLimit();

			assertThat(ticker.sleeps()).containsExactly(Duration.ofMinutes(15));
			assertThat(limiter.isRateLimited()).isFalse();
			assertThat(limiter.requestCount()).isZero();
		}

		@Test
		@DisplayName("Should abort waiting when the run is cancelled")
		void shouldAbortWhenCancelled() {
			RateLimiter limiter = limiter(new RateLimiterConfig(Duration.ofSeconds(1), 10, Duration.ofMinutes(1)));
			limiter.acquire();
			cancellation.cancel("test");

			assertThatThrownBy(limiter::acquire).isInstanceOf(CollectionCancelledException.class);
			assertThat(ticker.sleeps()).isEmpty();
		}

	}

	@Test
	@DisplayName("Should reject invalid configuration")
	void shouldRejectInvalidConfiguration() {
		assertThatThrownBy(() -> new RateLimiterConfig(Duration.ofSeconds(-1), 1, Duration.ofMinutes(1)))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new RateLimiterConfig(Duration.ZERO, 0, Duration.ofMinutes(1)))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new RateLimiterConfig(Duration.ZERO, 1, Duration.ZERO))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
