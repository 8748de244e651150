package org.springaicommunity.timeline.collector;

import java.time.Duration;

/**
 * Immutable pacing configuration for a {@link RateLimiter}.
 *
 * @param minDelay minimum spacing between two consecutive calls
 * @param maxRequestsPerWindow call budget per window
 * @param windowDuration length of the budget window
 * @param jitter upper bound of the random delay added to every spacing wait
 */
public record RateLimiterConfig(Duration minDelay, int maxRequestsPerWindow, Duration windowDuration,
		Duration jitter) {

	/**
	 * Safety margin added when waiting out an exhausted window.
	 */
	public static final Duration WINDOW_BUFFER = Duration.ofSeconds(1);

	public RateLimiterConfig {
		if (minDelay.isNegative()) {
			throw new IllegalArgumentException("minDelay must not be negative");
		}
		if (maxRequestsPerWindow <= 0) {
			throw new IllegalArgumentException("maxRequestsPerWindow must be positive");
		}
		if (windowDuration.isNegative() || windowDuration.isZero()) {
			throw new IllegalArgumentException("windowDuration must be positive");
		}
		if (jitter.isNegative()) {
			throw new IllegalArgumentException("jitter must not be negative");
		}
	}

	public RateLimiterConfig(Duration minDelay, int maxRequestsPerWindow, Duration windowDuration) {
		this(minDelay, maxRequestsPerWindow, windowDuration, Duration.ZERO);
	}

	/**
	 * Primary pacing: one call per second, 150 calls per 15 minute window.
	 * @return default primary configuration
	 */
	public static RateLimiterConfig primaryDefaults() {
		return new RateLimiterConfig(Duration.ofSeconds(1), 150, Duration.ofMinutes(15));
	}

	/**
	 * Fallback pacing: slower, with up to two seconds of random jitter.
	 * @return default fallback configuration
	 */
	public static RateLimiterConfig fallbackDefaults() {
		return new RateLimiterConfig(Duration.ofSeconds(3), 60, Duration.ofMinutes(15), Duration.ofSeconds(2));
	}

}
