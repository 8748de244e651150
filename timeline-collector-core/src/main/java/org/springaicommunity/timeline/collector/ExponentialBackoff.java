package org.springaicommunity.timeline.collector;

import java.time.Duration;

/**
 * Retry delay sequence {@code base * 2^(attempt-1)}, jittered and capped.
 *
 * <p>
 * Jitter is added as a fraction of the un-jittered delay before capping, so delays never
 * decrease from one attempt to the next. {@link #reset()} returns to the base delay after
 * a successful call.
 */
public class ExponentialBackoff {

	private final Duration base;

	private final Duration cap;

	private final double jitterFactor;

	private final CollectorContext context;

	private int attempt;

	public ExponentialBackoff(Duration base, Duration cap, double jitterFactor, CollectorContext context) {
		if (base.isNegative() || base.isZero()) {
			throw new IllegalArgumentException("base delay must be positive");
		}
		if (cap.compareTo(base) < 0) {
			throw new IllegalArgumentException("cap must not be smaller than base delay");
		}
		if (jitterFactor < 0 || jitterFactor > 1) {
			throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
		}
		this.base = base;
		this.cap = cap;
		this.jitterFactor = jitterFactor;
		this.context = context;
	}

	/**
	 * Advance to the next attempt and return its delay.
	 * @return delay before the next retry
	 */
	public Duration nextDelay() {
		attempt++;
		long baseMs = base.toMillis();
		long delay = baseMs;
		for (int i = 1; i < attempt && delay < cap.toMillis(); i++) {
			delay *= 2;
		}
		long jitter = (long) (delay * jitterFactor * context.nextFraction());
		return Duration.ofMillis(Math.min(delay + jitter, cap.toMillis()));
	}

	public int attempt() {
		return attempt;
	}

	public void reset() {
		attempt = 0;
	}

}
