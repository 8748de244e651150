package org.springaicommunity.timeline.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * Per-run context handed explicitly to every component: configuration, time source,
 * cancellation, randomness for jitter and the run's statistics.
 *
 * <p>
 * {@link #pause(Duration)} is the single suspension point of the engine. It checks for
 * cancellation before and after suspending and turns thread interruption into
 * cancellation.
 */
public final class CollectorContext {

	private static final Logger logger = LoggerFactory.getLogger(CollectorContext.class);

	private final CollectorProperties properties;

	private final Ticker ticker;

	private final CancellationToken cancellation;

	private final Random random;

	private final RunStatistics statistics;

	public CollectorContext(CollectorProperties properties, Ticker ticker, CancellationToken cancellation,
			Random random) {
		this.properties = properties;
		this.ticker = ticker;
		this.cancellation = cancellation;
		this.random = random;
		this.statistics = new RunStatistics(ticker.currentTimeMillis());
	}

	public CollectorProperties properties() {
		return properties;
	}

	public Ticker ticker() {
		return ticker;
	}

	public CancellationToken cancellation() {
		return cancellation;
	}

	public RunStatistics statistics() {
		return statistics;
	}

	public long now() {
		return ticker.currentTimeMillis();
	}

	public void throwIfCancelled() {
		cancellation.throwIfCancelled();
	}

	/**
	 * Suspend the run cooperatively.
	 * @param duration how long to suspend; zero or negative returns after the
	 * cancellation check
	 * @throws CollectionCancelledException if cancellation is requested before or during
	 * the suspension
	 */
	public void pause(Duration duration) {
		cancellation.throwIfCancelled();
		if (duration.isNegative() || duration.isZero()) {
			return;
		}
		try {
			ticker.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while paused for {}ms, cancelling run", duration.toMillis());
			cancellation.cancel("interrupted");
		}
		cancellation.throwIfCancelled();
	}

	/**
	 * Random extra delay in {@code [0, max]}.
	 * @param max upper bound of the jitter
	 * @return jitter duration
	 */
	public Duration jitter(Duration max) {
		long maxMs = max.toMillis();
		if (maxMs <= 0) {
			return Duration.ZERO;
		}
		return Duration.ofMillis((long) (random.nextDouble() * (maxMs + 1)));
	}

	/**
	 * Uniform random fraction in {@code [0, 1)}.
	 * @return the fraction
	 */
	public double nextFraction() {
		return random.nextDouble();
	}

}
