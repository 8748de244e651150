package org.springaicommunity.timeline.collector;

import java.time.Duration;

/**
 * Source of time and of suspension for every timed component. Production code uses
 * {@link #system()}; tests substitute a fake that advances a virtual clock.
 */
public interface Ticker {

	/**
	 * Current time in epoch milliseconds.
	 * @return current time
	 */
	long currentTimeMillis();

	/**
	 * Suspend the calling thread.
	 * @param duration how long to suspend
	 * @throws InterruptedException if the thread is interrupted while suspended
	 */
	void sleep(Duration duration) throws InterruptedException;

	static Ticker system() {
		return SystemTicker.INSTANCE;
	}

	/**
	 * Wall-clock ticker backed by {@link System#currentTimeMillis()} and
	 * {@link Thread#sleep(long)}.
	 */
	final class SystemTicker implements Ticker {

		private static final SystemTicker INSTANCE = new SystemTicker();

		private SystemTicker() {
		}

		@Override
		public long currentTimeMillis() {
			return System.currentTimeMillis();
		}

		@Override
		public void sleep(Duration duration) throws InterruptedException {
			if (!duration.isNegative() && !duration.isZero()) {
				Thread.sleep(duration.toMillis());
			}
		}

	}

}
