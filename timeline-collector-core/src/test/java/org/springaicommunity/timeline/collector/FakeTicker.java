package org.springaicommunity.timeline.collector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Virtual clock for tests: {@link #sleep(Duration)} returns immediately after advancing
 * the clock and recording the requested duration.
 */
class FakeTicker implements Ticker {

	static final long START = 1_700_000_000_000L;

	private long now;

	private final List<Duration> sleeps = new ArrayList<>();

	FakeTicker() {
		this(START);
	}

	FakeTicker(long start) {
		this.now = start;
	}

	@Override
	public long currentTimeMillis() {
		return now;
	}

	@Override
	public void sleep(Duration duration) throws InterruptedException {
		sleeps.add(duration);
		now += duration.toMillis();
	}

	void advance(Duration duration) {
		now += duration.toMillis();
	}

	List<Duration> sleeps() {
		return sleeps;
	}

	Duration totalSlept() {
		return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
	}

}
