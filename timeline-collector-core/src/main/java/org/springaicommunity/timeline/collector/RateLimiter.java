package org.springaicommunity.timeline.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Client-side pacing: a minimum delay between calls and a sliding-window call budget.
 *
 * <p>
 * Every call to {@link #acquire()} may suspend the caller through
 * {@link CollectorContext#pause(Duration)}, so waiting is cancellable. Instances are owned
 * by a single collector and are not thread-safe.
 *
 * <p>
 * The budget holds for every interval of {@code windowDuration}, not only for aligned
 * windows: the times of the last {@code maxRequestsPerWindow} calls are kept, and a call
 * is only allowed once the oldest of them has left the window.
 */
public class RateLimiter {

	private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

	private final String name;

	private final RateLimiterConfig config;

	private final CollectorContext context;

	private final Deque<Long> callTimes = new ArrayDeque<>();

	private long lastCallTime = -1;

	public RateLimiter(String name, RateLimiterConfig config, CollectorContext context) {
		this.name = name;
		this.config = config;
		this.context = context;
	}

	/**
	 * Block until the next call is allowed, then record the call.
	 * @throws CollectionCancelledException if the run is cancelled while waiting
	 */
	public void acquire() {
		if (isRateLimited()) {
			long remaining = callTimes.peekFirst() + config.windowDuration().toMillis() - context.now();
			Duration wait = Duration.ofMillis(Math.max(0, remaining)).plus(RateLimiterConfig.WINDOW_BUFFER);
			logger.info("[{}] Window budget of {} calls used, waiting {}ms", name, config.maxRequestsPerWindow(),
					wait.toMillis());
			context.pause(wait);
			evictExpired(context.now());
		}

		Duration spacing = Duration.ZERO;
		if (lastCallTime >= 0) {
			long sinceLast = context.now() - lastCallTime;
			spacing = Duration.ofMillis(Math.max(0, config.minDelay().toMillis() - sinceLast));
		}
		Duration delay = spacing.plus(context.jitter(config.jitter()));
		if (!delay.isZero()) {
			logger.debug("[{}] Pacing for {}ms", name, delay.toMillis());
			context.pause(delay);
		}

		lastCallTime = context.now();
		callTimes.addLast(lastCallTime);
	}

	/**
	 * React to an explicit throttling signal from the source: wait a full window and start
	 * over with a fresh budget.
	 */
	public void handleRateLimit() {
		logger.warn("[{}] Rate limited by source, waiting {}s", name, config.windowDuration().toSeconds());
		context.pause(config.windowDuration());
		callTimes.clear();
	}

	/**
	 * Whether the budget of the current window is spent.
	 * @return true when the next call would have to wait for the window to slide
	 */
	public boolean isRateLimited() {
		evictExpired(context.now());
		return callTimes.size() >= config.maxRequestsPerWindow();
	}

	/**
	 * Number of calls made within the last {@code windowDuration}.
	 * @return calls in the current window
	 */
	public int requestCount() {
		evictExpired(context.now());
		return callTimes.size();
	}

	public RateLimiterConfig config() {
		return config;
	}

	private void evictExpired(long now) {
		long window = config.windowDuration().toMillis();
		while (!callTimes.isEmpty() && now - callTimes.peekFirst() >= window) {
			callTimes.removeFirst();
		}
	}

}
