package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of {@link RunStatistics}, reported at the end of a run and embedded
 * in the progress checkpoint.
 *
 * @param requests source requests issued
 * @param rateLimitHits explicit throttling signals received
 * @param retries retries after transient failures
 * @param parseErrors raw records skipped as unparseable
 * @param timelinePosts new posts from the timeline pass
 * @param replyPosts new posts from the reply pass
 * @param fallbackPosts new posts from the fallback path
 * @param oldestPost oldest anchored post collected
 * @param newestPost newest anchored post collected
 * @param startedAt start of the run
 * @param runtime elapsed time of the run
 */
public record RunSummary(long requests, int rateLimitHits, int retries, int parseErrors, int timelinePosts,
		int replyPosts, int fallbackPosts, @Nullable Instant oldestPost, @Nullable Instant newestPost,
		Instant startedAt, Duration runtime) {

	public int totalCollected() {
		return timelinePosts + replyPosts + fallbackPosts;
	}

	/**
	 * Collection rate over the whole run.
	 * @return new posts per minute, 0 for runs shorter than a millisecond
	 */
	public double postsPerMinute() {
		long millis = runtime.toMillis();
		if (millis <= 0) {
			return 0;
		}
		return totalCollected() * 60_000.0 / millis;
	}

}
