package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable counters of a single run. Owned by the {@link CollectorContext} and updated on
 * the collection thread only.
 */
public class RunStatistics {

	private final long startTime;

	private long requests;

	private int rateLimitHits;

	private int retries;

	private int parseErrors;

	private int timelinePosts;

	private int replyPosts;

	private int fallbackPosts;

	@Nullable
	private Long oldestPost;

	@Nullable
	private Long newestPost;

	public RunStatistics(long startTime) {
		this.startTime = startTime;
	}

	public void recordRequest() {
		requests++;
	}

	public void recordRateLimitHit() {
		rateLimitHits++;
	}

	public void recordRetry() {
		retries++;
	}

	public void recordParseError() {
		parseErrors++;
	}

	/**
	 * Count a post that is new to the history.
	 * @param origin collection path that produced it
	 * @param post the post
	 */
	public void recordCollected(PostOrigin origin, Post post) {
		switch (origin) {
			case TIMELINE -> timelinePosts++;
			case REPLIES -> replyPosts++;
			case FALLBACK -> fallbackPosts++;
		}
		recordTimestamp(post);
	}

	/**
	 * Widen the anchored date range with the post's timestamp.
	 * @param post the post
	 */
	public void recordTimestamp(Post post) {
		Long ts = post.timestamp();
		if (ts == null) {
			return;
		}
		if (oldestPost == null || ts < oldestPost) {
			oldestPost = ts;
		}
		if (newestPost == null || ts > newestPost) {
			newestPost = ts;
		}
	}

	public long getRequests() {
		return requests;
	}

	public int getRateLimitHits() {
		return rateLimitHits;
	}

	public int getRetries() {
		return retries;
	}

	public int getParseErrors() {
		return parseErrors;
	}

	public int getTimelinePosts() {
		return timelinePosts;
	}

	public int getReplyPosts() {
		return replyPosts;
	}

	public int getFallbackPosts() {
		return fallbackPosts;
	}

	public int getPrimaryPosts() {
		return timelinePosts + replyPosts;
	}

	public int getTotalPosts() {
		return timelinePosts + replyPosts + fallbackPosts;
	}

	public long getStartTime() {
		return startTime;
	}

	public RunSummary toSummary(long now) {
		return new RunSummary(requests, rateLimitHits, retries, parseErrors, timelinePosts, replyPosts, fallbackPosts,
				oldestPost != null ? Instant.ofEpochMilli(oldestPost) : null,
				newestPost != null ? Instant.ofEpochMilli(newestPost) : null, Instant.ofEpochMilli(startTime),
				Duration.ofMillis(Math.max(0, now - startTime)));
	}

}
