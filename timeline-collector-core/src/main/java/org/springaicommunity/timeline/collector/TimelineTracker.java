package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Decides when a collection pass has stopped making forward progress.
 *
 * <p>
 * A pass is stuck when any of these holds:
 * <ul>
 * <li>{@code maxConsecutiveKnown} already-known posts were observed in a row</li>
 * <li>no new post arrived for {@code stallTimeout}</li>
 * <li>more than {@code maxRepeatedCursors} cursors were handed out twice</li>
 * </ul>
 * State is pass-local; call {@link #reset()} before starting another pass.
 */
public class TimelineTracker {

	private final int maxConsecutiveKnown;

	private final Duration stallTimeout;

	private final int maxRepeatedCursors;

	private final Ticker ticker;

	private final Set<String> seenIds = new HashSet<>();

	private final Set<String> cursorsSeen = new HashSet<>();

	@Nullable
	private Long oldestSeen;

	@Nullable
	private Long newestSeen;

	private int consecutiveKnownCount;

	private int repeatedCursorCount;

	private long lastProgressTime;

	public TimelineTracker(int maxConsecutiveKnown, Duration stallTimeout, int maxRepeatedCursors, Ticker ticker) {
		if (maxConsecutiveKnown <= 0) {
			throw new IllegalArgumentException("maxConsecutiveKnown must be positive");
		}
		this.maxConsecutiveKnown = maxConsecutiveKnown;
		this.stallTimeout = stallTimeout;
		this.maxRepeatedCursors = maxRepeatedCursors;
		this.ticker = ticker;
		this.lastProgressTime = ticker.currentTimeMillis();
	}

	public static TimelineTracker from(CollectorProperties properties, Ticker ticker) {
		return new TimelineTracker(properties.getMaxConsecutiveKnown(), properties.getStallTimeout(),
				properties.getMaxRepeatedCursors(), ticker);
	}

	/**
	 * Observe a post.
	 * @param post the post
	 * @return true if the id was not yet seen in this pass
	 */
	public boolean trackPost(Post post) {
		return trackPost(post, true);
	}

	/**
	 * Observe a post whose novelty has already been decided by the caller.
	 * @param post the post
	 * @param novel false when the post is already in the persistent history; such posts
	 * count as known even on their first sighting in this pass
	 * @return true if the id was not yet seen in this pass
	 */
	public boolean trackPost(Post post, boolean novel) {
		boolean newInPass = seenIds.add(post.id());
		if (newInPass && post.timestamp() != null) {
			long ts = post.timestamp();
			if (oldestSeen == null || ts < oldestSeen) {
				oldestSeen = ts;
			}
			if (newestSeen == null || ts > newestSeen) {
				newestSeen = ts;
			}
		}
		if (newInPass && novel) {
			consecutiveKnownCount = 0;
			lastProgressTime = ticker.currentTimeMillis();
		}
		else {
			consecutiveKnownCount++;
		}
		return newInPass;
	}

	/**
	 * Observe a pagination cursor.
	 * @param cursor the cursor returned by the source, may be null
	 * @return true if the cursor was returned before in this pass
	 */
	public boolean trackCursor(@Nullable String cursor) {
		if (cursor == null || cursor.isEmpty()) {
			return false;
		}
		if (!cursorsSeen.add(cursor)) {
			repeatedCursorCount++;
			return true;
		}
		return false;
	}

	public boolean isStuck() {
		return consecutiveKnownCount >= maxConsecutiveKnown || isStalled()
				|| repeatedCursorCount > maxRepeatedCursors;
	}

	/**
	 * Short description of the condition that made the pass stuck, for logging.
	 * @return reason, or "progressing" when not stuck
	 */
	public String stuckReason() {
		if (consecutiveKnownCount >= maxConsecutiveKnown) {
			return consecutiveKnownCount + " known posts in a row";
		}
		if (isStalled()) {
			return "no new post for " + stallTimeout.toSeconds() + "s";
		}
		if (repeatedCursorCount > maxRepeatedCursors) {
			return repeatedCursorCount + " repeated cursors";
		}
		return "progressing";
	}

	public void reset() {
		seenIds.clear();
		cursorsSeen.clear();
		oldestSeen = null;
		newestSeen = null;
		consecutiveKnownCount = 0;
		repeatedCursorCount = 0;
		lastProgressTime = ticker.currentTimeMillis();
	}

	public Progress progress() {
		return new Progress(oldestSeen != null ? Instant.ofEpochMilli(oldestSeen) : null,
				newestSeen != null ? Instant.ofEpochMilli(newestSeen) : null, seenIds.size());
	}

	public int consecutiveKnownCount() {
		return consecutiveKnownCount;
	}

	private boolean isStalled() {
		return ticker.currentTimeMillis() - lastProgressTime > stallTimeout.toMillis();
	}

	/**
	 * Snapshot of a pass.
	 *
	 * @param oldest oldest anchored post seen, or null
	 * @param newest newest anchored post seen, or null
	 * @param uniquePosts distinct ids seen in the pass
	 */
	public record Progress(@Nullable Instant oldest, @Nullable Instant newest, int uniquePosts) {
	}

}
