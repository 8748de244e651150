package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Advisory snapshot of a run, written at batch checkpoints, at the end of a run and on
 * failure.
 *
 * @param account account handle
 * @param phase phase the run was in ({@code TIMELINE}, {@code REPLIES}, {@code FALLBACK}
 * or {@code FINISHED})
 * @param cursor position of the timeline pass when the snapshot was taken
 * @param collectedPosts new posts collected by the run so far
 * @param knownPosts size of the post history
 * @param statistics run statistics at the time of the snapshot
 * @param timestamp when the snapshot was taken
 * @param completed whether the run finished
 * @param lastError message of the failure that ended the run, if any
 */
public record ProgressCheckpoint(String account, String phase, @Nullable String cursor, int collectedPosts,
		int knownPosts, RunSummary statistics, Instant timestamp, boolean completed, @Nullable String lastError) {

	public static final String PHASE_FINISHED = "FINISHED";

	public static final String PHASE_FALLBACK = "FALLBACK";

	/**
	 * Whether the snapshot is older than {@code maxAge}.
	 * @param now current time
	 * @param maxAge maximum age
	 * @return true when the snapshot should be ignored
	 */
	public boolean isStale(Instant now, Duration maxAge) {
		return Duration.between(timestamp, now).compareTo(maxAge) > 0;
	}

	/**
	 * Whether a new run can continue the timeline pass from {@link #cursor()}.
	 * @return true for an unfinished timeline snapshot with a cursor
	 */
	public boolean canResumeTimeline() {
		return !completed && PassKind.TIMELINE.name().equals(phase) && cursor != null;
	}

}
