package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a fallback session.
 *
 * @param passes extraction passes performed
 * @param newPosts posts unknown to the history before the session
 * @param stopReason why the session ended
 * @param error message of the failure that ended the session, if any
 */
public record FallbackResult(int passes, int newPosts, StopReason stopReason, @Nullable String error) {

	public static FallbackResult skipped() {
		return new FallbackResult(0, 0, StopReason.SKIPPED, null);
	}

	public boolean failed() {
		return stopReason == StopReason.FAILED;
	}

	/**
	 * Why a fallback session ended.
	 */
	public enum StopReason {

		/**
		 * The fallback path was not needed or not enabled.
		 */
		SKIPPED,

		/**
		 * Consecutive extractions yielded nothing unseen.
		 */
		STAGNATED,

		/**
		 * The hard session-duration cap was reached.
		 */
		SESSION_CAP,

		/**
		 * The view had nothing more to reveal.
		 */
		EXHAUSTED,

		/**
		 * The per-run post cap was reached.
		 */
		MAX_POSTS,

		/**
		 * The session failed; primary results stand.
		 */
		FAILED

	}

}
