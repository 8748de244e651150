package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one primary pass.
 *
 * @param kind which pass ran
 * @param finalState {@link PassState#DONE} or {@link PassState#FAILED}
 * @param stopReason why the pass ended
 * @param batches number of batches evaluated
 * @param recordsSeen raw records evaluated, including duplicates and parse failures
 * @param newPosts posts unknown to the history before this pass
 * @param lastCursor cursor the pass would continue from
 * @param lastError message of the failure that ended the pass, if any
 */
public record PassResult(PassKind kind, PassState finalState, StopReason stopReason, int batches, int recordsSeen,
		int newPosts, @Nullable String lastCursor, @Nullable String lastError) {

	public boolean escalationRequested() {
		return stopReason == StopReason.RATE_LIMITED;
	}

	public boolean failed() {
		return finalState == PassState.FAILED;
	}

	/**
	 * Why a pass stopped.
	 */
	public enum StopReason {

		/**
		 * Empty batch, or the source reported no further page.
		 */
		EXHAUSTED,

		/**
		 * The tracker reported no forward progress.
		 */
		STAGNATED,

		/**
		 * The per-run post cap was reached.
		 */
		MAX_POSTS,

		/**
		 * Rate-limit hits crossed the escalation threshold.
		 */
		RATE_LIMITED,

		/**
		 * Consecutive transient failures exceeded the retry budget.
		 */
		RETRIES_EXHAUSTED

	}

}
