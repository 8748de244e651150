package org.springaicommunity.timeline.collector;

/**
 * How a run ended.
 */
public enum RunOutcome {

	/**
	 * All passes ended normally.
	 */
	COMPLETED,

	/**
	 * A pass ended early after exhausting its retries, or the fallback failed, but posts
	 * were collected.
	 */
	PARTIAL,

	/**
	 * Cancellation was requested; collected posts were still handed to the sink.
	 */
	CANCELLED,

	/**
	 * A hard failure ended the run. Posts collected before it were handed to the sink and
	 * the failure was rethrown to the caller.
	 */
	FAILED

}
