package org.springaicommunity.timeline.collector;

/**
 * Classification of collection failures. Callers branch on the kind rather than on the
 * exception type.
 */
public enum ErrorKind {

	/**
	 * Login rejected or session lost. Fatal; aborts the run before collection.
	 */
	AUTHENTICATION(false, true),

	/**
	 * The source explicitly signalled throttling. Recovered by waiting out the window.
	 */
	RATE_LIMIT(true, false),

	/**
	 * Network failure or server error. Retried with exponential backoff.
	 */
	TRANSIENT_NETWORK(true, false),

	/**
	 * A single raw record could not be normalized. The record is skipped.
	 */
	RECORD_PARSE(false, false),

	/**
	 * The fallback path failed. Primary results stand.
	 */
	FALLBACK(false, false),

	/**
	 * Missing credentials, unknown account or a request the source refuses outright.
	 */
	CONFIGURATION(false, true);

	private final boolean retryable;

	private final boolean fatal;

	ErrorKind(boolean retryable, boolean fatal) {
		this.retryable = retryable;
		this.fatal = fatal;
	}

	public boolean isRetryable() {
		return retryable;
	}

	public boolean isFatal() {
		return fatal;
	}

}
