package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

/**
 * Cooperative cancellation flag shared between the operator (a shutdown hook, a test)
 * and the collection thread. Cancellation is observed at the next suspension point.
 */
public final class CancellationToken {

	private volatile boolean cancelled;

	@Nullable
	private volatile String reason;

	public void cancel(String reason) {
		this.reason = reason;
		this.cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	@Nullable
	public String reason() {
		return reason;
	}

	/**
	 * Throws if cancellation has been requested.
	 * @throws CollectionCancelledException when cancelled
	 */
	public void throwIfCancelled() {
		if (cancelled) {
			throw new CollectionCancelledException(
					"Collection cancelled" + (reason != null ? ": " + reason : ""));
		}
	}

}
