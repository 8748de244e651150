package org.springaicommunity.timeline.collector;

/**
 * Thrown at a suspension point once cancellation of the run has been requested.
 */
public class CollectionCancelledException extends RuntimeException {

	public CollectionCancelledException(String message) {
		super(message);
	}

}
