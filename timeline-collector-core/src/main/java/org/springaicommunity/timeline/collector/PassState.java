package org.springaicommunity.timeline.collector;

/**
 * States of a primary collection pass. {@link #DONE} and {@link #FAILED} are terminal.
 */
public enum PassState {

	INIT, FETCHING, EVALUATING, BACKOFF, DONE, FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}

}
