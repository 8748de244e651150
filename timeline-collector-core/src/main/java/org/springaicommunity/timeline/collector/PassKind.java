package org.springaicommunity.timeline.collector;

/**
 * The two passes of the primary collector.
 */
public enum PassKind {

	/**
	 * The account's own paginated timeline.
	 */
	TIMELINE(PostOrigin.TIMELINE),

	/**
	 * Search for replies written by the account.
	 */
	REPLIES(PostOrigin.REPLIES);

	private final PostOrigin origin;

	PassKind(PostOrigin origin) {
		this.origin = origin;
	}

	public PostOrigin origin() {
		return origin;
	}

}
