package org.springaicommunity.timeline.collector;

/**
 * Collection path that first produced a post in the current run.
 */
public enum PostOrigin {

	TIMELINE, REPLIES, FALLBACK

}
