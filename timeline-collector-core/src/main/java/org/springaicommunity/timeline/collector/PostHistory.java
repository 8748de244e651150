package org.springaicommunity.timeline.collector;

import java.util.Set;

/**
 * Durable set of post ids that have already been collected for an account. The only
 * authority on "already collected" across runs.
 *
 * <p>
 * The set never shrinks while the process runs. Implementations must tolerate repeated
 * {@link #save()} calls.
 */
public interface PostHistory {

	boolean isKnown(String id);

	/**
	 * Add an id.
	 * @param id post id
	 * @return true if the id was not known before
	 */
	boolean add(String id);

	int size();

	/**
	 * Load the persisted ids, replacing nothing already added in this process. A missing
	 * or unreadable store yields an empty history.
	 */
	void load();

	/**
	 * Persist all ids together with the time of the save.
	 */
	void save();

	Set<String> ids();

}
