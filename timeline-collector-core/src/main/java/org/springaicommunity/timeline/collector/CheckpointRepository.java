package org.springaicommunity.timeline.collector;

import java.util.Optional;

/**
 * Storage of the per-account {@link ProgressCheckpoint}.
 */
public interface CheckpointRepository {

	/**
	 * Load the last checkpoint of an account.
	 * @param account account handle
	 * @return the checkpoint, or empty when none exists or it cannot be read
	 */
	Optional<ProgressCheckpoint> load(String account);

	void save(ProgressCheckpoint checkpoint);

}
