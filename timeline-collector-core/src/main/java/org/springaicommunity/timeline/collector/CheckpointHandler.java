package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

/**
 * Callback invoked by a collector every {@code checkpointInterval} batches so the owner
 * can persist history and progress.
 */
@FunctionalInterface
public interface CheckpointHandler {

	CheckpointHandler NONE = (kind, cursor, batches) -> {
	};

	void onCheckpoint(PassKind kind, @Nullable String cursor, int batches);

}
