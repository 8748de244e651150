package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result of a collection run.
 *
 * <p>
 * {@code posts} holds the new posts of this run after filtering; {@code collectedCount}
 * counts them before filtering.
 *
 * @param account account handle
 * @param profile account profile as resolved at the start of the run
 * @param posts new posts of the run that passed the filter, in first-seen order
 * @param collectedCount new posts of the run before filtering
 * @param knownPosts size of the post history at the end of the run
 * @param statistics run statistics
 * @param outcome how the run ended
 * @param passes results of the primary passes that ran
 * @param fallback result of the fallback session
 * @param error message of the failure behind a partial outcome, if any
 */
public record CollectionResult(String account, AccountProfile profile, List<Post> posts, int collectedCount,
		int knownPosts, RunSummary statistics, RunOutcome outcome, List<PassResult> passes, FallbackResult fallback,
		@Nullable String error) {

	public CollectionResult {
		posts = List.copyOf(posts);
		passes = List.copyOf(passes);
	}

	/**
	 * Share of the expected post count present in the history.
	 * @return coverage between 0 and 1, or -1 when the expected count is unknown
	 */
	public double coverage() {
		if (!profile.hasExpectedCount()) {
			return -1;
		}
		return Math.min(1.0, (double) knownPosts / profile.expectedPostCount());
	}

}
