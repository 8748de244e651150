package org.springaicommunity.timeline.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single dedup filter of a run. Every collector offers its posts here; only this
 * class mutates the {@link PostHistory}.
 *
 * <p>
 * Posts are merged by id in first-seen order. A post already in the history from an
 * earlier run is never emitted again. Within the run, an anchored version of a post
 * replaces an unanchored one.
 */
public class PostDeduplicator {

	private static final Logger logger = LoggerFactory.getLogger(PostDeduplicator.class);

	private final PostHistory history;

	private final RunStatistics statistics;

	private final Map<String, Post> collected = new LinkedHashMap<>();

	public PostDeduplicator(PostHistory history, RunStatistics statistics) {
		this.history = history;
		this.statistics = statistics;
	}

	/**
	 * Offer a post.
	 * @param post the normalized post
	 * @param origin collection path that produced it
	 * @return true if the post was unknown to the history and has been added
	 */
	public boolean offer(Post post, PostOrigin origin) {
		Post existing = collected.get(post.id());
		if (existing != null) {
			if (!existing.isAnchored() && post.isAnchored()) {
				logger.debug("Replacing unanchored post {} with timestamped version", post.id());
				collected.put(post.id(), post);
				statistics.recordTimestamp(post);
			}
			return false;
		}
		if (history.isKnown(post.id())) {
			return false;
		}
		history.add(post.id());
		collected.put(post.id(), post);
		statistics.recordCollected(origin, post);
		return true;
	}

	public boolean isKnown(String id) {
		return collected.containsKey(id) || history.isKnown(id);
	}

	/**
	 * Posts collected in this run, in first-seen order.
	 * @return copy of the collected posts
	 */
	public List<Post> posts() {
		return new ArrayList<>(collected.values());
	}

	public int collectedCount() {
		return collected.size();
	}

	public PostHistory history() {
		return history;
	}

}
