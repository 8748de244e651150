package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders for raw records and normalized posts used across tests.
 */
final class TestPosts {

	static final ObjectMapper MAPPER = new ObjectMapper();

	/** 2024-01-01T00:00:00Z in epoch seconds. */
	static final long BASE_SECONDS = 1_704_067_200L;

	private TestPosts() {
	}

	/**
	 * Scraper-shaped record with a timestamp in epoch seconds.
	 */
	static ObjectNode raw(String id, long timestampSeconds) {
		ObjectNode node = MAPPER.createObjectNode();
		node.put("id", id);
		node.put("text", "post " + id);
		node.put("timestamp", timestampSeconds);
		node.put("likes", 1);
		node.put("retweets", 0);
		node.put("replies", 0);
		node.put("username", "someone");
		return node;
	}

	/**
	 * A timeline of {@code count} records, newest first, ids {@code p<count>} down to
	 * {@code p1}.
	 */
	static List<JsonNode> timeline(int count) {
		return timeline("p", count);
	}

	static List<JsonNode> timeline(String prefix, int count) {
		List<JsonNode> items = new ArrayList<>();
		for (int i = count; i >= 1; i--) {
			items.add(raw(prefix + i, BASE_SECONDS + i * 60L));
		}
		return items;
	}

	static Post post(String id, @Nullable Long timestamp) {
		return new Post(id, "post " + id, timestamp, Engagement.NONE, false, false, List.of(),
				PostNormalizer.defaultPermalink("someone", id), "someone", null, null, List.of(), List.of());
	}

	static Post post(String id) {
		return post(id, BASE_SECONDS * 1000);
	}

}
