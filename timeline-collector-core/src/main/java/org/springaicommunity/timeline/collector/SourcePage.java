package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One batch of raw records returned by a {@link PostSource}.
 *
 * @param items raw records in the order the source returned them
 * @param nextCursor the source's own continuation token, or null when it reports no
 * further page
 */
public record SourcePage(List<JsonNode> items, @Nullable String nextCursor) {

	public SourcePage {
		items = List.copyOf(items);
	}

	public static SourcePage empty() {
		return new SourcePage(List.of(), null);
	}

	public boolean isEmpty() {
		return items.isEmpty();
	}

}
