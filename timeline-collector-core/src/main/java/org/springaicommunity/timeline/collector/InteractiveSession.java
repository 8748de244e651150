package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Low-throughput, interactive view of the source used by the {@link FallbackCollector}:
 * open a live query view, reveal more results and read what is currently visible.
 */
public interface InteractiveSession extends AutoCloseable {

	void authenticate(Credentials credentials);

	void navigateTo(String query);

	/**
	 * Ask the view for more results.
	 * @return false when the view reports it has nothing more to show
	 */
	boolean revealMore();

	List<JsonNode> extractVisible();

	@Override
	void close();

}
