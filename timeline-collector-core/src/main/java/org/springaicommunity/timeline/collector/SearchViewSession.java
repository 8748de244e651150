package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link InteractiveSession} that emulates a live search view on top of a
 * {@link PostSource}: the view shows one page of the live query at a time and
 * {@link #revealMore()} scrolls to the next page.
 */
public class SearchViewSession implements InteractiveSession {

	private static final Logger logger = LoggerFactory.getLogger(SearchViewSession.class);

	private final PostSource source;

	private final int pageSize;

	@Nullable
	private String query;

	@Nullable
	private String nextCursor;

	private List<JsonNode> visible = List.of();

	private boolean loaded;

	public SearchViewSession(PostSource source, int pageSize) {
		this.source = source;
		this.pageSize = pageSize;
	}

	@Override
	public void authenticate(Credentials credentials) {
		source.authenticate(credentials);
	}

	@Override
	public void navigateTo(String query) {
		logger.debug("Opening live view for '{}'", query);
		this.query = query;
		this.nextCursor = null;
		this.visible = List.of();
		this.loaded = false;
	}

	@Override
	public boolean revealMore() {
		String current = requireQuery();
		if (loaded && nextCursor == null) {
			return false;
		}
		SourcePage page = source.searchPosts(current, pageSize, nextCursor);
		visible = page.items();
		nextCursor = page.nextCursor();
		loaded = true;
		return !page.isEmpty();
	}

	@Override
	public List<JsonNode> extractVisible() {
		if (!loaded) {
			revealMore();
		}
		return visible;
	}

	@Override
	public void close() {
		source.deauthenticate();
	}

	private String requireQuery() {
		String current = query;
		if (current == null) {
			throw new IllegalStateException("navigateTo must be called before revealing results");
		}
		return current;
	}

}
