package org.springaicommunity.timeline.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link PostFilterCriteria} to collected posts. Unanchored posts never match a
 * date range.
 */
public class PostFilter {

	private static final Logger logger = LoggerFactory.getLogger(PostFilter.class);

	private final PostFilterCriteria criteria;

	public PostFilter(PostFilterCriteria criteria) {
		this.criteria = criteria;
	}

	public boolean matches(Post post) {
		if (criteria.isUnfiltered()) {
			return true;
		}
		if (!criteria.postTypes().contains(PostFilterCriteria.PostType.of(post))) {
			return false;
		}
		if (post.engagement().likes() < criteria.minLikes() || post.engagement().reposts() < criteria.minReposts()) {
			return false;
		}
		if (criteria.hasDateRange() && !withinDateRange(post)) {
			return false;
		}
		if (!criteria.excludedKeywords().isEmpty()) {
			String text = post.text().toLowerCase(Locale.ROOT);
			for (String keyword : criteria.excludedKeywords()) {
				if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
					return false;
				}
			}
		}
		return true;
	}

	public List<Post> apply(List<Post> posts) {
		if (criteria.isUnfiltered()) {
			return posts;
		}
		List<Post> kept = posts.stream().filter(this::matches).toList();
		logger.info("Filter kept {} of {} posts", kept.size(), posts.size());
		return kept;
	}

	public PostFilterCriteria criteria() {
		return criteria;
	}

	private boolean withinDateRange(Post post) {
		Instant created = post.createdAt();
		if (created == null) {
			return false;
		}
		if (criteria.startDate() != null
				&& created.isBefore(criteria.startDate().atStartOfDay(ZoneOffset.UTC).toInstant())) {
			return false;
		}
		return criteria.endDate() == null
				|| created.isBefore(criteria.endDate().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant());
	}

}
