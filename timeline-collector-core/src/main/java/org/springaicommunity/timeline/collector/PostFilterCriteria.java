package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Selection applied to the collected posts before they reach the sink.
 *
 * @param postTypes kinds of posts to keep
 * @param minLikes minimum number of likes
 * @param minReposts minimum number of reposts
 * @param startDate first day (UTC) to keep, inclusive, or null for no lower bound
 * @param endDate last day (UTC) to keep, inclusive, or null for no upper bound
 * @param excludedKeywords posts whose text contains any of these (ignoring case) are
 * dropped
 */
public record PostFilterCriteria(Set<PostType> postTypes, int minLikes, int minReposts,
		@Nullable LocalDate startDate, @Nullable LocalDate endDate, List<String> excludedKeywords) {

	public PostFilterCriteria {
		postTypes = Set.copyOf(postTypes);
		excludedKeywords = List.copyOf(excludedKeywords);
		if (minLikes < 0 || minReposts < 0) {
			throw new IllegalArgumentException("Engagement minimums must not be negative");
		}
		if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
			throw new IllegalArgumentException("End date " + endDate + " is before start date " + startDate);
		}
	}

	/**
	 * Criteria that keep every post.
	 * @return unfiltered criteria
	 */
	public static PostFilterCriteria all() {
		return new PostFilterCriteria(EnumSet.allOf(PostType.class), 0, 0, null, null, List.of());
	}

	public boolean hasDateRange() {
		return startDate != null || endDate != null;
	}

	public boolean isUnfiltered() {
		return postTypes.containsAll(EnumSet.allOf(PostType.class)) && minLikes == 0 && minReposts == 0
				&& !hasDateRange() && excludedKeywords.isEmpty();
	}

	/**
	 * Post kinds selectable by the filter.
	 */
	public enum PostType {

		ORIGINAL, REPLIES, QUOTES, REPOSTS;

		public static PostType of(Post post) {
			if (post.repost()) {
				return REPOSTS;
			}
			if (post.reply()) {
				return REPLIES;
			}
			if (post.isQuote()) {
				return QUOTES;
			}
			return ORIGINAL;
		}

	}

}
