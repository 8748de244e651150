package org.springaicommunity.timeline.collector;

/**
 * Engagement counters attached to a post.
 *
 * @param likes number of likes
 * @param reposts number of reposts (retweets)
 * @param replies number of replies
 * @param quotes number of quote posts
 */
public record Engagement(int likes, int reposts, int replies, int quotes) {

	public static final Engagement NONE = new Engagement(0, 0, 0, 0);

	/**
	 * Returns likes plus reposts, the ranking used when sampling the most engaging posts.
	 * @return combined engagement score
	 */
	public int score() {
		return likes + reposts;
	}

}
