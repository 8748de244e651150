package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

/**
 * Remote, paginated, rate-limited source of posts.
 *
 * <p>
 * Every operation signals failure with a {@link CollectionException} whose
 * {@link ErrorKind} classifies it: {@link ErrorKind#RATE_LIMIT} for explicit throttling,
 * {@link ErrorKind#TRANSIENT_NETWORK} for retryable transport failures,
 * {@link ErrorKind#AUTHENTICATION} for rejected credentials and
 * {@link ErrorKind#CONFIGURATION} for requests the source refuses.
 */
public interface PostSource {

	void authenticate(Credentials credentials);

	/**
	 * Release the session. Must not throw.
	 */
	void deauthenticate();

	AccountProfile getProfile(String account);

	/**
	 * Fetch one batch of the account's timeline.
	 * @param account account handle
	 * @param batchSize maximum number of records
	 * @param cursor position to continue from, null for the newest posts
	 * @return the batch
	 */
	SourcePage fetchTimeline(String account, int batchSize, @Nullable String cursor);

	/**
	 * Fetch one page of search results.
	 * @param query search query, e.g. {@code from:account filter:replies}
	 * @param batchSize maximum number of records
	 * @param cursor position to continue from, null for the first page
	 * @return the page
	 */
	SourcePage searchPosts(String query, int batchSize, @Nullable String cursor);

	static String repliesQuery(String account) {
		return "from:" + account + " filter:replies";
	}

}
