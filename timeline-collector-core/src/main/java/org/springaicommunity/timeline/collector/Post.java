package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A normalized post collected from an account's timeline.
 *
 * <p>
 * Identity is {@code id}: two posts with the same id are the same entity regardless of
 * the collection path that produced them. A post whose {@code timestamp} is null is
 * <em>unanchored</em>; it takes part in deduplication but not in time-range analytics.
 *
 * @param id the source's post identifier
 * @param text the post text as published
 * @param timestamp creation time in epoch milliseconds, or null if unknown
 * @param engagement engagement counters
 * @param reply whether the post is a reply to another post
 * @param repost whether the post is a repost of another account's post
 * @param media photo and video references
 * @param permalink public URL of the post
 * @param username author handle
 * @param inReplyToId id of the post this one replies to (null if not a reply)
 * @param quotedId id of the quoted post (null if not a quote)
 * @param hashtags hashtags mentioned in the text
 * @param urls links contained in the post
 */
public record Post(String id, String text, @Nullable Long timestamp, Engagement engagement, boolean reply,
		boolean repost, List<String> media, String permalink, String username, @Nullable String inReplyToId,
		@Nullable String quotedId, List<String> hashtags, List<String> urls) {

	public Post {
		media = List.copyOf(media);
		hashtags = List.copyOf(hashtags);
		urls = List.copyOf(urls);
	}

	/**
	 * Returns true if the post carries a creation timestamp.
	 * @return true for anchored posts
	 */
	public boolean isAnchored() {
		return timestamp != null;
	}

	/**
	 * Returns true if the post quotes another post.
	 * @return true for quote posts
	 */
	public boolean isQuote() {
		return quotedId != null;
	}

	/**
	 * Returns the creation time as an Instant, or null for unanchored posts.
	 * @return the creation instant
	 */
	@Nullable
	public Instant createdAt() {
		return timestamp != null ? Instant.ofEpochMilli(timestamp) : null;
	}

}
