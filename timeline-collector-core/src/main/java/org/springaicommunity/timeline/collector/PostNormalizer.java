package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps raw source records of any {@link RawPostShape} to the canonical {@link Post}.
 *
 * <p>
 * Timestamps below {@code 1e12} are taken as epoch seconds. A record without a usable
 * timestamp is kept as an unanchored post. A record without an id, or of an unknown
 * shape, raises {@link ErrorKind#RECORD_PARSE}.
 */
public class PostNormalizer {

	private static final long SECONDS_THRESHOLD = 1_000_000_000_000L;

	private static final String REPOST_PREFIX = "RT @";

	private final JsonNodeUtils json;

	public PostNormalizer() {
		this(new JsonNodeUtils());
	}

	public PostNormalizer(JsonNodeUtils json) {
		this.json = json;
	}

	/**
	 * Normalize one raw record.
	 * @param raw the raw record
	 * @param account account being collected, used when the record names no author
	 * @return the canonical post
	 * @throws CollectionException of kind {@link ErrorKind#RECORD_PARSE} when the record
	 * cannot be mapped
	 */
	public Post normalize(JsonNode raw, String account) {
		RawPostShape shape = RawPostShape.detect(raw)
			.orElseThrow(() -> CollectionException.parse("Unrecognized record shape: " + abbreviate(raw)));
		return switch (shape) {
			case SCRAPER -> fromScraper(raw, account);
			case LEGACY_NESTED -> fromLegacy(raw, account);
			case API_V2 -> fromV2(raw, account);
		};
	}

	private Post fromScraper(JsonNode raw, String account) {
		String id = requireId(json.getString(raw, "id").orElse(null), raw);
		String text = json.getString(raw, "text").orElse("");
		Long timestamp = json.getLong(raw, "timestamp")
			.or(() -> json.getIsoInstant(raw, "timeParsed").map(Instant::toEpochMilli))
			.map(PostNormalizer::toEpochMillis)
			.orElse(null);
		Engagement engagement = new Engagement(count(raw, "likes"), count(raw, "retweets"), count(raw, "replies"),
				count(raw, "quotes"));

		List<String> media = new ArrayList<>(json.getStrings(raw, "url", "photos"));
		media.addAll(json.getStrings(raw, "url", "videos"));

		String username = json.getString(raw, "username").orElse(account);
		String permalink = json.getString(raw, "permanentUrl").orElse(defaultPermalink(username, id));
		boolean repost = json.getBoolean(raw, "isRetweet") || text.startsWith(REPOST_PREFIX);

		return new Post(id, text, timestamp, engagement, json.getBoolean(raw, "isReply"), repost, media, permalink,
				username, json.getString(raw, "inReplyToStatusId").orElse(null),
				json.getString(raw, "quotedStatusId").orElse(null), json.getStrings(raw, "text", "hashtags"),
				json.getStrings(raw, "url", "urls"));
	}

	private Post fromLegacy(JsonNode raw, String account) {
		JsonNode legacy = raw.path("legacy");
		String id = requireId(json.getString(raw, "rest_id")
			.or(() -> json.getString(raw, "id_str"))
			.or(() -> json.getString(legacy, "id_str"))
			.orElse(null), raw);
		String text = json.getString(legacy, "full_text").or(() -> json.getString(legacy, "text")).orElse("");
		Long timestamp = json.getLegacyInstant(legacy, "created_at").map(Instant::toEpochMilli).orElse(null);
		Engagement engagement = new Engagement(count(legacy, "favorite_count"), count(legacy, "retweet_count"),
				count(legacy, "reply_count"), count(legacy, "quote_count"));

		String inReplyTo = json.getString(legacy, "in_reply_to_status_id_str").orElse(null);
		boolean repost = legacy.has("retweeted_status_result") || raw.has("retweeted_status_result")
				|| text.startsWith(REPOST_PREFIX);
		String username = json.getString(raw, "core", "user_results", "result", "legacy", "screen_name")
			.orElse(account);

		return new Post(id, text, timestamp, engagement, inReplyTo != null, repost,
				json.getStrings(legacy, "media_url_https", "entities", "media"), defaultPermalink(username, id),
				username, inReplyTo, json.getString(legacy, "quoted_status_id_str").orElse(null),
				json.getStrings(legacy, "text", "entities", "hashtags"),
				json.getStrings(legacy, "expanded_url", "entities", "urls"));
	}

	private Post fromV2(JsonNode raw, String account) {
		String id = requireId(json.getString(raw, "id").orElse(null), raw);
		String text = json.getString(raw, "text").orElse("");
		Long timestamp = json.getIsoInstant(raw, "created_at").map(Instant::toEpochMilli).orElse(null);
		JsonNode metrics = raw.path("public_metrics");
		Engagement engagement = new Engagement(count(metrics, "like_count"), count(metrics, "retweet_count"),
				count(metrics, "reply_count"), count(metrics, "quote_count"));

		String inReplyTo = null;
		String quoted = null;
		boolean repost = text.startsWith(REPOST_PREFIX);
		for (JsonNode reference : json.getArray(raw, "referenced_tweets")) {
			String type = json.getString(reference, "type").orElse("");
			String referencedId = json.getString(reference, "id").orElse(null);
			switch (type) {
				case "replied_to" -> inReplyTo = referencedId;
				case "quoted" -> quoted = referencedId;
				case "retweeted" -> repost = true;
				default -> {
				}
			}
		}
		String username = json.getString(raw, "username").orElse(account);

		return new Post(id, text, timestamp, engagement, inReplyTo != null, repost,
				json.getStrings(raw, "media_key", "attachments", "media_keys"), defaultPermalink(username, id),
				username, inReplyTo, quoted, json.getStrings(raw, "tag", "entities", "hashtags"),
				json.getStrings(raw, "expanded_url", "entities", "urls"));
	}

	private int count(JsonNode node, String field) {
		return (int) Math.min(Integer.MAX_VALUE, json.getCount(node, field));
	}

	@Nullable
	private static Long toEpochMillis(long value) {
		if (value <= 0) {
			return null;
		}
		return value < SECONDS_THRESHOLD ? value * 1000 : value;
	}

	private static String requireId(@Nullable String id, JsonNode raw) {
		if (id == null || id.isBlank()) {
			throw CollectionException.parse("Record has no id: " + abbreviate(raw));
		}
		return id;
	}

	static String defaultPermalink(String username, String id) {
		return "https://x.com/" + username + "/status/" + id;
	}

	private static String abbreviate(JsonNode raw) {
		String text = raw.toString();
		return text.length() > 120 ? text.substring(0, 120) + "..." : text;
	}

}
