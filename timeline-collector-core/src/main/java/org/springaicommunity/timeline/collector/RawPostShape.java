package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Raw record layouts the normalizer understands.
 */
public enum RawPostShape {

	/**
	 * Flat scraper record: {@code id}, {@code text}, {@code likes}, {@code retweets},
	 * {@code timestamp}, {@code permanentUrl}.
	 */
	SCRAPER,

	/**
	 * GraphQL timeline entry with the classic payload under {@code legacy}.
	 */
	LEGACY_NESTED,

	/**
	 * v2 API object with {@code public_metrics} and {@code referenced_tweets}.
	 */
	API_V2;

	public static Optional<RawPostShape> detect(JsonNode raw) {
		if (!raw.isObject()) {
			return Optional.empty();
		}
		if (raw.path("legacy").isObject()) {
			return Optional.of(LEGACY_NESTED);
		}
		if (raw.has("public_metrics") || raw.has("referenced_tweets") || raw.has("author_id")
				|| raw.has("edit_history_tweet_ids")) {
			return Optional.of(API_V2);
		}
		if (raw.has("id") && (raw.has("text") || raw.has("timestamp") || raw.has("permanentUrl")
				|| raw.has("likes") || raw.has("timeParsed"))) {
			return Optional.of(SCRAPER);
		}
		return Optional.empty();
	}

}
