package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Utility for lenient JsonNode navigation over raw source records.
 */
public class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	/**
	 * Date format of the legacy {@code created_at} field, e.g.
	 * {@code Wed Oct 10 20:19:24 +0000 2018}.
	 */
	static final DateTimeFormatter LEGACY_DATE_FORMAT = DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy",
			Locale.ENGLISH);

	public JsonNode path(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

	public Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = path(node, path);
		if (target.isMissingNode() || target.isNull() || target.isContainerNode()) {
			return Optional.empty();
		}
		String text = target.asText();
		return text.isBlank() ? Optional.empty() : Optional.of(text);
	}

	/**
	 * Read a count. Numbers given as strings are accepted; anything that is not a number
	 * reads as zero.
	 */
	public long getCount(JsonNode node, String... path) {
		JsonNode target = path(node, path);
		if (target.isNumber()) {
			return Math.max(0, target.asLong());
		}
		if (target.isTextual()) {
			String text = target.asText().trim().replace(",", "");
			try {
				return Math.max(0, (long) Double.parseDouble(text));
			}
			catch (NumberFormatException e) {
				logger.debug("Non-numeric count '{}' read as 0", text);
			}
		}
		return 0;
	}

	public Optional<Long> getLong(JsonNode node, String... path) {
		JsonNode target = path(node, path);
		if (target.isNumber()) {
			return Optional.of(target.asLong());
		}
		if (target.isTextual()) {
			try {
				return Optional.of(Long.parseLong(target.asText().trim()));
			}
			catch (NumberFormatException e) {
				return Optional.empty();
			}
		}
		return Optional.empty();
	}

	public boolean getBoolean(JsonNode node, String... path) {
		JsonNode target = path(node, path);
		if (target.isTextual()) {
			return Boolean.parseBoolean(target.asText());
		}
		return target.asBoolean(false);
	}

	/**
	 * Parse an ISO-8601 instant or offset date-time.
	 */
	public Optional<Instant> getIsoInstant(JsonNode node, String... path) {
		return getString(node, path).flatMap(str -> {
			try {
				return Optional.of(OffsetDateTime.parse(str).toInstant());
			}
			catch (DateTimeParseException e) {
				logger.warn("Failed to parse datetime: {}", str);
				return Optional.empty();
			}
		});
	}

	public Optional<Instant> getLegacyInstant(JsonNode node, String... path) {
		return getString(node, path).flatMap(str -> {
			try {
				return Optional.of(OffsetDateTime.parse(str, LEGACY_DATE_FORMAT).toInstant());
			}
			catch (DateTimeParseException e) {
				logger.warn("Failed to parse legacy datetime: {}", str);
				return Optional.empty();
			}
		});
	}

	public List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = path(node, path);
		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}
		return List.of();
	}

	/**
	 * Collect strings from an array whose elements are either plain strings or objects
	 * carrying the value under {@code field}.
	 */
	public List<String> getStrings(JsonNode node, String field, String... path) {
		List<String> result = new ArrayList<>();
		for (JsonNode element : getArray(node, path)) {
			if (element.isTextual()) {
				if (!element.asText().isBlank()) {
					result.add(element.asText());
				}
			}
			else {
				getString(element, field).ifPresent(result::add);
			}
		}
		return result;
	}

}
