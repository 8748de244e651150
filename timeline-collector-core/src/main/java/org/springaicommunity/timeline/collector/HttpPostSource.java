package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link PostSource} backed by a JSON-over-HTTP timeline API, using the Java HttpClient.
 *
 * <p>
 * Endpoints, relative to the base URL:
 * <ul>
 * <li>{@code POST /auth/login} with {@code {"username", "password", "email"}}, answering
 * {@code {"token"}}</li>
 * <li>{@code POST /auth/logout}</li>
 * <li>{@code GET /users/{account}}, answering the profile with a post count</li>
 * <li>{@code GET /users/{account}/posts?count=&cursor=}</li>
 * <li>{@code GET /search?q=&count=&cursor=}</li>
 * </ul>
 * Pages carry their records under {@code posts}, {@code data} or {@code tweets} and the
 * continuation token under {@code next_cursor} or {@code meta.next_token}.
 *
 * <p>
 * Status codes map to {@link ErrorKind}: 429 and 403 with an exhausted
 * {@code X-RateLimit-Remaining} are {@link ErrorKind#RATE_LIMIT}, 401 is
 * {@link ErrorKind#AUTHENTICATION}, 5xx and I/O failures are
 * {@link ErrorKind#TRANSIENT_NETWORK}, any other 4xx is {@link ErrorKind#CONFIGURATION}.
 */
public class HttpPostSource implements PostSource {

	private static final Logger logger = LoggerFactory.getLogger(HttpPostSource.class);

	private static final String USER_AGENT = "timeline-collector";

	private static final List<String> ITEM_FIELDS = List.of("posts", "data", "tweets");

	private static final List<String> COUNT_FIELDS = List.of("statuses_count", "tweets_count", "posts_count");

	private final String baseUrl;

	private final ObjectMapper objectMapper;

	private final HttpClient httpClient;

	@Nullable
	private volatile String token;

	public HttpPostSource(String baseUrl, ObjectMapper objectMapper) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.objectMapper = objectMapper;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public void authenticate(Credentials credentials) {
		ObjectNode body = objectMapper.createObjectNode();
		body.put("username", credentials.username());
		body.put("password", credentials.password());
		if (credentials.email() != null) {
			body.put("email", credentials.email());
		}
		JsonNode response = send(post("/auth/login", body));
		String value = response.path("token").asText("");
		if (value.isEmpty()) {
			throw CollectionException.authentication("Login response carried no token");
		}
		this.token = value;
		logger.info("Authenticated as {}", credentials.username());
	}

	@Override
	public void deauthenticate() {
		if (token == null) {
			return;
		}
		// a cancelled run still logs out; the interrupt is restored afterwards
		boolean interrupted = Thread.interrupted();
		try {
			send(post("/auth/logout", objectMapper.createObjectNode()));
			logger.debug("Logged out");
		}
		catch (CollectionException | CollectionCancelledException e) {
			logger.warn("Logout failed: {}", e.getMessage());
		}
		finally {
			token = null;
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

	@Override
	public AccountProfile getProfile(String account) {
		JsonNode profile = send(get("/users/" + encode(account)));
		JsonNode user = profile.has("data") ? profile.path("data") : profile;
		JsonNode metrics = user.path("public_metrics");
		for (String field : COUNT_FIELDS) {
			if (user.path(field).canConvertToInt()) {
				return new AccountProfile(account, user.path(field).asInt());
			}
		}
		if (metrics.path("tweet_count").canConvertToInt()) {
			return new AccountProfile(account, metrics.path("tweet_count").asInt());
		}
		logger.warn("Profile of @{} carries no post count", account);
		return AccountProfile.unknown(account);
	}

	@Override
	public SourcePage fetchTimeline(String account, int batchSize, @Nullable String cursor) {
		return page(get("/users/" + encode(account) + "/posts" + query("count", String.valueOf(batchSize), "cursor",
				cursor)));
	}

	@Override
	public SourcePage searchPosts(String query, int batchSize, @Nullable String cursor) {
		return page(get("/search" + query("q", query, "count", String.valueOf(batchSize), "cursor", cursor)));
	}

	private SourcePage page(HttpRequest request) {
		JsonNode response = send(request);
		JsonNode items = response.isArray() ? response : null;
		if (items == null) {
			for (String field : ITEM_FIELDS) {
				if (response.path(field).isArray()) {
					items = response.path(field);
					break;
				}
			}
		}
		List<JsonNode> records = new ArrayList<>();
		if (items != null) {
			items.forEach(records::add);
		}
		String next = textOrNull(response.path("next_cursor"));
		if (next == null) {
			next = textOrNull(response.path("meta").path("next_token"));
		}
		return new SourcePage(records, next);
	}

	private HttpRequest get(String path) {
		return authorized(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET()).build();
	}

	private HttpRequest post(String path, JsonNode body) {
		try {
			return authorized(HttpRequest.newBuilder()
				.uri(URI.create(baseUrl + path))
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))).build();
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Cannot serialize request body", e);
		}
	}

	private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
		builder.header("Accept", "application/json").header("User-Agent", USER_AGENT);
		String current = token;
		if (current != null) {
			builder.header("Authorization", "Bearer " + current);
		}
		return builder;
	}

	private JsonNode send(HttpRequest request) {
		String description = request.method() + " " + request.uri().getPath();
		logger.debug(description);
		long start = System.currentTimeMillis();
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.debug("{} failed after {}ms: {}", description, System.currentTimeMillis() - start, e.getMessage());
			throw CollectionException.transientFailure("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CollectionCancelledException("HTTP request interrupted");
		}

		int statusCode = response.statusCode();
		logger.debug("{} -> {} in {}ms", description, statusCode, System.currentTimeMillis() - start);
		if (statusCode >= 200 && statusCode < 300) {
			return parse(response.body(), description);
		}
		throw classify(statusCode, response, description);
	}

	private JsonNode parse(String body, String description) {
		if (body.isBlank()) {
			return objectMapper.createObjectNode();
		}
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw CollectionException.transientFailure("Malformed response to " + description, e);
		}
	}

	static CollectionException classify(int statusCode, HttpResponse<?> response, String description) {
		int remaining = response.headers()
			.firstValue("X-RateLimit-Remaining")
			.map(HttpPostSource::parseIntOrMinusOne)
			.orElse(-1);
		if (statusCode == 429 || (statusCode == 403 && remaining == 0)) {
			return new CollectionException(ErrorKind.RATE_LIMIT, "Rate limited on " + description, statusCode);
		}
		if (statusCode == 401) {
			return new CollectionException(ErrorKind.AUTHENTICATION, "Unauthorized on " + description, statusCode);
		}
		if (statusCode >= 500) {
			return new CollectionException(ErrorKind.TRANSIENT_NETWORK,
					"Server error " + statusCode + " on " + description, statusCode);
		}
		if (statusCode == 404) {
			return new CollectionException(ErrorKind.CONFIGURATION, "Not found: " + description, statusCode);
		}
		return new CollectionException(ErrorKind.CONFIGURATION, "Request rejected (" + statusCode + "): " + description,
				statusCode);
	}

	private static int parseIntOrMinusOne(String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			return -1;
		}
	}

	@Nullable
	private static String textOrNull(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return null;
		}
		String text = node.asText();
		return text.isEmpty() ? null : text;
	}

	private static String query(@Nullable String... pairs) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i + 1 < pairs.length; i += 2) {
			if (pairs[i + 1] == null) {
				continue;
			}
			sb.append(sb.length() == 0 ? '?' : '&').append(pairs[i]).append('=').append(encode(pairs[i + 1]));
		}
		return sb.toString();
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}
