package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link PostSink} that maintains {@code <baseDir>/<account>/posts.json}.
 *
 * <p>
 * Posts already in the file are kept; posts of the new run are merged in by id, so the
 * file grows across runs the same way the post history does.
 */
public class FileSystemPostSink implements PostSink {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemPostSink.class);

	static final String FILE_NAME = "posts.json";

	private final Path baseDir;

	private final ObjectMapper objectMapper;

	public FileSystemPostSink(Path baseDir, ObjectMapper objectMapper) {
		this.baseDir = baseDir;
		this.objectMapper = objectMapper;
	}

	@Override
	public void accept(CollectionResult result) {
		Path file = fileFor(result.account());
		Map<String, JsonNode> merged = readExisting(file);
		int before = merged.size();
		for (Post post : result.posts()) {
			merged.put(post.id(), objectMapper.valueToTree(post));
		}

		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("account", result.account());
		metadata.put("updated_at", Instant.now().toString());
		metadata.put("outcome", result.outcome().name());
		metadata.put("new_posts", result.posts().size());
		metadata.put("total_posts", merged.size());
		metadata.put("expected_posts", result.profile().expectedPostCount());
		metadata.put("statistics", result.statistics());

		Map<String, Object> output = new LinkedHashMap<>();
		output.put("metadata", metadata);
		output.put("posts", merged.values());

		try {
			Files.createDirectories(file.getParent());
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), output);
			logger.info("Wrote {} posts ({} new) to {}", merged.size(), merged.size() - before, file);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write posts to " + file, e);
		}
	}

	Path fileFor(String account) {
		return baseDir.resolve(account).resolve(FILE_NAME);
	}

	private Map<String, JsonNode> readExisting(Path file) {
		Map<String, JsonNode> posts = new LinkedHashMap<>();
		if (!Files.exists(file)) {
			return posts;
		}
		try {
			JsonNode root = objectMapper.readTree(file.toFile());
			for (JsonNode post : root.path("posts")) {
				String id = post.path("id").asText("");
				if (!id.isEmpty()) {
					posts.put(id, post);
				}
			}
		}
		catch (IOException e) {
			logger.warn("Existing output {} is unreadable and will be replaced: {}", file, e.getMessage());
		}
		return posts;
	}

}
