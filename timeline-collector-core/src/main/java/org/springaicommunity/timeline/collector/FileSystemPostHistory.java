package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link PostHistory} stored as a JSON document:
 *
 * <pre>
 * {
 *   "post_ids": ["1", "2"],
 *   "last_updated": "2024-05-01T10:00:00Z"
 * }
 * </pre>
 *
 * Saves go to a sibling temporary file that is then moved over the target, so a crash
 * never leaves a truncated history behind.
 */
public class FileSystemPostHistory implements PostHistory {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemPostHistory.class);

	private final Path file;

	private final ObjectMapper objectMapper;

	private final Ticker ticker;

	private final Set<String> knownIds = new LinkedHashSet<>();

	public FileSystemPostHistory(Path file, ObjectMapper objectMapper, Ticker ticker) {
		this.file = file;
		this.objectMapper = objectMapper;
		this.ticker = ticker;
	}

	@Override
	public boolean isKnown(String id) {
		return knownIds.contains(id);
	}

	@Override
	public boolean add(String id) {
		return knownIds.add(id);
	}

	@Override
	public int size() {
		return knownIds.size();
	}

	@Override
	public Set<String> ids() {
		return Collections.unmodifiableSet(knownIds);
	}

	@Override
	public void load() {
		if (!Files.exists(file)) {
			logger.info("No post history at {}, starting fresh", file);
			return;
		}
		try {
			HistoryDocument document = objectMapper.readValue(file.toFile(), HistoryDocument.class);
			if (document != null && document.postIds() != null) {
				knownIds.addAll(document.postIds());
			}
			logger.info("Loaded history of {} known posts from {}", knownIds.size(), file);
		}
		catch (IOException e) {
			logger.warn("Could not read post history {}, starting fresh: {}", file, e.getMessage());
		}
	}

	@Override
	public void save() {
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Path temp = file.resolveSibling(file.getFileName() + ".tmp");
			HistoryDocument document = new HistoryDocument(new ArrayList<>(knownIds),
					Instant.ofEpochMilli(ticker.currentTimeMillis()));
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
			moveIntoPlace(temp);
			logger.debug("Saved history of {} posts to {}", knownIds.size(), file);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to save post history to " + file, e);
		}
	}

	public Path file() {
		return file;
	}

	private void moveIntoPlace(Path temp) throws IOException {
		try {
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	/**
	 * On-disk form of the history.
	 */
	public record HistoryDocument(@Nullable List<String> postIds, @Nullable Instant lastUpdated) {
	}

}
