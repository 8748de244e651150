package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * File system implementation of {@link CheckpointRepository}. Checkpoints live at
 * {@code <baseDir>/<account>/progress.json}.
 *
 * <p>
 * Checkpoints are advisory, so neither reading nor writing ever fails the run.
 */
public class FileSystemCheckpointRepository implements CheckpointRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCheckpointRepository.class);

	static final String FILE_NAME = "progress.json";

	private final Path baseDir;

	private final ObjectMapper objectMapper;

	public FileSystemCheckpointRepository(Path baseDir, ObjectMapper objectMapper) {
		this.baseDir = baseDir;
		this.objectMapper = objectMapper;
	}

	@Override
	public Optional<ProgressCheckpoint> load(String account) {
		Path file = fileFor(account);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			return Optional.ofNullable(objectMapper.readValue(file.toFile(), ProgressCheckpoint.class));
		}
		catch (IOException e) {
			logger.warn("Ignoring unreadable progress checkpoint {}: {}", file, e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void save(ProgressCheckpoint checkpoint) {
		Path file = fileFor(checkpoint.account());
		try {
			Files.createDirectories(file.getParent());
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), checkpoint);
			logger.debug("Saved progress checkpoint ({}, {} posts) to {}", checkpoint.phase(),
					checkpoint.collectedPosts(), file);
		}
		catch (IOException e) {
			logger.warn("Failed to save progress checkpoint {}: {}", file, e.getMessage());
		}
	}

	Path fileFor(String account) {
		return baseDir.resolve(account).resolve(FILE_NAME);
	}

}
