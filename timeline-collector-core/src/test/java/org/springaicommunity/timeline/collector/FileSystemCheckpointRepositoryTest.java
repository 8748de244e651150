package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileSystemCheckpointRepository Tests")
class FileSystemCheckpointRepositoryTest {

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private FileSystemCheckpointRepository repository;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		repository = new FileSystemCheckpointRepository(tempDir, objectMapper);
	}

	private ProgressCheckpoint checkpoint(String phase, String cursor, boolean completed) {
		Instant timestamp = Instant.parse("2024-06-01T10:00:00Z");
		RunStatistics statistics = new RunStatistics(timestamp.toEpochMilli());
		statistics.recordRequest();
		statistics.recordCollected(PostOrigin.TIMELINE, TestPosts.post("p1"));
		return new ProgressCheckpoint("acct", phase, cursor, 1, 10,
				statistics.toSummary(timestamp.plusSeconds(90).toEpochMilli()), timestamp, completed, null);
	}

	@Test
	@DisplayName("Should return empty when no checkpoint exists")
	void shouldReturnEmpty() {
		assertThat(repository.load("acct")).isEmpty();
	}

	@Test
	@DisplayName("Should round-trip a checkpoint through progress.json")
	void shouldRoundTrip() throws Exception {
		ProgressCheckpoint saved = checkpoint("TIMELINE", "p42", false);

		repository.save(saved);

		Path file = tempDir.resolve("acct").resolve("progress.json");
		JsonNode json = objectMapper.readTree(file.toFile());
		assertThat(json.path("phase").asText()).isEqualTo("TIMELINE");
		assertThat(json.path("collected_posts").asInt()).isEqualTo(1);
		assertThat(json.path("statistics").path("runtime").asText()).isEqualTo("PT1M30S");

		ProgressCheckpoint loaded = repository.load("acct").orElseThrow();
		assertThat(loaded).isEqualTo(saved);
		assertThat(loaded.canResumeTimeline()).isTrue();
	}

	@Test
	@DisplayName("Should ignore an unreadable checkpoint")
	void shouldIgnoreCorruptFile() throws Exception {
		Files.createDirectories(tempDir.resolve("acct"));
		Files.writeString(tempDir.resolve("acct").resolve("progress.json"), "[[[");

		assertThat(repository.load("acct")).isEmpty();
	}

	@Test
	@DisplayName("Should only resume unfinished timeline checkpoints with a cursor")
	void shouldDecideResumability() {
		assertThat(checkpoint("TIMELINE", "p1", true).canResumeTimeline()).isFalse();
		assertThat(checkpoint("REPLIES", "p1", false).canResumeTimeline()).isFalse();
		assertThat(checkpoint(ProgressCheckpoint.PHASE_FINISHED, "p1", false).canResumeTimeline()).isFalse();
	}

	@Test
	@DisplayName("Should consider checkpoints older than the maximum age stale")
	void shouldDetectStaleness() {
		ProgressCheckpoint checkpoint = checkpoint("TIMELINE", "p1", false);
		Instant now = checkpoint.timestamp();

		assertThat(checkpoint.isStale(now.plus(Duration.ofHours(23)), Duration.ofHours(24))).isFalse();
		assertThat(checkpoint.isStale(now.plus(Duration.ofHours(25)), Duration.ofHours(24))).isTrue();
	}

}
