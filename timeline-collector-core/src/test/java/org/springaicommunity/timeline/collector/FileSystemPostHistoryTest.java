package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FileSystemPostHistory}.
 */
@DisplayName("FileSystemPostHistory Tests")
class FileSystemPostHistoryTest {

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private FakeTicker ticker;

	private Path file;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		ticker = new FakeTicker();
		file = tempDir.resolve("acct").resolve("history.json");
	}

	private FileSystemPostHistory newHistory() {
		return new FileSystemPostHistory(file, objectMapper, ticker);
	}

	@Nested
	@DisplayName("Load Tests")
	class LoadTest {

		@Test
		@DisplayName("Should start empty when no history file exists")
		void shouldStartEmptyWithoutFile() {
			FileSystemPostHistory history = newHistory();

			history.load();

			assertThat(history.size()).isZero();
		}

		@Test
		@DisplayName("Should start empty instead of failing on a corrupt file")
		void shouldStartEmptyOnCorruptFile() throws Exception {
			Files.createDirectories(file.getParent());
			Files.writeString(file, "{ not json");
			FileSystemPostHistory history = newHistory();

			assertThatCode(history::load).doesNotThrowAnyException();
			assertThat(history.size()).isZero();
		}

		@Test
		@DisplayName("Should tolerate a document without ids")
		void shouldTolerateMissingIds() throws Exception {
			Files.createDirectories(file.getParent());
			Files.writeString(file, "{\"last_updated\": \"2024-01-01T00:00:00Z\"}");
			FileSystemPostHistory history = newHistory();

			history.load();

			assertThat(history.size()).isZero();
		}

	}

	@Nested
	@DisplayName("Save Tests")
	class SaveTest {

		@Test
		@DisplayName("Should persist ids and reload them in order")
		void shouldPersistAndReload() {
			FileSystemPostHistory history = newHistory();
			history.add("3");
			history.add("1");
			history.add("2");
			history.save();

			FileSystemPostHistory reloaded = newHistory();
			reloaded.load();

			assertThat(reloaded.ids()).containsExactly("3", "1", "2");
			assertThat(reloaded.isKnown("1")).isTrue();
			assertThat(reloaded.isKnown("4")).isFalse();
		}

		@Test
		@DisplayName("Should write post_ids and last_updated without leaving a temp file")
		void shouldWriteDocumentFormat() throws Exception {
			FileSystemPostHistory history = newHistory();
			history.add("a");
			history.save();

			JsonNode document = objectMapper.readTree(file.toFile());
			assertThat(document.path("post_ids").get(0).asText()).isEqualTo("a");
			assertThat(document.path("last_updated").asText()).startsWith("2023-11-14T");
			assertThat(file.resolveSibling("history.json.tmp")).doesNotExist();
		}

		@Test
		@DisplayName("Should be idempotent when saved twice without changes")
		void shouldBeIdempotent() throws Exception {
			FileSystemPostHistory history = newHistory();
			history.add("a");
			history.add("b");
			history.save();
			String first = Files.readString(file);

			history.save();

			assertThat(Files.readString(file)).isEqualTo(first);
		}

		@Test
		@DisplayName("Should merge with previously saved ids after reload")
		void shouldAccumulateAcrossRuns() {
			FileSystemPostHistory first = newHistory();
			first.add("a");
			first.save();

			FileSystemPostHistory second = newHistory();
			second.load();
			assertThat(second.add("a")).isFalse();
			assertThat(second.add("b")).isTrue();
			second.save();

			FileSystemPostHistory third = newHistory();
			third.load();
			assertThat(third.ids()).containsExactly("a", "b");
		}

	}

}
