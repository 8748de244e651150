package org.springaicommunity.timeline.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link TimelineTracker}.
 */
@DisplayName("TimelineTracker Tests")
class TimelineTrackerTest {

	private FakeTicker ticker;

	private TimelineTracker tracker;

	@BeforeEach
	void setUp() {
		ticker = new FakeTicker();
		tracker = new TimelineTracker(50, Duration.ofMinutes(5), 3, ticker);
	}

	private void trackKnown(int count) {
		for (int i = 0; i < count; i++) {
			tracker.trackPost(TestPosts.post("known-" + i), false);
		}
	}

	@Nested
	@DisplayName("Known Streak Tests")
	class KnownStreakTest {

		@Test
		@DisplayName("Should not be stuck after 49 known posts in a row")
		void shouldNotBeStuckBelowLimit() {
			trackKnown(49);

			assertThat(tracker.isStuck()).isFalse();
			assertThat(tracker.stuckReason()).isEqualTo("progressing");
		}

		@Test
		@DisplayName("Should be stuck after 51 known posts in a row")
		void shouldBeStuckAboveLimit() {
			trackKnown(51);

			assertThat(tracker.isStuck()).isTrue();
			assertThat(tracker.stuckReason()).contains("known posts in a row");
		}

		@Test
		@DisplayName("Should be stuck exactly at the limit")
		void shouldBeStuckAtLimit() {
			trackKnown(50);

			assertThat(tracker.isStuck()).isTrue();
		}

		@Test
		@DisplayName("Should reset the streak when a new post arrives")
		void shouldResetStreakOnNewPost() {
			trackKnown(49);
			tracker.trackPost(TestPosts.post("fresh"));
			trackKnown(49);

			assertThat(tracker.isStuck()).isFalse();
			assertThat(tracker.consecutiveKnownCount()).isEqualTo(49);
		}

		@Test
		@DisplayName("Should count a repeated id within the pass as known")
		void shouldCountRepeatedIdAsKnown() {
			Post post = TestPosts.post("same");

			assertThat(tracker.trackPost(post)).isTrue();
			assertThat(tracker.trackPost(post)).isFalse();
			assertThat(tracker.consecutiveKnownCount()).isEqualTo(1);
		}

	}

	@Nested
	@DisplayName("Stall Tests")
	class StallTest {

		@Test
		@DisplayName("Should be stuck when no new post arrived for longer than the stall timeout")
		void shouldBeStuckAfterStallTimeout() {
			tracker.trackPost(TestPosts.post("a"));

			ticker.advance(Duration.ofMinutes(5));
			assertThat(tracker.isStuck()).isFalse();

			ticker.advance(Duration.ofMillis(1));
			assertThat(tracker.isStuck()).isTrue();
			assertThat(tracker.stuckReason()).startsWith("no new post for");
		}

		@Test
		@DisplayName("Should restart the stall clock on every new post")
		void shouldRestartStallClock() {
			ticker.advance(Duration.ofMinutes(4));
			tracker.trackPost(TestPosts.post("a"));
			ticker.advance(Duration.ofMinutes(4));

			assertThat(tracker.isStuck()).isFalse();
		}

	}

	@Nested
	@DisplayName("Cursor Tests")
	class CursorTest {

		@Test
		@DisplayName("Should tolerate up to three repeated cursors")
		void shouldTolerateRepeatedCursors() {
			assertThat(tracker.trackCursor("c1")).isFalse();
			assertThat(tracker.trackCursor("c1")).isTrue();
			tracker.trackCursor("c1");
			tracker.trackCursor("c1");

			assertThat(tracker.isStuck()).isFalse();

			tracker.trackCursor("c1");
			assertThat(tracker.isStuck()).isTrue();
			assertThat(tracker.stuckReason()).contains("repeated cursors");
		}

		@Test
		@DisplayName("Should ignore missing cursors")
		void shouldIgnoreMissingCursors() {
			for (int i = 0; i < 10; i++) {
				assertThat(tracker.trackCursor(null)).isFalse();
				assertThat(tracker.trackCursor("")).isFalse();
			}

			assertThat(tracker.isStuck()).isFalse();
		}

	}

	@Test
	@DisplayName("Should report the time range of anchored posts only")
	void shouldReportAnchoredRange() {
		tracker.trackPost(TestPosts.post("a", 2_000L));
		tracker.trackPost(TestPosts.post("b", 1_000L));
		tracker.trackPost(TestPosts.post("c", 3_000L));
		tracker.trackPost(TestPosts.post("d", null));

		TimelineTracker.Progress progress = tracker.progress();

		assertThat(progress.oldest()).isEqualTo(Instant.ofEpochMilli(1_000L));
		assertThat(progress.newest()).isEqualTo(Instant.ofEpochMilli(3_000L));
		assertThat(progress.uniquePosts()).isEqualTo(4);
	}

	@Test
	@DisplayName("Should forget everything on reset")
	void shouldForgetOnReset() {
		trackKnown(60);
		tracker.trackCursor("c");
		tracker.trackCursor("c");

		tracker.reset();

		assertThat(tracker.isStuck()).isFalse();
		assertThat(tracker.progress().uniquePosts()).isZero();
		assertThat(tracker.progress().oldest()).isNull();
		assertThat(tracker.trackCursor("c")).isFalse();
	}

}
