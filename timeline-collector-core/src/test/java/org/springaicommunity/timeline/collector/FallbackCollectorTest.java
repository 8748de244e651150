package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link FallbackCollector} with a mocked {@link InteractiveSession}.
 */
@DisplayName("FallbackCollector Tests")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FallbackCollectorTest {

	private static final Credentials CREDENTIALS = new Credentials("user", "secret", null);

	@Mock
	private InteractiveSession session;

	private FakeTicker ticker;

	private CancellationToken cancellation;

	private CollectorProperties properties;

	private InMemoryPostHistory history;

	private PostDeduplicator deduplicator;

	@BeforeEach
	void setUp() {
		ticker = new FakeTicker();
		cancellation = new CancellationToken();
		properties = new CollectorProperties();
		history = new InMemoryPostHistory();
		when(session.revealMore()).thenReturn(true);
	}

	private FallbackCollector collector() {
		CollectorContext context = new CollectorContext(properties, ticker, cancellation, new Random(3));
		deduplicator = new PostDeduplicator(history, context.statistics());
		return new FallbackCollector(() -> session, new PostNormalizer(), deduplicator, context);
	}

	@Nested
	@DisplayName("Stop Condition Tests")
	class StopConditionTest {

		@Test
		@DisplayName("Should stop after consecutive passes without unseen posts")
		void shouldStopWhenStagnant() {
			when(session.extractVisible()).thenReturn(TestPosts.timeline("f", 5));
			FallbackCollector collector = collector();

			FallbackResult result = collector.collect("acct", CREDENTIALS);

			assertThat(result.stopReason()).isEqualTo(FallbackResult.StopReason.STAGNATED);
			assertThat(result.passes()).isEqualTo(4);
			assertThat(result.newPosts()).isEqualTo(5);
			verify(session).authenticate(CREDENTIALS);
			verify(session).navigateTo("from:acct");
			verify(session).close();
		}

		@Test
		@DisplayName("Should stop when the view reveals nothing more")
		void shouldStopWhenExhausted() {
			when(session.extractVisible()).thenReturn(TestPosts.timeline("f", 3));
			when(session.revealMore()).thenReturn(false);

			FallbackResult result = collector().collect("acct", CREDENTIALS);

			assertThat(result.stopReason()).isEqualTo(FallbackResult.StopReason.EXHAUSTED);
			assertThat(result.passes()).isEqualTo(1);
			assertThat(deduplicator.posts()).extracting(Post::id).containsExactly("f3", "f2", "f1");
		}

		@Test
		@DisplayName("Should stop at the session duration cap")
		void shouldStopAtSessionCap() {
			properties.setFallbackSessionCap(Duration.ofSeconds(30));
			AtomicInteger pass = new AtomicInteger();
			when(session.extractVisible())
				.thenAnswer(invocation -> TestPosts.timeline("pass" + pass.incrementAndGet() + "-", 2));

			FallbackResult result = collector().collect("acct", CREDENTIALS);

			assertThat(result.stopReason()).isEqualTo(FallbackResult.StopReason.SESSION_CAP);
			assertThat(result.passes()).isGreaterThan(1);
			assertThat(ticker.currentTimeMillis() - FakeTicker.START).isGreaterThanOrEqualTo(30_000L);
		}

		@Test
		@DisplayName("Should not exceed the per-run post cap")
		void shouldStopAtMaxPosts() {
			properties.setMaxPosts(3);
			when(session.extractVisible()).thenReturn(TestPosts.timeline("f", 5));

			FallbackResult result = collector().collect("acct", CREDENTIALS);

			assertThat(result.stopReason()).isEqualTo(FallbackResult.StopReason.MAX_POSTS);
			assertThat(deduplicator.collectedCount()).isEqualTo(3);
		}

		@Test
		@DisplayName("Should count posts already in the history as seen but not new")
		void shouldNotReEmitKnownPosts() {
			List<JsonNode> visible = TestPosts.timeline("f", 4);
			history.add("f4");
			history.add("f3");
			when(session.extractVisible()).thenReturn(visible);
			when(session.revealMore()).thenReturn(false);

			FallbackResult result = collector().collect("acct", CREDENTIALS);

			assertThat(result.newPosts()).isEqualTo(2);
			assertThat(deduplicator.posts()).extracting(Post::id).containsExactly("f2", "f1");
		}

	}

	@Nested
	@DisplayName("Failure Tests")
	class FailureTest {

		@Test
		@DisplayName("Should report a crashed session as failed and keep collected posts")
		void shouldReportFailure() {
			when(session.extractVisible()).thenReturn(TestPosts.timeline("f", 2))
				.thenThrow(new IllegalStateException("page crashed"));

			FallbackResult result = collector().collect("acct", CREDENTIALS);

			assertThat(result.failed()).isTrue();
			assertThat(result.error()).contains("Fallback session failed").contains("page crashed");
			assertThat(result.newPosts()).isEqualTo(2);
			assertThat(deduplicator.collectedCount()).isEqualTo(2);
			verify(session).close();
		}

		@Test
		@DisplayName("Should not propagate a failed login")
		void shouldContainLoginFailure() {
			doThrow(CollectionException.authentication("challenge required")).when(session).authenticate(any());

			FallbackResult result = collector().collect("acct", CREDENTIALS);

			assertThat(result.stopReason()).isEqualTo(FallbackResult.StopReason.FAILED);
			assertThat(result.passes()).isZero();
			verify(session, never()).extractVisible();
		}

		@Test
		@DisplayName("Should propagate cancellation and still close the session")
		void shouldPropagateCancellation() {
			when(session.extractVisible()).thenReturn(TestPosts.timeline("f", 2));
			cancellation.cancel("shutdown");

			assertThatThrownBy(() -> collector().collect("acct", CREDENTIALS))
				.isInstanceOf(CollectionCancelledException.class);
			verify(session).close();
		}

	}

}
