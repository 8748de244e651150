package org.springaicommunity.timeline.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PostDeduplicator Tests")
class PostDeduplicatorTest {

	private InMemoryPostHistory history;

	private RunStatistics statistics;

	private PostDeduplicator deduplicator;

	@BeforeEach
	void setUp() {
		history = new InMemoryPostHistory("old-1", "old-2");
		statistics = new RunStatistics(FakeTicker.START);
		deduplicator = new PostDeduplicator(history, statistics);
	}

	@Test
	@DisplayName("Should accept an unknown post and record it in the history")
	void shouldAcceptUnknownPost() {
		boolean added = deduplicator.offer(TestPosts.post("new-1"), PostOrigin.TIMELINE);

		assertThat(added).isTrue();
		assertThat(history.isKnown("new-1")).isTrue();
		assertThat(deduplicator.collectedCount()).isEqualTo(1);
		assertThat(statistics.getTimelinePosts()).isEqualTo(1);
	}

	@Test
	@DisplayName("Should never emit a post known from an earlier run")
	void shouldRejectHistoryPost() {
		boolean added = deduplicator.offer(TestPosts.post("old-1"), PostOrigin.FALLBACK);

		assertThat(added).isFalse();
		assertThat(deduplicator.posts()).isEmpty();
		assertThat(statistics.getFallbackPosts()).isZero();
	}

	@Test
	@DisplayName("Should merge the same post from two collection paths")
	void shouldMergeAcrossPaths() {
		deduplicator.offer(TestPosts.post("p1"), PostOrigin.TIMELINE);

		boolean again = deduplicator.offer(TestPosts.post("p1"), PostOrigin.FALLBACK);

		assertThat(again).isFalse();
		assertThat(deduplicator.posts()).extracting(Post::id).containsExactly("p1");
		assertThat(statistics.getTotalPosts()).isEqualTo(1);
	}

	@Test
	@DisplayName("Should replace an unanchored post with its timestamped version")
	void shouldPreferAnchoredVersion() {
		deduplicator.offer(TestPosts.post("p1", null), PostOrigin.FALLBACK);
		deduplicator.offer(TestPosts.post("p1", 5_000L), PostOrigin.REPLIES);

		assertThat(deduplicator.posts()).singleElement()
			.satisfies(post -> assertThat(post.timestamp()).isEqualTo(5_000L));
	}

	@Test
	@DisplayName("Should keep the anchored version when an unanchored duplicate arrives")
	void shouldKeepAnchoredVersion() {
		deduplicator.offer(TestPosts.post("p1", 5_000L), PostOrigin.TIMELINE);
		deduplicator.offer(TestPosts.post("p1", null), PostOrigin.FALLBACK);

		assertThat(deduplicator.posts()).singleElement().satisfies(post -> assertThat(post.isAnchored()).isTrue());
	}

	@Test
	@DisplayName("Should keep first-seen order and report known ids")
	void shouldKeepOrder() {
		deduplicator.offer(TestPosts.post("b"), PostOrigin.TIMELINE);
		deduplicator.offer(TestPosts.post("a"), PostOrigin.REPLIES);
		deduplicator.offer(TestPosts.post("c"), PostOrigin.FALLBACK);

		assertThat(deduplicator.posts()).extracting(Post::id).containsExactly("b", "a", "c");
		assertThat(deduplicator.isKnown("old-2")).isTrue();
		assertThat(deduplicator.isKnown("zzz")).isFalse();
		assertThat(statistics.getPrimaryPosts()).isEqualTo(2);
		assertThat(statistics.getFallbackPosts()).isEqualTo(1);
	}

}
