package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Walks the source's paginated API in batches.
 *
 * <p>
 * Each pass is a small state machine:
 *
 * <pre>
 * INIT -> FETCHING -> EVALUATING -> FETCHING | DONE
 *            |  ^
 *            v  |
 *          BACKOFF            (too many failures) -> FAILED
 * </pre>
 *
 * Requests are paced by a private {@link RateLimiter}; transient failures are retried
 * with {@link ExponentialBackoff}; the pass ends when the {@link TimelineTracker}
 * reports no forward progress, the source runs dry, the per-run cap is reached or the
 * rate-limit signals cross the escalation threshold. Every post goes through the shared
 * {@link PostDeduplicator}.
 */
public class PrimaryCollector {

	private static final Logger logger = LoggerFactory.getLogger(PrimaryCollector.class);

	private final PostSource source;

	private final PostNormalizer normalizer;

	private final PostDeduplicator deduplicator;

	private final CollectorContext context;

	private final CollectorProperties properties;

	private final RateLimiter rateLimiter;

	private final ExponentialBackoff backoff;

	private final TimelineTracker tracker;

	private PassState state = PassState.INIT;

	@Nullable
	private String currentCursor;

	public PrimaryCollector(PostSource source, PostNormalizer normalizer, PostDeduplicator deduplicator,
			CollectorContext context) {
		this.source = source;
		this.normalizer = normalizer;
		this.deduplicator = deduplicator;
		this.context = context;
		this.properties = context.properties();
		this.rateLimiter = new RateLimiter("primary", properties.primaryRateLimiterConfig(), context);
		this.backoff = new ExponentialBackoff(properties.getBackoffBase(), properties.getBackoffCap(),
				properties.getBackoffJitter(), context);
		this.tracker = TimelineTracker.from(properties, context.ticker());
	}

	/**
	 * Collect the account's timeline.
	 * @param profile account profile; the expected count only drives progress reporting
	 * @param startCursor cursor to resume from, or null to start at the newest post
	 * @param checkpoints called every {@code checkpointInterval} batches
	 * @return outcome of the pass
	 * @throws CollectionException for authentication or configuration failures
	 * @throws CollectionCancelledException if the run is cancelled
	 */
	public PassResult collectTimeline(AccountProfile profile, @Nullable String startCursor,
			CheckpointHandler checkpoints) {
		String account = profile.account();
		return runPass(PassKind.TIMELINE, account, profile.expectedPostCount(),
				cursor -> source.fetchTimeline(account, properties.getBatchSize(), cursor), startCursor, checkpoints);
	}

	/**
	 * Collect replies written by the account through the search query
	 * {@code from:<account> filter:replies}.
	 * @param account account handle
	 * @param checkpoints called every {@code checkpointInterval} batches
	 * @return outcome of the pass
	 */
	public PassResult collectReplies(String account, CheckpointHandler checkpoints) {
		String query = PostSource.repliesQuery(account);
		return runPass(PassKind.REPLIES, account, 0,
				cursor -> source.searchPosts(query, properties.getBatchSize(), cursor), null, checkpoints);
	}

	public PassState state() {
		return state;
	}

	/**
	 * Cursor of the running or last pass, the position a later run can continue from.
	 * @return the cursor, or null before the first batch
	 */
	@Nullable
	public String currentCursor() {
		return currentCursor;
	}

	public TimelineTracker.Progress progress() {
		return tracker.progress();
	}

	private PassResult runPass(PassKind kind, String account, int expected, PageFetcher fetcher,
			@Nullable String startCursor, CheckpointHandler checkpoints) {
		RunStatistics statistics = context.statistics();
		PassProgress pass = new PassProgress(startCursor);
		tracker.reset();
		backoff.reset();
		currentCursor = startCursor;
		state = PassState.INIT;
		logger.info("Starting {} pass for @{} (expected posts: {}, cursor: {})", kind, account,
				expected > 0 ? expected : "unknown", startCursor != null ? startCursor : "newest");

		SourcePage page = SourcePage.empty();
		state = PassState.FETCHING;
		while (!state.isTerminal()) {
			switch (state) {
				case FETCHING -> {
					context.throwIfCancelled();
					if (deduplicator.collectedCount() >= properties.getMaxPosts()) {
						pass.stop(PassResult.StopReason.MAX_POSTS);
						state = PassState.DONE;
					}
					else {
						rateLimiter.acquire();
						statistics.recordRequest();
						try {
							page = fetcher.fetch(pass.cursor);
							pass.consecutiveFailures = 0;
							backoff.reset();
							state = PassState.EVALUATING;
						}
						catch (CollectionException e) {
							state = onFetchFailure(kind, pass, e);
						}
					}
				}
				case BACKOFF -> {
					Duration delay = backoff.nextDelay();
					logger.warn("{} pass: transient failure ({}), retry {}/{} in {}ms", kind, pass.lastError,
							pass.consecutiveFailures, properties.getMaxRetries(), delay.toMillis());
					context.pause(delay);
					state = PassState.FETCHING;
				}
				case EVALUATING -> state = evaluate(kind, account, expected, page, pass, checkpoints);
				default -> throw new IllegalStateException("Unexpected state " + state);
			}
		}

		PassResult result = new PassResult(kind, state,
				pass.stopReason != null ? pass.stopReason : PassResult.StopReason.EXHAUSTED, pass.batches,
				pass.recordsSeen, pass.newPosts, pass.cursor, pass.lastError);
		TimelineTracker.Progress progress = tracker.progress();
		logger.info("{} pass finished in state {} ({}): {} batches, {} records, {} new posts, range {} .. {}", kind,
				result.finalState(), result.stopReason(), result.batches(), result.recordsSeen(), result.newPosts(),
				progress.oldest(), progress.newest());
		return result;
	}

	private PassState onFetchFailure(PassKind kind, PassProgress pass, CollectionException e) {
		if (!e.kind().isRetryable()) {
			throw e;
		}
		switch (e.kind()) {
			case RATE_LIMIT -> {
				context.statistics().recordRateLimitHit();
				pass.rateLimitHits++;
				rateLimiter.handleRateLimit();
				if (pass.rateLimitHits >= properties.getRateLimitEscalationThreshold()) {
					logger.warn("{} pass rate limited {} times, requesting escalation", kind, pass.rateLimitHits);
					pass.lastError = e.getMessage();
					pass.stop(PassResult.StopReason.RATE_LIMITED);
					return PassState.DONE;
				}
				return PassState.FETCHING;
			}
			case TRANSIENT_NETWORK -> {
				pass.consecutiveFailures++;
				pass.lastError = e.getMessage();
				if (pass.consecutiveFailures > properties.getMaxRetries()) {
					logger.error("{} pass failed after {} consecutive failures: {}", kind, pass.consecutiveFailures,
							e.getMessage());
					pass.stop(PassResult.StopReason.RETRIES_EXHAUSTED);
					return PassState.FAILED;
				}
				context.statistics().recordRetry();
				return PassState.BACKOFF;
			}
			default -> throw e;
		}
	}

	private PassState evaluate(PassKind kind, String account, int expected, SourcePage page, PassProgress pass,
			CheckpointHandler checkpoints) {
		pass.batches++;
		if (page.isEmpty()) {
			logger.info("{} pass: source returned an empty batch", kind);
			pass.stop(PassResult.StopReason.EXHAUSTED);
			return PassState.DONE;
		}

		int newInBatch = 0;
		String lastId = null;
		PassResult.StopReason stop = null;
		for (JsonNode raw : page.items()) {
			pass.recordsSeen++;
			Post post;
			try {
				post = normalizer.normalize(raw, account);
			}
			catch (CollectionException e) {
				if (e.kind() != ErrorKind.RECORD_PARSE) {
					throw e;
				}
				context.statistics().recordParseError();
				logger.warn("Skipping record: {}", e.getMessage());
				continue;
			}
			lastId = post.id();
			boolean added = deduplicator.offer(post, kind.origin());
			tracker.trackPost(post, added);
			if (added) {
				newInBatch++;
				pass.newPosts++;
			}
			if (tracker.isStuck()) {
				stop = PassResult.StopReason.STAGNATED;
				break;
			}
			if (deduplicator.collectedCount() >= properties.getMaxPosts()) {
				stop = PassResult.StopReason.MAX_POSTS;
				break;
			}
		}

		String nextCursor = nextCursor(kind, page, lastId, pass.cursor);
		pass.cursor = nextCursor;
		currentCursor = nextCursor;
		logBatch(kind, expected, pass, newInBatch, page.items().size());

		if (stop != null) {
			if (stop == PassResult.StopReason.STAGNATED) {
				logger.info("{} pass stagnated: {}", kind, tracker.stuckReason());
			}
			pass.stop(stop);
			return PassState.DONE;
		}
		if (kind == PassKind.REPLIES && page.nextCursor() == null) {
			logger.info("{} pass: source reports no further page", kind);
			pass.stop(PassResult.StopReason.EXHAUSTED);
			return PassState.DONE;
		}
		tracker.trackCursor(nextCursor);
		if (tracker.isStuck()) {
			logger.info("{} pass stagnated: {}", kind, tracker.stuckReason());
			pass.stop(PassResult.StopReason.STAGNATED);
			return PassState.DONE;
		}

		if (properties.getCheckpointInterval() > 0 && pass.batches % properties.getCheckpointInterval() == 0) {
			checkpoints.onCheckpoint(kind, pass.cursor, pass.batches);
		}
		context.pause(properties.getDelayBetweenBatches());
		return PassState.FETCHING;
	}

	@Nullable
	private static String nextCursor(PassKind kind, SourcePage page, @Nullable String lastId,
			@Nullable String current) {
		if (kind == PassKind.REPLIES && page.nextCursor() != null) {
			return page.nextCursor();
		}
		return lastId != null ? lastId : current;
	}

	private void logBatch(PassKind kind, int expected, PassProgress pass, int newInBatch, int batchSize) {
		int total = deduplicator.history().size();
		if (expected > 0) {
			logger.info("{} batch {}: {} new of {} records, {} known posts ({}% of {})", kind, pass.batches,
					newInBatch, batchSize, total, String.format("%.1f", total * 100.0 / expected), expected);
		}
		else {
			logger.info("{} batch {}: {} new of {} records, {} known posts", kind, pass.batches, newInBatch,
					batchSize, total);
		}
		logger.debug("{} cursor now {}, {} consecutive known", kind, pass.cursor, tracker.consecutiveKnownCount());
	}

	@FunctionalInterface
	private interface PageFetcher {

		SourcePage fetch(@Nullable String cursor);

	}

	/**
	 * Mutable bookkeeping of a running pass.
	 */
	private static final class PassProgress {

		@Nullable
		private String cursor;

		private int batches;

		private int recordsSeen;

		private int newPosts;

		private int rateLimitHits;

		private int consecutiveFailures;

		@Nullable
		private String lastError;

		private PassResult.@Nullable StopReason stopReason;

		private PassProgress(@Nullable String cursor) {
			this.cursor = cursor;
		}

		private void stop(PassResult.StopReason reason) {
			this.stopReason = reason;
		}

	}

}
