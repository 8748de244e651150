package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Orchestrates a collection run for one account.
 *
 * <p>
 * Sequence: validate the account, load the post history, authenticate, resolve the
 * profile, run the timeline pass, optionally the reply pass, then the fallback session
 * when the primary path asked for escalation or stayed below the coverage threshold.
 * Finally the history and a progress checkpoint are persisted and the new posts are
 * handed to the {@link PostSink}.
 *
 * <p>
 * Hard failures ({@link ErrorKind#AUTHENTICATION}, {@link ErrorKind#CONFIGURATION} and a
 * failed primary path without a single post) are rethrown after best-effort persistence.
 * Cancellation ends the run early but still persists and delivers what was collected.
 */
public class TimelineCollectionService {

	private static final Logger logger = LoggerFactory.getLogger(TimelineCollectionService.class);

	private static final Pattern ACCOUNT_PATTERN = Pattern.compile("[A-Za-z0-9_]{1,50}");

	private static final String PHASE_INIT = "INIT";

	private final PostSource source;

	private final Supplier<InteractiveSession> sessionFactory;

	private final Function<String, PostHistory> historyFactory;

	private final CheckpointRepository checkpointRepository;

	private final PostSink sink;

	private final PostNormalizer normalizer;

	private final PostFilter filter;

	private final CollectorProperties properties;

	private final Ticker ticker;

	private final Random random;

	public TimelineCollectionService(PostSource source, Supplier<InteractiveSession> sessionFactory,
			Function<String, PostHistory> historyFactory, CheckpointRepository checkpointRepository, PostSink sink,
			PostNormalizer normalizer, PostFilter filter, CollectorProperties properties, Ticker ticker,
			Random random) {
		this.source = source;
		this.sessionFactory = sessionFactory;
		this.historyFactory = historyFactory;
		this.checkpointRepository = checkpointRepository;
		this.sink = sink;
		this.normalizer = normalizer;
		this.filter = filter;
		this.properties = properties;
		this.ticker = ticker;
		this.random = random;
	}

	public CollectionResult run(String account, Credentials credentials) {
		return run(account, credentials, new CancellationToken());
	}

	/**
	 * Run a collection for the account.
	 * @param account account handle, without a leading {@code @}
	 * @param credentials login credentials
	 * @param cancellation token observed at every suspension point
	 * @return the result that was handed to the sink
	 * @throws CollectionException on authentication, configuration or total primary
	 * failure
	 */
	public CollectionResult run(String account, Credentials credentials, CancellationToken cancellation) {
		String handle = validateAccount(account);
		CollectorContext context = new CollectorContext(properties, ticker, cancellation, random);
		PostHistory history = historyFactory.apply(handle);
		history.load();
		PostDeduplicator deduplicator = new PostDeduplicator(history, context.statistics());

		String resumeCursor = loadResumeCursor(handle);
		RunState run = new RunState(handle, resumeCursor);
		logger.info("Starting collection for @{} ({} posts already known)", handle, history.size());

		try {
			authenticate(credentials, context);
			run.profile = resolveProfile(handle, context);

			PrimaryCollector primary = new PrimaryCollector(source, normalizer, deduplicator, context);
			run.primary = primary;
			CheckpointHandler checkpoints = (kind, cursor, batches) -> {
				if (kind == PassKind.TIMELINE) {
					run.cursor = cursor;
				}
				persistHistory(history);
				saveCheckpoint(run, deduplicator, context, false, null);
			};

			run.phase = PassKind.TIMELINE.name();
			PassResult timeline = primary.collectTimeline(run.profile, resumeCursor, checkpoints);
			run.passes.add(timeline);
			run.cursor = timeline.lastCursor();
			boolean escalate = timeline.escalationRequested();

			if (properties.isIncludeReplies() && !timeline.failed()
					&& timeline.stopReason() != PassResult.StopReason.MAX_POSTS) {
				run.phase = PassKind.REPLIES.name();
				PassResult replies = primary.collectReplies(handle, checkpoints);
				run.passes.add(replies);
				escalate |= replies.escalationRequested();
			}

			PassResult failedPass = run.passes.stream().filter(PassResult::failed).findFirst().orElse(null);
			if (failedPass != null && deduplicator.collectedCount() == 0) {
				throw new CollectionException(ErrorKind.TRANSIENT_NETWORK,
						"No posts collected after exhausting retries: " + failedPass.lastError());
			}

			if (deduplicator.collectedCount() < properties.getMaxPosts()
					&& shouldRunFallback(run.profile, history, escalate)) {
				run.phase = ProgressCheckpoint.PHASE_FALLBACK;
				run.fallback = new FallbackCollector(sessionFactory, normalizer, deduplicator, context).collect(handle,
						credentials);
			}

			RunOutcome outcome = failedPass != null || run.fallback.failed() ? RunOutcome.PARTIAL
					: RunOutcome.COMPLETED;
			String error = failedPass != null ? failedPass.lastError() : run.fallback.error();
			return finish(run, deduplicator, context, outcome, error);
		}
		catch (CollectionCancelledException e) {
			logger.warn("Collection for @{} cancelled: {}", handle, e.getMessage());
			if (run.primary != null && PassKind.TIMELINE.name().equals(run.phase)) {
				run.cursor = run.primary.currentCursor();
			}
			return finish(run, deduplicator, context, RunOutcome.CANCELLED, e.getMessage());
		}
		catch (CollectionException e) {
			logger.error("Collection for @{} failed ({}): {}", handle, e.kind(), e.getMessage());
			if (run.primary != null && PassKind.TIMELINE.name().equals(run.phase)) {
				run.cursor = run.primary.currentCursor();
			}
			try {
				if (deduplicator.collectedCount() > 0) {
					deliver(run, deduplicator, context, RunOutcome.FAILED, e.getMessage());
				}
				persistHistory(history);
			}
			catch (RuntimeException sinkFailure) {
				logger.error("Could not deliver the posts collected before the failure: {}", sinkFailure.getMessage());
				e.addSuppressed(sinkFailure);
			}
			saveCheckpoint(run, deduplicator, context, false, e.getMessage());
			throw e;
		}
		finally {
			logout();
		}
	}

	private void logout() {
		try {
			source.deauthenticate();
		}
		catch (RuntimeException e) {
			logger.warn("Logout failed: {}", e.getMessage());
		}
	}

	private String validateAccount(String account) {
		String handle = account.startsWith("@") ? account.substring(1) : account;
		if (!ACCOUNT_PATTERN.matcher(handle).matches()) {
			throw CollectionException.configuration("Invalid account name: '" + account + "'");
		}
		return handle;
	}

	@Nullable
	private String loadResumeCursor(String account) {
		Optional<ProgressCheckpoint> previous = checkpointRepository.load(account);
		if (previous.isEmpty()) {
			return null;
		}
		ProgressCheckpoint checkpoint = previous.get();
		if (checkpoint.isStale(Instant.ofEpochMilli(ticker.currentTimeMillis()), properties.getCheckpointMaxAge())) {
			logger.warn("Ignoring progress checkpoint of @{} from {}: older than {}h", account, checkpoint.timestamp(),
					properties.getCheckpointMaxAge().toHours());
			return null;
		}
		if (checkpoint.canResumeTimeline()) {
			logger.info("Resuming timeline of @{} from cursor {} ({} posts collected by the previous run)", account,
					checkpoint.cursor(), checkpoint.collectedPosts());
			return checkpoint.cursor();
		}
		logger.info("Previous run of @{} finished at {}, starting from the newest post", account,
				checkpoint.timestamp());
		return null;
	}

	private void authenticate(Credentials credentials, CollectorContext context) {
		int attempts = Math.max(1, properties.getLoginRetries());
		CollectionException last = null;
		for (int attempt = 1; attempt <= attempts; attempt++) {
			context.throwIfCancelled();
			try {
				source.authenticate(credentials);
				return;
			}
			catch (CollectionException e) {
				if (e.kind() == ErrorKind.CONFIGURATION) {
					throw e;
				}
				last = e;
				if (attempt < attempts) {
					logger.warn("Login attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
					context.pause(properties.getRetryDelay().multipliedBy(attempt));
				}
			}
		}
		throw new CollectionException(ErrorKind.AUTHENTICATION,
				"Login failed after " + attempts + " attempts: " + (last != null ? last.getMessage() : "unknown"),
				last);
	}

	private AccountProfile resolveProfile(String account, CollectorContext context) {
		int attempts = Math.max(1, properties.getLoginRetries());
		for (int attempt = 1; attempt <= attempts; attempt++) {
			context.throwIfCancelled();
			try {
				AccountProfile profile = source.getProfile(account);
				logger.info("@{} reports {} posts", account,
						profile.hasExpectedCount() ? profile.expectedPostCount() : "an unknown number of");
				return profile;
			}
			catch (CollectionException e) {
				if (e.kind().isFatal()) {
					throw e;
				}
				logger.warn("Profile lookup {}/{} for @{} failed: {}", attempt, attempts, account, e.getMessage());
				if (attempt < attempts) {
					context.pause(properties.getRetryDelay().multipliedBy(attempt));
				}
			}
		}
		logger.warn("Continuing without an expected post count for @{}; fallback only runs on escalation", account);
		return AccountProfile.unknown(account);
	}

	boolean shouldRunFallback(AccountProfile profile, PostHistory history, boolean escalate) {
		if (!properties.isFallbackEnabled()) {
			if (escalate) {
				logger.info("Primary path asked for escalation but the fallback is disabled");
			}
			return false;
		}
		if (escalate) {
			logger.info("Primary path throttled, escalating to fallback");
			return true;
		}
		if (!profile.hasExpectedCount()) {
			return false;
		}
		double coverage = (double) history.size() / profile.expectedPostCount();
		if (coverage < properties.getCoverageThreshold()) {
			logger.info("Coverage {}% is below {}%, running fallback", String.format("%.1f", coverage * 100),
					String.format("%.0f", properties.getCoverageThreshold() * 100));
			return true;
		}
		logger.info("Coverage {}% reached, no fallback needed", String.format("%.1f", coverage * 100));
		return false;
	}

	private CollectionResult finish(RunState run, PostDeduplicator deduplicator, CollectorContext context,
			RunOutcome outcome, @Nullable String error) {
		boolean resumable = outcome == RunOutcome.CANCELLED || run.timelineUnfinished();
		if (!resumable) {
			run.phase = ProgressCheckpoint.PHASE_FINISHED;
		}
		else if (outcome != RunOutcome.CANCELLED) {
			run.phase = PassKind.TIMELINE.name();
		}
		CollectionResult result = deliver(run, deduplicator, context, outcome, error);
		persistHistory(deduplicator.history());
		saveCheckpoint(run, deduplicator, context, !resumable, error);
		return result;
	}

	/**
	 * Hand the new posts of the run to the sink. Runs before the history is saved, so ids
	 * only become known once their posts were written.
	 */
	private CollectionResult deliver(RunState run, PostDeduplicator deduplicator, CollectorContext context,
			RunOutcome outcome, @Nullable String error) {
		List<Post> collected = deduplicator.posts();
		CollectionResult result = new CollectionResult(run.account, run.profile, filter.apply(collected),
				collected.size(), deduplicator.history().size(), context.statistics().toSummary(context.now()),
				outcome, run.passes, run.fallback, error);
		logSummary(result, collected);
		sink.accept(result);
		return result;
	}

	private void persistHistory(PostHistory history) {
		try {
			history.save();
		}
		catch (UncheckedIOException e) {
			logger.error("Could not persist post history: {}", e.getMessage());
		}
	}

	private void saveCheckpoint(RunState run, PostDeduplicator deduplicator, CollectorContext context,
			boolean completed, @Nullable String error) {
		checkpointRepository.save(new ProgressCheckpoint(run.account, run.phase, run.cursor,
				deduplicator.collectedCount(), deduplicator.history().size(),
				context.statistics().toSummary(context.now()), Instant.ofEpochMilli(context.now()), completed, error));
	}

	private void logSummary(CollectionResult result, List<Post> collected) {
		RunSummary summary = result.statistics();
		logger.info("Run summary for @{}: outcome {}", result.account(), result.outcome());
		logger.info("  New posts: {} (timeline {}, replies {}, fallback {}), {} after filtering",
				result.collectedCount(), summary.timelinePosts(), summary.replyPosts(), summary.fallbackPosts(),
				result.posts().size());
		if (result.coverage() >= 0) {
			logger.info("  Known posts: {} of {} expected ({}%)", result.knownPosts(),
					result.profile().expectedPostCount(), String.format("%.1f", result.coverage() * 100));
		}
		else {
			logger.info("  Known posts: {}", result.knownPosts());
		}
		logger.info("  Runtime: {}s, {} posts/min, {} requests, {} rate-limit hits, {} retries, {} skipped records",
				summary.runtime().toSeconds(), String.format("%.1f", summary.postsPerMinute()), summary.requests(),
				summary.rateLimitHits(), summary.retries(), summary.parseErrors());
		if (summary.oldestPost() != null) {
			logger.info("  Date range: {} .. {}", summary.oldestPost(), summary.newestPost());
		}
		collected.stream()
			.max(Comparator.comparingInt(post -> post.engagement().score()))
			.ifPresent(post -> logger.info("  Most engaging new post: {} ({} likes, {} reposts)", post.permalink(),
					post.engagement().likes(), post.engagement().reposts()));
	}

	/**
	 * Mutable state of a run, shared with the checkpoint callback.
	 */
	private static final class RunState {

		private final String account;

		private final List<PassResult> passes = new ArrayList<>();

		private AccountProfile profile;

		private String phase;

		@Nullable
		private String cursor;

		@Nullable
		private PrimaryCollector primary;

		private FallbackResult fallback = FallbackResult.skipped();

		private RunState(String account, @Nullable String resumeCursor) {
			this.account = account;
			this.profile = AccountProfile.unknown(account);
			this.cursor = resumeCursor;
			this.phase = resumeCursor != null ? PassKind.TIMELINE.name() : PHASE_INIT;
		}

		private boolean timelineUnfinished() {
			return passes.stream()
				.filter(pass -> pass.kind() == PassKind.TIMELINE)
				.anyMatch(pass -> pass.stopReason() == PassResult.StopReason.MAX_POSTS
						|| pass.stopReason() == PassResult.StopReason.RATE_LIMITED || pass.failed());
		}

	}

}
