package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Secondary, low-throughput collection path through an {@link InteractiveSession}.
 *
 * <p>
 * Runs under its own, looser {@link RateLimiter} with random jitter and a hard session
 * duration cap. The session stops after {@code maxStagnantFallbackPasses} consecutive
 * extractions that show nothing unseen in this session. Any failure is reported as
 * {@link ErrorKind#FALLBACK} in the result and never propagates; cancellation does.
 */
public class FallbackCollector {

	private static final Logger logger = LoggerFactory.getLogger(FallbackCollector.class);

	private final Supplier<InteractiveSession> sessionFactory;

	private final PostNormalizer normalizer;

	private final PostDeduplicator deduplicator;

	private final CollectorContext context;

	private final RateLimiter rateLimiter;

	public FallbackCollector(Supplier<InteractiveSession> sessionFactory, PostNormalizer normalizer,
			PostDeduplicator deduplicator, CollectorContext context) {
		this.sessionFactory = sessionFactory;
		this.normalizer = normalizer;
		this.deduplicator = deduplicator;
		this.context = context;
		this.rateLimiter = new RateLimiter("fallback", context.properties().fallbackRateLimiterConfig(), context);
	}

	/**
	 * Run one fallback session for the account.
	 * @param account account handle
	 * @param credentials credentials for the interactive session
	 * @return outcome of the session
	 * @throws CollectionCancelledException if the run is cancelled
	 */
	public FallbackResult collect(String account, Credentials credentials) {
		CollectorProperties properties = context.properties();
		long deadline = context.now() + properties.getFallbackSessionCap().toMillis();
		Set<String> seenThisSession = new HashSet<>();
		int passes = 0;
		int newPosts = 0;
		int stagnantPasses = 0;

		logger.info("Starting fallback session for @{} (cap {} min)", account,
				properties.getFallbackSessionCap().toMinutes());
		try (InteractiveSession session = sessionFactory.get()) {
			rateLimiter.acquire();
			session.authenticate(credentials);
			rateLimiter.acquire();
			session.navigateTo("from:" + account);

			while (true) {
				if (context.now() >= deadline) {
					logger.info("Fallback session cap reached after {} passes", passes);
					return finish(passes, newPosts, FallbackResult.StopReason.SESSION_CAP);
				}
				rateLimiter.acquire();
				context.statistics().recordRequest();
				List<JsonNode> visible = session.extractVisible();
				passes++;

				int unseen = 0;
				for (JsonNode raw : visible) {
					if (deduplicator.collectedCount() >= properties.getMaxPosts()) {
						break;
					}
					Post post;
					try {
						post = normalizer.normalize(raw, account);
					}
					catch (CollectionException e) {
						if (e.kind() != ErrorKind.RECORD_PARSE) {
							throw e;
						}
						context.statistics().recordParseError();
						logger.warn("Skipping fallback record: {}", e.getMessage());
						continue;
					}
					if (seenThisSession.add(post.id())) {
						unseen++;
					}
					if (deduplicator.offer(post, PostOrigin.FALLBACK)) {
						newPosts++;
					}
				}
				logger.info("Fallback pass {}: {} visible, {} unseen, {} new posts so far", passes, visible.size(),
						unseen, newPosts);

				if (deduplicator.collectedCount() >= properties.getMaxPosts()) {
					return finish(passes, newPosts, FallbackResult.StopReason.MAX_POSTS);
				}
				stagnantPasses = unseen == 0 ? stagnantPasses + 1 : 0;
				if (stagnantPasses >= properties.getMaxStagnantFallbackPasses()) {
					logger.info("Fallback stagnated after {} passes without unseen posts", stagnantPasses);
					return finish(passes, newPosts, FallbackResult.StopReason.STAGNATED);
				}

				rateLimiter.acquire();
				if (!session.revealMore()) {
					logger.info("Fallback view has nothing more to reveal");
					return finish(passes, newPosts, FallbackResult.StopReason.EXHAUSTED);
				}
			}
		}
		catch (CollectionCancelledException e) {
			throw e;
		}
		catch (RuntimeException e) {
			CollectionException failure = new CollectionException(ErrorKind.FALLBACK,
					"Fallback session failed: " + e.getMessage(), e);
			logger.warn("{}; keeping {} posts collected so far", failure.getMessage(), newPosts);
			return new FallbackResult(passes, newPosts, FallbackResult.StopReason.FAILED, failure.getMessage());
		}
	}

	private static FallbackResult finish(int passes, int newPosts, FallbackResult.StopReason reason) {
		return new FallbackResult(passes, newPosts, reason, null);
	}

}
