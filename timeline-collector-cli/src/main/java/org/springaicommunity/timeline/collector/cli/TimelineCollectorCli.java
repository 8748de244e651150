package org.springaicommunity.timeline.collector.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.timeline.collector.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Timeline Collector CLI Application
 *
 * Plain Java command-line application that incrementally collects the posts of one
 * account. Uses TimelineCollectorBuilder for service wiring.
 *
 * Usage: java -jar timeline-collector-cli.jar [OPTIONS] &lt;account&gt;
 *
 * Environment Variables: TIMELINE_USERNAME, TIMELINE_PASSWORD (required),
 * TIMELINE_EMAIL, TIMELINE_API_URL
 *
 * Exit codes: 0 when the run completed (possibly partially), 1 on configuration or
 * collection failure, 130 when interrupted.
 */
public class TimelineCollectorCli {

	private static final Logger logger = LoggerFactory.getLogger(TimelineCollectorCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_CANCELLED = 130;

	public static void main(String[] args) {
		CancellationToken cancellation = new CancellationToken();
		CountDownLatch finished = new CountDownLatch(1);
		Thread mainThread = Thread.currentThread();
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			if (finished.getCount() > 0) {
				cancellation.cancel("shutdown requested");
				mainThread.interrupt();
				try {
					// Let the run persist its history and checkpoint before the JVM halts
					finished.await(30, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
		}, "timeline-collector-shutdown"));

		int exitCode;
		try {
			exitCode = run(args, cancellation);
		}
		catch (Exception e) {
			logger.error("Collection failed: {}", e.getMessage());
			exitCode = EXIT_FAILURE;
		}
		finally {
			finished.countDown();
		}
		if (exitCode != EXIT_OK && !cancellation.isCancelled()) {
			System.exit(exitCode);
		}
		else if (exitCode != EXIT_OK) {
			// System.exit blocks while the shutdown sequence is running
			Runtime.getRuntime().halt(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, new CancellationToken());
	}

	static int run(String[] args, CancellationToken cancellation) {
		CollectorProperties properties = new CollectorProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		Credentials credentials;
		try {
			config = argumentParser.parseAndValidate(args);
			credentials = argumentParser.validateEnvironment(config);
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			logger.error(e.getMessage());
			logger.info("Run with --help for usage");
			return EXIT_FAILURE;
		}

		configureLogLevel(config);
		config.applyTo(properties);
		logConfiguration(config);

		String account = config.account;
		String apiUrl = config.apiUrl;
		if (account == null || apiUrl == null) {
			logger.error("Account and API URL are required");
			return EXIT_FAILURE;
		}

		TimelineCollectionService service = TimelineCollectorBuilder.create()
			.apiUrl(apiUrl)
			.properties(properties)
			.filter(config.toFilterCriteria())
			.build();

		CollectionResult result;
		try {
			result = service.run(account, credentials, cancellation);
		}
		catch (CollectionException e) {
			logger.error("Collection failed ({}): {}", e.kind(), e.getMessage());
			return EXIT_FAILURE;
		}

		logResults(result, config.verbose);
		return result.outcome() == RunOutcome.CANCELLED ? EXIT_CANCELLED : EXIT_OK;
	}

	private static void configureLogLevel(ParsedConfiguration config) {
		if (!config.verbose && !config.debug) {
			return;
		}
		org.slf4j.Logger collectorLogger = LoggerFactory.getLogger("org.springaicommunity.timeline");
		if (collectorLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(config.debug ? Level.TRACE : Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Account: @{}", config.account);
		logger.info("  API URL: {}", config.apiUrl);
		logger.info("  Output directory: {}", config.outputDir);
		logger.info("  Batch size: {}", config.batchSize);
		logger.info("  Max posts: {}", config.maxPosts);
		logger.info("  Include replies: {}", config.includeReplies);
		logger.info("  Fallback: {}", config.fallbackEnabled ? "enabled" : "disabled");
		logger.info("  Coverage threshold: {}", config.coverageThreshold);
		if (config.verbose) {
			logger.info("  Post types: {}", config.postTypes);
			logger.info("  Min likes: {}", config.minLikes);
			logger.info("  Min reposts: {}", config.minReposts);
			logger.info("  Start date: {}", config.startDate != null ? config.startDate : "(not set)");
			logger.info("  End date: {}", config.endDate != null ? config.endDate : "(not set)");
			logger.info("  Excluded keywords: {}", config.excludedKeywords);
		}
	}

	private static void logResults(CollectionResult result, boolean verbose) {
		switch (result.outcome()) {
			case COMPLETED -> logger.info("Collection completed successfully!");
			case PARTIAL -> logger.warn("Collection completed partially: {}", result.error());
			case CANCELLED -> logger.warn("Collection cancelled: {}", result.error());
			case FAILED -> logger.error("Collection failed: {}", result.error());
		}
		logger.info("New posts: {}", result.collectedCount());
		logger.info("Posts after filtering: {}", result.posts().size());
		logger.info("Known posts: {}", result.knownPosts());
		if (result.coverage() >= 0) {
			logger.info("Coverage: {}%", String.format("%.1f", result.coverage() * 100));
		}

		if (verbose) {
			for (PassResult pass : result.passes()) {
				logger.info("  - {} pass: {} ({}), {} batches, {} new posts", pass.kind(), pass.finalState(),
						pass.stopReason(), pass.batches(), pass.newPosts());
			}
			if (result.fallback().stopReason() != FallbackResult.StopReason.SKIPPED) {
				logger.info("  - fallback: {} ({} passes, {} new posts)", result.fallback().stopReason(),
						result.fallback().passes(), result.fallback().newPosts());
			}
		}
	}

}
