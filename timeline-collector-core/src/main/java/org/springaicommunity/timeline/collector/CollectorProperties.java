package org.springaicommunity.timeline.collector;

import java.time.Duration;

/**
 * Configuration properties for timeline collection.
 *
 * <p>
 * Every tunable of the engine lives here: batch sizing, pacing of both collection paths,
 * retry and backoff, the stagnation heuristics and the fallback escalation rules.
 * Properties can be set directly via setters or passed to
 * {@link TimelineCollectorBuilder}.
 *
 * <p>
 * Default values are suitable for most accounts. Lower the pacing only when the source is
 * known to tolerate it.
 */
public class CollectorProperties {

	/**
	 * Base directory for history, progress and output files. Each account gets its own
	 * subdirectory.
	 */
	private String outputDir = "timeline-data";

	/**
	 * Maximum number of records requested per batch.
	 */
	private int batchSize = 100;

	/**
	 * Maximum number of new posts collected in one run.
	 */
	private int maxPosts = 50000;

	/**
	 * Maximum number of consecutive transient failures tolerated before a pass fails.
	 */
	private int maxRetries = 5;

	/**
	 * Base delay between login and profile attempts. Attempt {@code n} waits {@code n}
	 * times this delay.
	 */
	private Duration retryDelay = Duration.ofSeconds(5);

	/**
	 * Number of login attempts before authentication is considered failed.
	 */
	private int loginRetries = 3;

	/**
	 * First backoff delay after a transient failure. Doubles with every further attempt.
	 */
	private Duration backoffBase = Duration.ofSeconds(1);

	/**
	 * Upper bound of any backoff delay.
	 */
	private Duration backoffCap = Duration.ofMinutes(1);

	/**
	 * Fraction of the backoff delay added as random jitter (0 to 1).
	 */
	private double backoffJitter = 0.25;

	/**
	 * Minimum delay between two primary requests.
	 */
	private Duration primaryMinDelay = Duration.ofSeconds(1);

	/**
	 * Primary request budget per rate-limit window.
	 */
	private int primaryMaxRequestsPerWindow = 150;

	/**
	 * Length of the primary rate-limit window.
	 */
	private Duration primaryWindow = Duration.ofMinutes(15);

	/**
	 * Minimum delay between two fallback interactions.
	 */
	private Duration fallbackMinDelay = Duration.ofSeconds(3);

	/**
	 * Fallback interaction budget per rate-limit window.
	 */
	private int fallbackMaxRequestsPerWindow = 60;

	/**
	 * Length of the fallback rate-limit window.
	 */
	private Duration fallbackWindow = Duration.ofMinutes(15);

	/**
	 * Upper bound of the random delay added to every fallback interaction.
	 */
	private Duration fallbackJitter = Duration.ofSeconds(2);

	/**
	 * Pause between two primary batches.
	 */
	private Duration delayBetweenBatches = Duration.ofSeconds(1);

	/**
	 * Number of rate-limit signals in one pass after which the pass ends and asks for the
	 * fallback path.
	 */
	private int rateLimitEscalationThreshold = 3;

	/**
	 * Number of already-known posts in a row after which a pass is considered stagnant.
	 */
	private int maxConsecutiveKnown = 50;

	/**
	 * Time without a new post after which a pass is considered stagnant.
	 */
	private Duration stallTimeout = Duration.ofMinutes(5);

	/**
	 * Number of repeated cursors tolerated before a pass is considered stagnant.
	 */
	private int maxRepeatedCursors = 3;

	/**
	 * Fraction of the expected post count below which the fallback path runs.
	 */
	private double coverageThreshold = 0.8;

	/**
	 * Whether the fallback path may run at all.
	 */
	private boolean fallbackEnabled = true;

	/**
	 * Hard cap on the duration of a fallback session.
	 */
	private Duration fallbackSessionCap = Duration.ofMinutes(30);

	/**
	 * Consecutive fallback extractions without an unseen post after which the fallback
	 * stops.
	 */
	private int maxStagnantFallbackPasses = 3;

	/**
	 * Whether to run the reply search pass after the timeline pass.
	 */
	private boolean includeReplies = true;

	/**
	 * Number of batches between two checkpoints of history and progress.
	 */
	private int checkpointInterval = 10;

	/**
	 * Age after which a progress checkpoint is considered stale and ignored.
	 */
	private Duration checkpointMaxAge = Duration.ofHours(24);

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	/**
	 * Enable debug-level logging output.
	 */
	private boolean debug = false;

	/**
	 * Returns the output base directory.
	 * @return the output base directory
	 */
	public String getOutputDir() {
		return outputDir;
	}

	/**
	 * Sets the output base directory.
	 * @param outputDir the output base directory
	 */
	public void setOutputDir(String outputDir) {
		this.outputDir = outputDir;
	}

	/**
	 * Returns the batch size.
	 * @return the batch size
	 */
	public int getBatchSize() {
		return batchSize;
	}

	/**
	 * Sets the batch size.
	 * @param batchSize the batch size
	 */
	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	/**
	 * Returns the per-run post cap.
	 * @return the per-run post cap
	 */
	public int getMaxPosts() {
		return maxPosts;
	}

	/**
	 * Sets the per-run post cap.
	 * @param maxPosts the per-run post cap
	 */
	public void setMaxPosts(int maxPosts) {
		this.maxPosts = maxPosts;
	}

	/**
	 * Returns the retry budget.
	 * @return the retry budget
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Sets the retry budget.
	 * @param maxRetries the retry budget
	 */
	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	/**
	 * Returns the linear retry delay.
	 * @return the linear retry delay
	 */
	public Duration getRetryDelay() {
		return retryDelay;
	}

	/**
	 * Sets the linear retry delay.
	 * @param retryDelay the linear retry delay
	 */
	public void setRetryDelay(Duration retryDelay) {
		this.retryDelay = retryDelay;
	}

	/**
	 * Returns the number of login attempts.
	 * @return the number of login attempts
	 */
	public int getLoginRetries() {
		return loginRetries;
	}

	/**
	 * Sets the number of login attempts.
	 * @param loginRetries the number of login attempts
	 */
	public void setLoginRetries(int loginRetries) {
		this.loginRetries = loginRetries;
	}

	/**
	 * Returns the initial backoff delay.
	 * @return the initial backoff delay
	 */
	public Duration getBackoffBase() {
		return backoffBase;
	}

	/**
	 * Sets the initial backoff delay.
	 * @param backoffBase the initial backoff delay
	 */
	public void setBackoffBase(Duration backoffBase) {
		this.backoffBase = backoffBase;
	}

	/**
	 * Returns the backoff cap.
	 * @return the backoff cap
	 */
	public Duration getBackoffCap() {
		return backoffCap;
	}

	/**
	 * Sets the backoff cap.
	 * @param backoffCap the backoff cap
	 */
	public void setBackoffCap(Duration backoffCap) {
		this.backoffCap = backoffCap;
	}

	/**
	 * Returns the backoff jitter fraction.
	 * @return the backoff jitter fraction
	 */
	public double getBackoffJitter() {
		return backoffJitter;
	}

	/**
	 * Sets the backoff jitter fraction.
	 * @param backoffJitter the backoff jitter fraction
	 */
	public void setBackoffJitter(double backoffJitter) {
		this.backoffJitter = backoffJitter;
	}

	/**
	 * Returns the primary minimum delay.
	 * @return the primary minimum delay
	 */
	public Duration getPrimaryMinDelay() {
		return primaryMinDelay;
	}

	/**
	 * Sets the primary minimum delay.
	 * @param primaryMinDelay the primary minimum delay
	 */
	public void setPrimaryMinDelay(Duration primaryMinDelay) {
		this.primaryMinDelay = primaryMinDelay;
	}

	/**
	 * Returns the primary request budget.
	 * @return the primary request budget
	 */
	public int getPrimaryMaxRequestsPerWindow() {
		return primaryMaxRequestsPerWindow;
	}

	/**
	 * Sets the primary request budget.
	 * @param primaryMaxRequestsPerWindow the primary request budget
	 */
	public void setPrimaryMaxRequestsPerWindow(int primaryMaxRequestsPerWindow) {
		this.primaryMaxRequestsPerWindow = primaryMaxRequestsPerWindow;
	}

	/**
	 * Returns the primary window.
	 * @return the primary window
	 */
	public Duration getPrimaryWindow() {
		return primaryWindow;
	}

	/**
	 * Sets the primary window.
	 * @param primaryWindow the primary window
	 */
	public void setPrimaryWindow(Duration primaryWindow) {
		this.primaryWindow = primaryWindow;
	}

	/**
	 * Returns the fallback minimum delay.
	 * @return the fallback minimum delay
	 */
	public Duration getFallbackMinDelay() {
		return fallbackMinDelay;
	}

	/**
	 * Sets the fallback minimum delay.
	 * @param fallbackMinDelay the fallback minimum delay
	 */
	public void setFallbackMinDelay(Duration fallbackMinDelay) {
		this.fallbackMinDelay = fallbackMinDelay;
	}

	/**
	 * Returns the fallback request budget.
	 * @return the fallback request budget
	 */
	public int getFallbackMaxRequestsPerWindow() {
		return fallbackMaxRequestsPerWindow;
	}

	/**
	 * Sets the fallback request budget.
	 * @param fallbackMaxRequestsPerWindow the fallback request budget
	 */
	public void setFallbackMaxRequestsPerWindow(int fallbackMaxRequestsPerWindow) {
		this.fallbackMaxRequestsPerWindow = fallbackMaxRequestsPerWindow;
	}

	/**
	 * Returns the fallback window.
	 * @return the fallback window
	 */
	public Duration getFallbackWindow() {
		return fallbackWindow;
	}

	/**
	 * Sets the fallback window.
	 * @param fallbackWindow the fallback window
	 */
	public void setFallbackWindow(Duration fallbackWindow) {
		this.fallbackWindow = fallbackWindow;
	}

	/**
	 * Returns the fallback jitter.
	 * @return the fallback jitter
	 */
	public Duration getFallbackJitter() {
		return fallbackJitter;
	}

	/**
	 * Sets the fallback jitter.
	 * @param fallbackJitter the fallback jitter
	 */
	public void setFallbackJitter(Duration fallbackJitter) {
		this.fallbackJitter = fallbackJitter;
	}

	/**
	 * Returns the inter-batch pause.
	 * @return the inter-batch pause
	 */
	public Duration getDelayBetweenBatches() {
		return delayBetweenBatches;
	}

	/**
	 * Sets the inter-batch pause.
	 * @param delayBetweenBatches the inter-batch pause
	 */
	public void setDelayBetweenBatches(Duration delayBetweenBatches) {
		this.delayBetweenBatches = delayBetweenBatches;
	}

	/**
	 * Returns the escalation threshold.
	 * @return the escalation threshold
	 */
	public int getRateLimitEscalationThreshold() {
		return rateLimitEscalationThreshold;
	}

	/**
	 * Sets the escalation threshold.
	 * @param rateLimitEscalationThreshold the escalation threshold
	 */
	public void setRateLimitEscalationThreshold(int rateLimitEscalationThreshold) {
		this.rateLimitEscalationThreshold = rateLimitEscalationThreshold;
	}

	/**
	 * Returns the consecutive-known threshold.
	 * @return the consecutive-known threshold
	 */
	public int getMaxConsecutiveKnown() {
		return maxConsecutiveKnown;
	}

	/**
	 * Sets the consecutive-known threshold.
	 * @param maxConsecutiveKnown the consecutive-known threshold
	 */
	public void setMaxConsecutiveKnown(int maxConsecutiveKnown) {
		this.maxConsecutiveKnown = maxConsecutiveKnown;
	}

	/**
	 * Returns the stall timeout.
	 * @return the stall timeout
	 */
	public Duration getStallTimeout() {
		return stallTimeout;
	}

	/**
	 * Sets the stall timeout.
	 * @param stallTimeout the stall timeout
	 */
	public void setStallTimeout(Duration stallTimeout) {
		this.stallTimeout = stallTimeout;
	}

	/**
	 * Returns the repeated cursor limit.
	 * @return the repeated cursor limit
	 */
	public int getMaxRepeatedCursors() {
		return maxRepeatedCursors;
	}

	/**
	 * Sets the repeated cursor limit.
	 * @param maxRepeatedCursors the repeated cursor limit
	 */
	public void setMaxRepeatedCursors(int maxRepeatedCursors) {
		this.maxRepeatedCursors = maxRepeatedCursors;
	}

	/**
	 * Returns the coverage threshold.
	 * @return the coverage threshold
	 */
	public double getCoverageThreshold() {
		return coverageThreshold;
	}

	/**
	 * Sets the coverage threshold.
	 * @param coverageThreshold the coverage threshold
	 */
	public void setCoverageThreshold(double coverageThreshold) {
		this.coverageThreshold = coverageThreshold;
	}

	/**
	 * Returns true if the fallback path is enabled.
	 * @return true if the fallback path is enabled
	 */
	public boolean isFallbackEnabled() {
		return fallbackEnabled;
	}

	/**
	 * Sets true if the fallback path is enabled.
	 * @param fallbackEnabled true if the fallback path is enabled
	 */
	public void setFallbackEnabled(boolean fallbackEnabled) {
		this.fallbackEnabled = fallbackEnabled;
	}

	/**
	 * Returns the fallback session cap.
	 * @return the fallback session cap
	 */
	public Duration getFallbackSessionCap() {
		return fallbackSessionCap;
	}

	/**
	 * Sets the fallback session cap.
	 * @param fallbackSessionCap the fallback session cap
	 */
	public void setFallbackSessionCap(Duration fallbackSessionCap) {
		this.fallbackSessionCap = fallbackSessionCap;
	}

	/**
	 * Returns the stagnant pass limit.
	 * @return the stagnant pass limit
	 */
	public int getMaxStagnantFallbackPasses() {
		return maxStagnantFallbackPasses;
	}

	/**
	 * Sets the stagnant pass limit.
	 * @param maxStagnantFallbackPasses the stagnant pass limit
	 */
	public void setMaxStagnantFallbackPasses(int maxStagnantFallbackPasses) {
		this.maxStagnantFallbackPasses = maxStagnantFallbackPasses;
	}

	/**
	 * Returns true if replies are collected.
	 * @return true if replies are collected
	 */
	public boolean isIncludeReplies() {
		return includeReplies;
	}

	/**
	 * Sets true if replies are collected.
	 * @param includeReplies true if replies are collected
	 */
	public void setIncludeReplies(boolean includeReplies) {
		this.includeReplies = includeReplies;
	}

	/**
	 * Returns the checkpoint interval.
	 * @return the checkpoint interval
	 */
	public int getCheckpointInterval() {
		return checkpointInterval;
	}

	/**
	 * Sets the checkpoint interval.
	 * @param checkpointInterval the checkpoint interval
	 */
	public void setCheckpointInterval(int checkpointInterval) {
		this.checkpointInterval = checkpointInterval;
	}

	/**
	 * Returns the checkpoint max age.
	 * @return the checkpoint max age
	 */
	public Duration getCheckpointMaxAge() {
		return checkpointMaxAge;
	}

	/**
	 * Sets the checkpoint max age.
	 * @param checkpointMaxAge the checkpoint max age
	 */
	public void setCheckpointMaxAge(Duration checkpointMaxAge) {
		this.checkpointMaxAge = checkpointMaxAge;
	}

	/**
	 * Returns true if verbose logging is enabled.
	 * @return true if verbose logging is enabled
	 */
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * Sets true if verbose logging is enabled.
	 * @param verbose true if verbose logging is enabled
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/**
	 * Returns true if debug logging is enabled.
	 * @return true if debug logging is enabled
	 */
	public boolean isDebug() {
		return debug;
	}

	/**
	 * Sets true if debug logging is enabled.
	 * @param debug true if debug logging is enabled
	 */
	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	/**
	 * Pacing of the primary collector.
	 * @return rate limiter configuration for the primary path
	 */
	public RateLimiterConfig primaryRateLimiterConfig() {
		return new RateLimiterConfig(primaryMinDelay, primaryMaxRequestsPerWindow, primaryWindow);
	}

	/**
	 * Pacing of the fallback collector.
	 * @return rate limiter configuration for the fallback path
	 */
	public RateLimiterConfig fallbackRateLimiterConfig() {
		return new RateLimiterConfig(fallbackMinDelay, fallbackMaxRequestsPerWindow, fallbackWindow, fallbackJitter);
	}

}
