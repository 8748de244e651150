package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Account to collect (positional)
	@Nullable
	public String account;

	// Source
	@Nullable
	public String apiUrl;

	// Output and batching
	public String outputDir;

	public int batchSize;

	public int maxPosts;

	// Collection paths
	public boolean includeReplies;

	public boolean fallbackEnabled;

	public double coverageThreshold;

	// Logging
	public boolean verbose = false;

	public boolean debug = false;

	public boolean helpRequested = false;

	// Post filtering
	public Set<PostFilterCriteria.PostType> postTypes = EnumSet.allOf(PostFilterCriteria.PostType.class);

	public int minLikes = 0;

	public int minReposts = 0;

	@Nullable
	public LocalDate startDate = null;

	@Nullable
	public LocalDate endDate = null;

	public List<String> excludedKeywords = new ArrayList<>();

	public ParsedConfiguration(CollectorProperties defaultProperties) {
		this.outputDir = defaultProperties.getOutputDir();
		this.batchSize = defaultProperties.getBatchSize();
		this.maxPosts = defaultProperties.getMaxPosts();
		this.includeReplies = defaultProperties.isIncludeReplies();
		this.fallbackEnabled = defaultProperties.isFallbackEnabled();
		this.coverageThreshold = defaultProperties.getCoverageThreshold();
		this.verbose = defaultProperties.isVerbose();
		this.debug = defaultProperties.isDebug();
	}

	/**
	 * Copy the command-line overrides onto the properties used for the run.
	 * @param properties properties to update
	 * @return the same properties
	 */
	public CollectorProperties applyTo(CollectorProperties properties) {
		properties.setOutputDir(outputDir);
		properties.setBatchSize(batchSize);
		properties.setMaxPosts(maxPosts);
		properties.setIncludeReplies(includeReplies);
		properties.setFallbackEnabled(fallbackEnabled);
		properties.setCoverageThreshold(coverageThreshold);
		properties.setVerbose(verbose);
		properties.setDebug(debug);
		return properties;
	}

	public PostFilterCriteria toFilterCriteria() {
		return new PostFilterCriteria(postTypes, minLikes, minReposts, startDate, endDate, excludedKeywords);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "account='" + account + '\'' + ", apiUrl='" + apiUrl + '\'' + ", outputDir='"
				+ outputDir + '\'' + ", batchSize=" + batchSize + ", maxPosts=" + maxPosts + ", includeReplies="
				+ includeReplies + ", fallbackEnabled=" + fallbackEnabled + ", coverageThreshold=" + coverageThreshold
				+ ", verbose=" + verbose + ", debug=" + debug + ", helpRequested=" + helpRequested + ", postTypes="
				+ postTypes + ", minLikes=" + minLikes + ", minReposts=" + minReposts + ", startDate=" + startDate
				+ ", endDate=" + endDate + ", excludedKeywords=" + excludedKeywords + '}';
	}

}
