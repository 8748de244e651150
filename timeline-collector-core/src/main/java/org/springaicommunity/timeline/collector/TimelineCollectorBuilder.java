package org.springaicommunity.timeline.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Builder that wires a {@link TimelineCollectionService} without a DI container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // HTTP source from the environment, files under ./timeline-data
 * TimelineCollectionService collector = TimelineCollectorBuilder.create()
 *     .apiUrlFromEnv()
 *     .build();
 *
 * // With custom configuration
 * CollectorProperties props = new CollectorProperties();
 * props.setBatchSize(50);
 * props.setIncludeReplies(false);
 *
 * TimelineCollectionService collector = TimelineCollectorBuilder.create()
 *     .apiUrl("https://timeline.example.com/api")
 *     .properties(props)
 *     .filter(new PostFilterCriteria(...))
 *     .build();
 *
 * // For testing with a synthetic source and a fake clock
 * TimelineCollectionService testCollector = TimelineCollectorBuilder.create()
 *     .postSource(fakeSource)
 *     .ticker(fakeTicker)
 *     .sink(result -> results.add(result))
 *     .build();
 * }
 * </pre>
 */
public class TimelineCollectorBuilder {

	@Nullable
	private String apiUrl;

	private CollectorProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private PostSource postSource;

	@Nullable
	private Supplier<InteractiveSession> sessionFactory;

	@Nullable
	private Function<String, PostHistory> historyFactory;

	@Nullable
	private CheckpointRepository checkpointRepository;

	@Nullable
	private PostSink sink;

	private PostFilterCriteria filterCriteria = PostFilterCriteria.all();

	private Ticker ticker = Ticker.system();

	@Nullable
	private Random random;

	private TimelineCollectorBuilder() {
		this.properties = new CollectorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new TimelineCollectorBuilder
	 */
	public static TimelineCollectorBuilder create() {
		return new TimelineCollectorBuilder();
	}

	/**
	 * Set the base URL of the HTTP timeline API.
	 * @param apiUrl base URL
	 * @return this builder
	 */
	public TimelineCollectorBuilder apiUrl(String apiUrl) {
		this.apiUrl = apiUrl;
		return this;
	}

	/**
	 * Read the API base URL from {@code TIMELINE_API_URL} ({@code .env} or environment).
	 * @return this builder
	 * @throws IllegalStateException if TIMELINE_API_URL is not set
	 */
	public TimelineCollectorBuilder apiUrlFromEnv() {
		this.apiUrl = EnvironmentSupport.get(EnvironmentSupport.API_URL);
		if (this.apiUrl == null) {
			throw new IllegalStateException(
					"TIMELINE_API_URL environment variable is required. Set it to the base URL of the timeline API.");
		}
		return this;
	}

	/**
	 * Set collection properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public TimelineCollectorBuilder properties(@Nullable CollectorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public TimelineCollectorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom PostSource. When provided, no API URL is required.
	 * @param postSource custom source (null to use the HTTP source)
	 * @return this builder
	 */
	public TimelineCollectorBuilder postSource(@Nullable PostSource postSource) {
		this.postSource = postSource;
		return this;
	}

	/**
	 * Set the factory of interactive sessions used by the fallback path.
	 * @param sessionFactory session factory (null to use a search view over the source)
	 * @return this builder
	 */
	public TimelineCollectorBuilder sessionFactory(@Nullable Supplier<InteractiveSession> sessionFactory) {
		this.sessionFactory = sessionFactory;
		return this;
	}

	/**
	 * Set the per-account history factory.
	 * @param historyFactory factory (null to store {@code history.json} under the output
	 * directory)
	 * @return this builder
	 */
	public TimelineCollectorBuilder historyFactory(@Nullable Function<String, PostHistory> historyFactory) {
		this.historyFactory = historyFactory;
		return this;
	}

	/**
	 * Set a custom CheckpointRepository.
	 * @param checkpointRepository repository (null to use the file system)
	 * @return this builder
	 */
	public TimelineCollectorBuilder checkpointRepository(@Nullable CheckpointRepository checkpointRepository) {
		this.checkpointRepository = checkpointRepository;
		return this;
	}

	/**
	 * Set the sink receiving the result of every run.
	 * @param sink sink (null to write {@code posts.json} under the output directory)
	 * @return this builder
	 */
	public TimelineCollectorBuilder sink(@Nullable PostSink sink) {
		this.sink = sink;
		return this;
	}

	/**
	 * Set the filter applied before posts reach the sink.
	 * @param criteria filter criteria
	 * @return this builder
	 */
	public TimelineCollectorBuilder filter(PostFilterCriteria criteria) {
		this.filterCriteria = criteria;
		return this;
	}

	/**
	 * Set the time source. Tests use a fake ticker to avoid real waiting.
	 * @param ticker time source
	 * @return this builder
	 */
	public TimelineCollectorBuilder ticker(Ticker ticker) {
		this.ticker = ticker;
		return this;
	}

	/**
	 * Set the random source used for jitter.
	 * @param random random source (null for an unseeded one)
	 * @return this builder
	 */
	public TimelineCollectorBuilder random(@Nullable Random random) {
		this.random = random;
		return this;
	}

	/**
	 * Build the TimelineCollectionService.
	 * @return configured service
	 * @throws IllegalStateException if neither a source nor an API URL was configured
	 */
	public TimelineCollectionService build() {
		validate();
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		Path outputDir = Paths.get(properties.getOutputDir());

		PostSource source = this.postSource != null ? this.postSource : new HttpPostSource(requireApiUrl(), mapper);
		Supplier<InteractiveSession> sessions = this.sessionFactory != null ? this.sessionFactory
				: () -> new SearchViewSession(source, properties.getBatchSize());
		Function<String, PostHistory> histories = this.historyFactory != null ? this.historyFactory
				: account -> new FileSystemPostHistory(outputDir.resolve(account).resolve("history.json"), mapper,
						ticker);
		CheckpointRepository checkpoints = this.checkpointRepository != null ? this.checkpointRepository
				: new FileSystemCheckpointRepository(outputDir, mapper);
		PostSink postSink = this.sink != null ? this.sink : new FileSystemPostSink(outputDir, mapper);

		return new TimelineCollectionService(source, sessions, histories, checkpoints, postSink, new PostNormalizer(),
				new PostFilter(filterCriteria), properties, ticker, this.random != null ? this.random : new Random());
	}

	private void validate() {
		if (postSource == null && (apiUrl == null || apiUrl.isBlank())) {
			throw new IllegalStateException("An API URL is required. Call apiUrl() or apiUrlFromEnv() first.");
		}
		if (properties.getBatchSize() <= 0) {
			throw new IllegalStateException("batchSize must be positive");
		}
		if (properties.getCoverageThreshold() < 0 || properties.getCoverageThreshold() > 1) {
			throw new IllegalStateException("coverageThreshold must be between 0 and 1");
		}
	}

	private String requireApiUrl() {
		String url = apiUrl;
		if (url == null) {
			throw new IllegalStateException("An API URL is required. Call apiUrl() or apiUrlFromEnv() first.");
		}
		return url;
	}

}
