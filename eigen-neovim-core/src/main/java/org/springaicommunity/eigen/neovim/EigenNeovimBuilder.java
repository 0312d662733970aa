package org.springaicommunity.eigen.neovim;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Builder wiring the crawl and analysis services without any framework.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Crawl with the token from the environment
 * CrawlOrchestrator orchestrator = EigenNeovimBuilder.create()
 *     .tokenFromEnv()
 *     .buildOrchestrator();
 * CrawlResult result = orchestrator.run(CrawlRequest.builder().build());
 *
 * // Analyze the cache, no token needed
 * AnalysisService analysis = EigenNeovimBuilder.create().buildAnalysisService();
 *
 * // For testing with a mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * CrawlOrchestrator testOrchestrator = EigenNeovimBuilder.create()
 *     .httpClient(mockClient)
 *     .cache(new FileSystemConfigCache(tempDir, ObjectMapperFactory.create()))
 *     .checkpointStore(new InMemoryCheckpointStore())
 *     .buildOrchestrator();
 * }
 * </pre>
 *
 * <p>
 * The default client stack is {@link RetryingGitHubClient} around
 * {@link ThrottledGitHubClient} around {@link GitHubHttpClient}. A custom client given to
 * {@link #httpClient(GitHubClient)} is used as is.
 */
public class EigenNeovimBuilder {

	private @Nullable String token;

	private EigenProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable CodeSearchService searchService;

	private @Nullable ConfigCache cache;

	private @Nullable CheckpointStore checkpointStore;

	private Sleeper sleeper = Sleeper.SYSTEM;

	private Clock clock = Clock.systemUTC();

	private EigenNeovimBuilder() {
		this.properties = new EigenProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new EigenNeovimBuilder
	 */
	public static EigenNeovimBuilder create() {
		return new EigenNeovimBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public EigenNeovimBuilder token(@Nullable String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GH_TOKEN} or {@code GITHUB_TOKEN}, in a
	 * {@code .env} file or the environment.
	 * @return this builder
	 * @throws AuthRequiredException if neither is set
	 */
	public EigenNeovimBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.githubToken();
		if (this.token == null) {
			throw new AuthRequiredException(
					"GH_TOKEN or GITHUB_TOKEN is required. Please set your GitHub personal access token.");
		}
		return this;
	}

	/**
	 * Set configuration properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public EigenNeovimBuilder properties(@Nullable EigenProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public EigenNeovimBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public EigenNeovimBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom CodeSearchService. When provided, no GitHubClient is built at all.
	 */
	public EigenNeovimBuilder searchService(@Nullable CodeSearchService searchService) {
		this.searchService = searchService;
		return this;
	}

	/**
	 * Set a custom ConfigCache (null for the file system cache in the configured
	 * directory).
	 */
	public EigenNeovimBuilder cache(@Nullable ConfigCache cache) {
		this.cache = cache;
		return this;
	}

	/**
	 * Set a custom CheckpointStore (null for the configured state file).
	 */
	public EigenNeovimBuilder checkpointStore(@Nullable CheckpointStore checkpointStore) {
		this.checkpointStore = checkpointStore;
		return this;
	}

	/**
	 * Sleeper used for throttling and retry waits.
	 */
	public EigenNeovimBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	public EigenNeovimBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the crawl orchestrator.
	 * @return configured CrawlOrchestrator
	 * @throws AuthRequiredException if no token, client or search service was provided
	 */
	public CrawlOrchestrator buildOrchestrator() {
		return new CrawlOrchestrator(buildSearchService(), resolveCache(), resolveCheckpointStore(), clock);
	}

	/**
	 * Build the code search service (for advanced usage).
	 * @return configured CodeSearchService
	 * @throws AuthRequiredException if no token or client was provided
	 */
	public CodeSearchService buildSearchService() {
		if (searchService != null) {
			return searchService;
		}
		return new GitHubCodeSearchService(resolveClient(), resolveObjectMapper(), properties.getPerPage());
	}

	/**
	 * Build the analysis service. Analysis reads only the cache and needs no token.
	 * @return configured AnalysisService
	 */
	public AnalysisService buildAnalysisService() {
		return new AnalysisService(resolveCache(), new ConfigExtractor(), new NeovimConfigDetector());
	}

	/**
	 * The retry policy for REST and raw content calls, from the properties.
	 */
	public RetryPolicy retryPolicy() {
		return RetryPolicy.builder()
			.maxAttempts(properties.getMaxRetries())
			.baseDelay(Duration.ofMillis(properties.getRetryBaseDelayMillis()))
			.maxDelay(Duration.ofMillis(properties.getRetryMaxDelayMillis()))
			.rateLimitWaitBudget(Duration.ofMinutes(properties.getRateLimitWaitMinutes()))
			.build();
	}

	private GitHubClient resolveClient() {
		if (httpClient != null) {
			return httpClient;
		}
		if (token == null || token.isBlank()) {
			throw new AuthRequiredException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
		RequestThrottle throttle = RequestThrottle.builder()
			.budget(RequestCategory.SEARCH, RequestThrottle.Budget.perMinute(properties.getSearchRequestsPerMinute()))
			.maxResetWait(Duration.ofMinutes(properties.getRateLimitWaitMinutes()))
			.sleeper(sleeper)
			.clock(clock)
			.build();
		GitHubClient http = new GitHubHttpClient(token, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
		RetryPolicy policy = retryPolicy();
		RetryPolicy search = RetryPolicy.forSearch();
		RetryPolicy searchPolicy = RetryPolicy.builder()
			.maxAttempts(search.maxAttempts())
			.baseDelay(search.baseDelay())
			.maxDelay(search.maxDelay())
			.rateLimitWaitBudget(policy.rateLimitWaitBudget())
			.build();
		return RetryingGitHubClient.builder()
			.wrapping(new ThrottledGitHubClient(http, throttle))
			.policy(policy)
			.searchPolicy(searchPolicy)
			.sleeper(sleeper)
			.clock(clock)
			.build();
	}

	private ConfigCache resolveCache() {
		return cache != null ? cache
				: new FileSystemConfigCache(Path.of(properties.getCacheDirectory()), resolveObjectMapper());
	}

	private CheckpointStore resolveCheckpointStore() {
		return checkpointStore != null ? checkpointStore
				: new FileSystemCheckpointStore(Path.of(properties.getStateFile()), resolveObjectMapper());
	}

	private ObjectMapper resolveObjectMapper() {
		return objectMapper != null ? objectMapper : ObjectMapperFactory.create();
	}

}
