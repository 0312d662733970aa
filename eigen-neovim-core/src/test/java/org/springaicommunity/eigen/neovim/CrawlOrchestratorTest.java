package org.springaicommunity.eigen.neovim;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.eigen.neovim.CrawlResult.StopReason;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CrawlOrchestrator}.
 *
 * Runs crawls against an in-memory search service and a real file system cache.
 */
@DisplayName("CrawlOrchestrator Tests")
class CrawlOrchestratorTest {

	@TempDir
	Path tempDir;

	private FakeSearchService search;

	private FileSystemConfigCache cache;

	private InMemoryCheckpointStore store;

	private CrawlOrchestrator orchestrator;

	private final QueryStrategy first = new QueryStrategy("filename:init.lua path:nvim", QueryStrategy.Kind.PATH);

	private final QueryStrategy second = new QueryStrategy("filename:init.lua stars:>1000",
			QueryStrategy.Kind.POPULARITY);

	@BeforeEach
	void setUp() {
		search = new FakeSearchService();
		cache = new FileSystemConfigCache(tempDir.resolve("data"), ObjectMapperFactory.create());
		store = new InMemoryCheckpointStore();
		orchestrator = new CrawlOrchestrator(search, cache, store);
	}

	private CrawlRequest.Builder request(QueryStrategy... strategies) {
		return CrawlRequest.builder().strategies(List.of(strategies)).workers(2).checkpointInterval(2);
	}

	@Nested
	@DisplayName("Completion Tests")
	class CompletionTest {

		@Test
		@DisplayName("Should cache every repository across pages and strategies")
		void shouldCacheEverything() {
			search.pages(first, List.of("a/one", "b/two"), List.of("c/three"));
			search.pages(second, List.of("d/four"));

			CrawlResult result = orchestrator.run(request(first, second).build());

			assertThat(result.stopReason()).isEqualTo(StopReason.COMPLETED);
			assertThat(result.newlyCached()).isEqualTo(4);
			assertThat(result.exhaustedStrategies()).isEqualTo(2);
			assertThat(result.totalFetched()).isEqualTo(4);
			assertThat(cache.identities()).containsExactly("a/one", "b/two", "c/three", "d/four");
			assertThat(store.load().orElseThrow().progress(first.id()).status()).isEqualTo(StrategyStatus.EXHAUSTED);
		}

		@Test
		@DisplayName("Should fetch a repository found by several strategies only once")
		void shouldSkipDuplicates() {
			search.pages(first, List.of("a/one", "b/two"));
			search.pages(second, List.of("b/two", "a/one", "c/three"));

			CrawlResult result = orchestrator.run(request(first, second).build());

			assertThat(result.newlyCached()).isEqualTo(3);
			assertThat(result.skippedDuplicates()).isEqualTo(2);
			assertThat(search.maxFetchesPerRepository()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should never fetch repositories already in the cache")
		void shouldMergeCacheIntoProcessedSet() {
			cache.write(CachedConfig.of(search.describe(new SearchHit("a/one", "init.lua", "u"), first), "init.lua",
					"-- cached", Instant.parse("2024-01-01T00:00:00Z")));
			search.pages(first, List.of("a/one", "b/two"));

			CrawlResult result = orchestrator.run(request(first).build());

			assertThat(result.newlyCached()).isEqualTo(1);
			assertThat(search.fetches("a/one")).isZero();
			assertThat(orchestrator.snapshot().isProcessed("a/one")).isTrue();
		}

		@Test
		@DisplayName("Should skip exhausted strategies when resuming")
		void shouldSkipExhaustedStrategies() {
			search.pages(first, List.of("a/one"));
			orchestrator.run(request(first).build());

			orchestrator.run(request(first).build());

			assertThat(search.searches(first)).isEqualTo(1);
		}

		@Test
		@DisplayName("Should restart exhausted strategies after a reset but keep the processed set")
		void shouldResetQueries() {
			search.pages(first, List.of("a/one"));
			orchestrator.run(request(first).build());

			CrawlResult result = orchestrator.run(request(first).resetQueries(true).build());

			assertThat(search.searches(first)).isEqualTo(2);
			assertThat(result.skippedDuplicates()).isEqualTo(1);
			assertThat(search.fetches("a/one")).isEqualTo(1);
		}

	}

	@Nested
	@DisplayName("Early Stop Tests")
	class EarlyStopTest {

		@Test
		@DisplayName("Should stop at the repository budget")
		void shouldStopAtMaxRepositories() {
			search.pages(first, List.of("a/one", "b/two", "c/three", "d/four", "e/five"));

			CrawlResult result = orchestrator.run(request(first).maxRepositories(3).build());

			assertThat(result.stopReason()).isEqualTo(StopReason.MAX_REPOSITORIES);
			assertThat(result.newlyCached()).isEqualTo(3);
			assertThat(cache.identities()).hasSize(3);
		}

		@Test
		@DisplayName("Resuming after a stop should fetch the rest without fetching anything twice")
		void resumeShouldCompleteWithoutRefetching() {
			search.pages(first, List.of("a/one", "b/two", "c/three"), List.of("d/four", "e/five"));

			CrawlResult partial = orchestrator.run(request(first).maxRepositories(2).build());
			Set<String> afterFirstRun = new HashSet<>(store.load().orElseThrow().processed());
			CrawlResult rest = orchestrator.run(request(first).build());

			assertThat(partial.stoppedEarly()).isTrue();
			assertThat(rest.stopReason()).isEqualTo(StopReason.COMPLETED);
			assertThat(store.load().orElseThrow().processed()).containsAll(afterFirstRun)
				.containsExactly("a/one", "b/two", "c/three", "d/four", "e/five");
			assertThat(search.maxFetchesPerRepository()).isEqualTo(1);
			assertThat(rest.totalFetched()).isEqualTo(5);
		}

		@Test
		@DisplayName("Should honor a stop request")
		void shouldHonorStopSignal() {
			search.pages(first, List.of("a/one", "b/two"));
			StopSignal stopSignal = new StopSignal();
			stopSignal.request("test");

			CrawlResult result = orchestrator.run(request(first).build(), stopSignal);

			assertThat(result.stopReason()).isEqualTo(StopReason.STOP_REQUESTED);
			assertThat(result.newlyCached()).isZero();
			assertThat(store.getSaveCount()).isPositive();
		}

		@Test
		@DisplayName("Should stop and keep the page position when the search is rate limited")
		void shouldStopWhenRateLimited() {
			search.pages(first, List.of("a/one"), List.of("b/two"));
			search.failAt(first, 2, new RateLimitedException("quota exhausted", null));

			CrawlResult result = orchestrator.run(request(first, second).build());

			assertThat(result.stopReason()).isEqualTo(StopReason.RATE_LIMITED);
			assertThat(result.newlyCached()).isEqualTo(1);
			assertThat(store.load().orElseThrow().progress(first.id()))
				.isEqualTo(new StrategyProgress(StrategyStatus.PAGINATING, 2));
			assertThat(search.searches(second)).isZero();
		}

		@Test
		@DisplayName("Should stop the whole crawl when credentials are rejected")
		void shouldPropagateAuthFailure() {
			search.pages(first, List.of("a/one"));
			search.failAt(first, 1, new AuthRequiredException("Bad credentials"));

			assertThatThrownBy(() -> orchestrator.run(request(first).build()))
				.isInstanceOf(AuthRequiredException.class);
			assertThat(store.getSaveCount()).isPositive();
		}

	}

	@Nested
	@DisplayName("Failure Tests")
	class FailureTest {

		@Test
		@DisplayName("A failing search should mark the strategy failed and continue with the next")
		void shouldContinueAfterSearchFailure() {
			search.pages(first, List.of("a/one"));
			search.pages(second, List.of("b/two"));
			search.failAt(first, 1, new TransientFetchException("boom", new RuntimeException()));

			CrawlResult result = orchestrator.run(request(first, second).build());

			assertThat(result.stopReason()).isEqualTo(StopReason.COMPLETED);
			assertThat(result.failedStrategies()).isEqualTo(1);
			assertThat(result.exhaustedStrategies()).isEqualTo(1);
			assertThat(cache.identities()).containsExactly("b/two");
			assertThat(store.load().orElseThrow().progress(first.id()).status()).isEqualTo(StrategyStatus.FAILED);
		}

		@Test
		@DisplayName("A missing file should be recorded as failed and retried by a later run")
		void shouldRecordMissingContent() {
			search.pages(first, List.of("a/one", "b/two"));
			search.missing("b/two");

			CrawlResult result = orchestrator.run(request(first).build());

			assertThat(result.failures()).extracting(ItemFailure::fullName).containsExactly("b/two");
			assertThat(cache.contains("b/two")).isFalse();
			assertThat(store.load().orElseThrow().isFailed("b/two")).isTrue();

			search.found("b/two");
			orchestrator.run(request(first).resetQueries(true).build());

			assertThat(cache.contains("b/two")).isTrue();
			assertThat(store.load().orElseThrow().isFailed("b/two")).isFalse();
		}

		@Test
		@DisplayName("A failing download should not stop the page")
		void shouldContinueAfterDownloadFailure() {
			search.pages(first, List.of("a/one", "b/two", "c/three"));
			search.failDownload("b/two", new TransientFetchException("timeout", new RuntimeException()));

			CrawlResult result = orchestrator.run(request(first).build());

			assertThat(result.newlyCached()).isEqualTo(2);
			assertThat(result.failures()).hasSize(1);
			assertThat(result.failures().get(0).reason()).contains("timeout");
		}

	}

	@Nested
	@DisplayName("Checkpoint Tests")
	class CheckpointTest {

		@Test
		@DisplayName("Should save every checkpoint interval within a page, after the page and at the end")
		void shouldSaveAtInterval() {
			RecordingCheckpointStore recording = new RecordingCheckpointStore();
			CrawlOrchestrator recorded = new CrawlOrchestrator(search, cache, recording);
			search.pages(first, List.of("a/one", "b/two", "c/three", "d/four", "e/five"));

			recorded.run(request(first).checkpointInterval(2).build());

			List<CrawlCheckpoint> saved = recording.saved();
			assertThat(saved).hasSize(4);
			assertThat(saved.get(0).processed()).containsExactly("a/one", "b/two");
			assertThat(saved.get(1).processed()).containsExactly("a/one", "b/two", "c/three", "d/four");
			assertThat(saved.get(1).progress(first.id()).status()).isEqualTo(StrategyStatus.PAGINATING);
			assertThat(saved.get(2).processed()).containsExactly("a/one", "b/two", "c/three", "d/four", "e/five");
			assertThat(saved.get(2).progress(first.id()).status()).isEqualTo(StrategyStatus.EXHAUSTED);
			assertThat(saved.get(3).processed()).isEqualTo(saved.get(2).processed());
		}

		@Test
		@DisplayName("Every repository recorded in a saved checkpoint should already be cached")
		void savedCheckpointsShouldOnlyNameCachedRepositories() {
			RecordingCheckpointStore recording = new RecordingCheckpointStore(cache);
			CrawlOrchestrator recorded = new CrawlOrchestrator(search, cache, recording);
			search.pages(first, List.of("a/one", "b/two", "c/three"), List.of("d/four", "e/five"));

			recorded.run(request(first).checkpointInterval(1).build());

			assertThat(recording.uncachedAtSave()).isEmpty();
			assertThat(recording.saved()).hasSizeGreaterThan(5);
		}

		@Test
		@DisplayName("Downloads in flight should never exceed the worker count")
		void shouldBoundInFlightDownloads() {
			List<String> names = new ArrayList<>();
			for (int i = 0; i < 9; i++) {
				names.add("user" + i + "/nvim");
			}
			search.pages(first, names);
			search.trackInFlight(cache);

			CrawlResult result = orchestrator.run(request(first).workers(3).build());

			assertThat(result.newlyCached()).isEqualTo(9);
			assertThat(search.maxInFlight()).isBetween(1, 3);
		}

	}

	/**
	 * Keeps a copy of every saved checkpoint. When given a cache, also notes processed
	 * repositories that were not cached yet at save time.
	 */
	static final class RecordingCheckpointStore implements CheckpointStore {

		private final List<CrawlCheckpoint> saved = new ArrayList<>();

		private final Set<String> uncachedAtSave = new HashSet<>();

		private final ConfigCache cache;

		RecordingCheckpointStore() {
			this(null);
		}

		RecordingCheckpointStore(ConfigCache cache) {
			this.cache = cache;
		}

		@Override
		public synchronized Optional<CrawlCheckpoint> load() {
			return saved.isEmpty() ? Optional.empty() : Optional.of(saved.get(saved.size() - 1).copy());
		}

		@Override
		public synchronized void save(CrawlCheckpoint checkpoint) {
			CrawlCheckpoint copy = checkpoint.copy();
			saved.add(copy);
			if (cache != null) {
				for (String fullName : copy.processed()) {
					if (!cache.contains(fullName)) {
						uncachedAtSave.add(fullName);
					}
				}
			}
		}

		synchronized List<CrawlCheckpoint> saved() {
			return List.copyOf(saved);
		}

		synchronized Set<String> uncachedAtSave() {
			return Set.copyOf(uncachedAtSave);
		}

	}

	/**
	 * Scripted search results keyed by query.
	 */
	static final class FakeSearchService implements CodeSearchService {

		private final Map<String, List<List<String>>> pages = new ConcurrentHashMap<>();

		private final Map<String, RuntimeException> searchFailures = new ConcurrentHashMap<>();

		private final Map<String, RuntimeException> downloadFailures = new ConcurrentHashMap<>();

		private final Set<String> missing = ConcurrentHashMap.newKeySet();

		private final Map<String, AtomicInteger> searchCounts = new ConcurrentHashMap<>();

		private final Map<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();

		private final AtomicInteger fetchesStarted = new AtomicInteger();

		private final AtomicInteger maxInFlight = new AtomicInteger();

		private volatile ConfigCache trackedCache;

		/**
		 * Measure downloads started but not yet cached, slowing each download down a
		 * little so that they overlap.
		 */
		void trackInFlight(ConfigCache cache) {
			this.trackedCache = cache;
		}

		int maxInFlight() {
			return maxInFlight.get();
		}

		@SafeVarargs
		final void pages(QueryStrategy strategy, List<String>... results) {
			pages.put(strategy.query(), new ArrayList<>(List.of(results)));
		}

		void failAt(QueryStrategy strategy, int page, RuntimeException failure) {
			searchFailures.put(strategy.query() + "#" + page, failure);
		}

		void failDownload(String fullName, RuntimeException failure) {
			downloadFailures.put(fullName, failure);
		}

		void missing(String fullName) {
			missing.add(fullName);
		}

		void found(String fullName) {
			missing.remove(fullName);
		}

		int searches(QueryStrategy strategy) {
			AtomicInteger count = searchCounts.get(strategy.query());
			return count != null ? count.get() : 0;
		}

		int fetches(String fullName) {
			AtomicInteger count = fetchCounts.get(fullName);
			return count != null ? count.get() : 0;
		}

		int maxFetchesPerRepository() {
			return fetchCounts.values().stream().mapToInt(AtomicInteger::get).max().orElse(0);
		}

		@Override
		public SearchPage search(QueryStrategy strategy, int page) {
			searchCounts.computeIfAbsent(strategy.query(), q -> new AtomicInteger()).incrementAndGet();
			RuntimeException failure = searchFailures.get(strategy.query() + "#" + page);
			if (failure != null) {
				throw failure;
			}
			List<List<String>> results = pages.getOrDefault(strategy.query(), List.of());
			if (page > results.size()) {
				return SearchPage.end();
			}
			List<SearchHit> hits = results.get(page - 1)
				.stream()
				.map(name -> new SearchHit(name, "init.lua", "https://github.com/" + name))
				.toList();
			long total = results.stream().mapToLong(List::size).sum();
			return new SearchPage(hits, total, page < results.size() ? page + 1 : null);
		}

		@Override
		public RepositoryRef describe(SearchHit hit, QueryStrategy strategy) {
			return new RepositoryRef(hit.fullName(), hit.fullName().length(), "main", strategy.id(), hit.htmlUrl(),
					Instant.parse("2024-05-01T00:00:00Z"));
		}

		@Override
		public Optional<String> fetchContent(RepositoryRef repository, String path) {
			fetchCounts.computeIfAbsent(repository.fullName(), n -> new AtomicInteger()).incrementAndGet();
			ConfigCache tracked = trackedCache;
			if (tracked != null) {
				int started = fetchesStarted.incrementAndGet();
				maxInFlight.accumulateAndGet(started - tracked.identities().size(), Math::max);
				try {
					Thread.sleep(20);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
			RuntimeException failure = downloadFailures.get(repository.fullName());
			if (failure != null) {
				throw failure;
			}
			if (missing.contains(repository.fullName())) {
				return Optional.empty();
			}
			return Optional.of("-- " + repository.fullName() + "\nvim.opt.number = true\n");
		}

	}

}
