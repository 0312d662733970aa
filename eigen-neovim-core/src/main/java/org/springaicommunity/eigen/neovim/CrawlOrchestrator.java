package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.eigen.neovim.CrawlResult.StopReason;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives query strategies through a {@link CodeSearchService}, caches every repository's
 * config at most once, and checkpoints progress so that an interrupted crawl resumes
 * where it stopped.
 *
 * <p>
 * One strategy is active at a time and moves {@code PENDING -> PAGINATING -> EXHAUSTED}
 * (or {@code FAILED} when its search breaks; failed strategies are retried on the next
 * run from their saved page). Per page, downloads of unseen repositories run on a small
 * worker pool, while this loop alone consumes the results in page order, writes the
 * cache and mutates and saves the checkpoint, all under one lock.
 *
 * <p>
 * The checkpoint is saved after every page and after every
 * {@link CrawlRequest#checkpointInterval()} cached repositories. A repository is marked
 * processed only after its cache entry is written, so an interruption can lose progress
 * but never record a repository that is not cached.
 */
public class CrawlOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(CrawlOrchestrator.class);

	private final CodeSearchService searchService;

	private final ConfigCache cache;

	private final CheckpointStore checkpointStore;

	private final Clock clock;

	private final Object lock = new Object();

	private @Nullable CrawlCheckpoint checkpoint;

	public CrawlOrchestrator(CodeSearchService searchService, ConfigCache cache, CheckpointStore checkpointStore) {
		this(searchService, cache, checkpointStore, Clock.systemUTC());
	}

	public CrawlOrchestrator(CodeSearchService searchService, ConfigCache cache, CheckpointStore checkpointStore,
			Clock clock) {
		this.searchService = searchService;
		this.cache = cache;
		this.checkpointStore = checkpointStore;
		this.clock = clock;
	}

	/**
	 * Run a crawl that stops only when done, out of budget or rate limited.
	 */
	public CrawlResult run(CrawlRequest request) {
		return run(request, new StopSignal());
	}

	/**
	 * Run a crawl.
	 * @param request what to crawl
	 * @param stopSignal checked between items; when raised, in-flight downloads are
	 * finished and recorded, the checkpoint is saved and the run returns
	 * @return the run summary
	 * @throws CheckpointCorruptException if resuming and the checkpoint cannot be read
	 * @throws AuthRequiredException if GitHub rejects the credential
	 */
	public CrawlResult run(CrawlRequest request, StopSignal stopSignal) {
		CrawlCheckpoint state = request.resume() ? checkpointStore.load().orElseGet(CrawlCheckpoint::new)
				: new CrawlCheckpoint();
		if (request.resetQueries()) {
			logger.info("Resetting all query strategies to their first page");
			state.resetStrategies();
		}
		int merged = state.mergeProcessed(cache.identities());
		if (merged > 0) {
			logger.info("Merged {} cached repositories into the processed set", merged);
		}
		synchronized (lock) {
			this.checkpoint = state;
		}

		Run run = new Run(request, state, stopSignal);
		ExecutorService executor = Executors.newFixedThreadPool(request.workers(), new WorkerThreadFactory());
		try {
			run.execute(executor);
		}
		finally {
			executor.shutdownNow();
			save(state);
		}

		CrawlResult result = run.result();
		logger.info("Crawl finished ({}): {} new, {} duplicates skipped, {} failed, {}/{} strategies exhausted",
				result.stopReason(), result.newlyCached(), result.skippedDuplicates(), result.failures().size(),
				result.exhaustedStrategies(), result.totalStrategies());
		return result;
	}

	/**
	 * A consistent copy of the checkpoint of the current (or last) run, or null before
	 * the first run.
	 */
	public @Nullable CrawlCheckpoint snapshot() {
		synchronized (lock) {
			return checkpoint != null ? checkpoint.copy() : null;
		}
	}

	private void save(CrawlCheckpoint state) {
		synchronized (lock) {
			checkpointStore.save(state);
		}
	}

	/**
	 * Mutable bookkeeping of a single run.
	 */
	private final class Run {

		private final CrawlRequest request;

		private final CrawlCheckpoint state;

		private final StopSignal stopSignal;

		private final Set<String> failedThisRun = new HashSet<>();

		private final List<ItemFailure> failures = new ArrayList<>();

		private int newlyCached;

		private int skippedDuplicates;

		private int sinceLastSave;

		private StopReason stopReason = StopReason.COMPLETED;

		private @Nullable String stopDetail;

		Run(CrawlRequest request, CrawlCheckpoint state, StopSignal stopSignal) {
			this.request = request;
			this.state = state;
			this.stopSignal = stopSignal;
		}

		void execute(ExecutorService executor) {
			List<QueryStrategy> strategies = request.strategies();
			for (int i = 0; i < strategies.size() && !stopping(); i++) {
				QueryStrategy strategy = strategies.get(i);
				StrategyProgress progress = state.progress(strategy.id());
				if (progress.status() == StrategyStatus.EXHAUSTED) {
					logger.debug("Skipping exhausted strategy '{}'", strategy.query());
					continue;
				}
				logger.info("Strategy {}/{}: '{}' from page {}{}", i + 1, strategies.size(), strategy.query(),
						progress.nextPage(), progress.status() == StrategyStatus.FAILED ? " (retrying failed)" : "");
				crawlStrategy(strategy, progress.nextPage(), executor);
			}
		}

		private void crawlStrategy(QueryStrategy strategy, int firstPage, ExecutorService executor) {
			int page = firstPage;
			while (!stopping()) {
				StrategyProgress progress = state.progress(strategy.id()).paginating(page);
				updateProgress(strategy, progress);

				SearchPage result;
				try {
					result = searchService.search(strategy, page);
				}
				catch (RateLimitedException e) {
					stop(StopReason.RATE_LIMITED, e.getMessage());
					return;
				}
				catch (AuthRequiredException e) {
					throw e;
				}
				catch (RuntimeException e) {
					logger.warn("Search failed for '{}' page {}: {}. Moving to the next strategy", strategy.query(),
							page, e.getMessage());
					updateProgress(strategy, progress.failed());
					save(state);
					return;
				}

				boolean pageComplete = processPage(strategy, result.hits(), executor);
				if (pageComplete) {
					Integer next = result.nextPage();
					updateProgress(strategy, next == null ? progress.exhausted() : progress.paginating(next));
				}
				save(state);
				sinceLastSave = 0;

				if (!pageComplete || result.isLast()) {
					if (pageComplete) {
						logger.info("Strategy '{}' exhausted", strategy.query());
					}
					return;
				}
				page = result.nextPage();
			}
		}

		/**
		 * Process one page of hits. Returns true if every hit was dealt with, false if
		 * the run stopped part way (the page is then repeated on resume).
		 */
		private boolean processPage(QueryStrategy strategy, List<SearchHit> hits, ExecutorService executor) {
			List<SearchHit> todo = new ArrayList<>();
			Set<String> seenOnPage = new HashSet<>();
			for (SearchHit hit : hits) {
				String fullName = hit.fullName();
				if (!seenOnPage.add(fullName)) {
					continue;
				}
				synchronized (lock) {
					if (state.isProcessed(fullName)) {
						skippedDuplicates++;
						continue;
					}
					if (cache.contains(fullName)) {
						// cached by a concurrent or earlier process after this run started
						state.markProcessed(fullName);
						skippedDuplicates++;
						continue;
					}
				}
				if (!failedThisRun.contains(fullName)) {
					todo.add(hit);
				}
			}

			Deque<Pending> inflight = new ArrayDeque<>();
			Iterator<SearchHit> remaining = todo.iterator();
			while (true) {
				while (!stopping() && remaining.hasNext() && inflight.size() < request.workers()
						&& newlyCached + inflight.size() < request.maxRepositories()) {
					SearchHit hit = remaining.next();
					inflight.addLast(new Pending(hit, executor.submit(() -> download(hit, strategy))));
				}
				if (inflight.isEmpty()) {
					break;
				}
				Pending pending = inflight.pollFirst();
				record(pending);
			}

			if (!stopping() && newlyCached >= request.maxRepositories()) {
				stop(StopReason.MAX_REPOSITORIES, "cached " + newlyCached + " repositories");
			}
			return !remaining.hasNext() && stopReason != StopReason.RATE_LIMITED && !stopSignal.isRequested();
		}

		private Optional<CachedConfig> download(SearchHit hit, QueryStrategy strategy) {
			RepositoryRef repository = searchService.describe(hit, strategy);
			return searchService.fetchContent(repository, hit.path())
				.map(content -> CachedConfig.of(repository, hit.path(), content, clock.instant()));
		}

		private void record(Pending pending) {
			String fullName = pending.hit().fullName();
			Optional<CachedConfig> downloaded;
			try {
				downloaded = pending.future().get();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				stopSignal.request("interrupted");
				pending.future().cancel(true);
				return;
			}
			catch (CancellationException e) {
				return;
			}
			catch (ExecutionException e) {
				Throwable cause = e.getCause();
				if (cause instanceof RateLimitedException) {
					stop(StopReason.RATE_LIMITED, cause.getMessage());
					return;
				}
				if (cause instanceof AuthRequiredException authRequired) {
					throw authRequired;
				}
				fail(fullName, cause != null ? cause.getMessage() : e.getMessage());
				return;
			}

			if (downloaded.isEmpty()) {
				fail(fullName, "config file not found on default branch");
				return;
			}

			CachedConfig config = downloaded.get();
			synchronized (lock) {
				cache.write(config);
				state.markProcessed(fullName);
				state.incrementFetched();
				newlyCached++;
				if (++sinceLastSave >= request.checkpointInterval()) {
					checkpointStore.save(state);
					sinceLastSave = 0;
				}
			}
			logger.info("[{}] Cached {} ({} stars)", newlyCached, fullName, config.repository().stars());
		}

		private void fail(String fullName, @Nullable String reason) {
			String why = reason != null ? reason : "unknown error";
			logger.warn("Skipping {}: {}", fullName, why);
			failedThisRun.add(fullName);
			failures.add(new ItemFailure(fullName, why));
			synchronized (lock) {
				state.markFailed(fullName, why);
			}
		}

		private void updateProgress(QueryStrategy strategy, StrategyProgress progress) {
			synchronized (lock) {
				state.updateProgress(strategy.id(), progress);
			}
		}

		private boolean stopping() {
			if (stopReason != StopReason.COMPLETED) {
				return true;
			}
			if (stopSignal.isRequested()) {
				stop(StopReason.STOP_REQUESTED, stopSignal.reason());
				return true;
			}
			return false;
		}

		private void stop(StopReason reason, @Nullable String detail) {
			if (stopReason == StopReason.COMPLETED) {
				stopReason = reason;
				stopDetail = detail;
				logger.info("Stopping crawl ({}): {}", reason, detail);
			}
		}

		CrawlResult result() {
			int exhausted = 0;
			int failed = 0;
			for (QueryStrategy strategy : request.strategies()) {
				StrategyStatus status = state.progress(strategy.id()).status();
				if (status == StrategyStatus.EXHAUSTED) {
					exhausted++;
				}
				else if (status == StrategyStatus.FAILED) {
					failed++;
				}
			}
			return new CrawlResult(newlyCached, skippedDuplicates, failures, exhausted, failed,
					request.strategies().size(), state.totalFetched(), stopReason, stopDetail);
		}

	}

	private record Pending(SearchHit hit, Future<Optional<CachedConfig>> future) {
	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "eigen-fetch-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
