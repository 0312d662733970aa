package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Durable crawl progress: which repositories were processed, which failed, where each
 * query strategy stands, and how many configs were fetched in total.
 *
 * <p>
 * The processed set only grows. A checkpoint is owned by one crawl loop at a time; other
 * threads read it through {@link #copy()}.
 */
public final class CrawlCheckpoint {

	private final NavigableSet<String> processed;

	private final SortedMap<String, String> failed;

	private final Map<String, StrategyProgress> strategies;

	private long totalFetched;

	private @Nullable Instant savedAt;

	public CrawlCheckpoint() {
		this(new TreeSet<>(), new TreeMap<>(), new LinkedHashMap<>(), 0, null);
	}

	public CrawlCheckpoint(Collection<String> processed, Map<String, String> failed,
			Map<String, StrategyProgress> strategies, long totalFetched, @Nullable Instant savedAt) {
		this.processed = new TreeSet<>(processed);
		this.failed = new TreeMap<>(failed);
		this.strategies = new LinkedHashMap<>(strategies);
		this.totalFetched = totalFetched;
		this.savedAt = savedAt;
	}

	public boolean isProcessed(String fullName) {
		return processed.contains(fullName);
	}

	/**
	 * Record a repository as processed. Clears any earlier failure for it.
	 * @return true if it was not processed before
	 */
	public boolean markProcessed(String fullName) {
		failed.remove(fullName);
		return processed.add(fullName);
	}

	/**
	 * Merge identities known from elsewhere (e.g. the cache) into the processed set.
	 * @return how many were new
	 */
	public int mergeProcessed(Collection<String> identities) {
		int before = processed.size();
		processed.addAll(identities);
		identities.forEach(failed::remove);
		return processed.size() - before;
	}

	public void markFailed(String fullName, String reason) {
		if (!processed.contains(fullName)) {
			failed.put(fullName, reason);
		}
	}

	public boolean isFailed(String fullName) {
		return failed.containsKey(fullName);
	}

	public StrategyProgress progress(String strategyId) {
		return strategies.getOrDefault(strategyId, StrategyProgress.PENDING);
	}

	public void updateProgress(String strategyId, StrategyProgress progress) {
		strategies.put(strategyId, progress);
	}

	/**
	 * Put every strategy back to PENDING at page 1, keeping the processed set.
	 */
	public void resetStrategies() {
		strategies.clear();
	}

	public void incrementFetched() {
		totalFetched++;
	}

	public void markSaved(Instant when) {
		this.savedAt = when;
	}

	public NavigableSet<String> processed() {
		return Collections.unmodifiableNavigableSet(processed);
	}

	public SortedMap<String, String> failed() {
		return Collections.unmodifiableSortedMap(failed);
	}

	public Map<String, StrategyProgress> strategies() {
		return Collections.unmodifiableMap(strategies);
	}

	public long totalFetched() {
		return totalFetched;
	}

	public @Nullable Instant savedAt() {
		return savedAt;
	}

	/**
	 * Independent copy, safe to hand to other threads.
	 */
	public CrawlCheckpoint copy() {
		return new CrawlCheckpoint(processed, failed, strategies, totalFetched, savedAt);
	}

}
