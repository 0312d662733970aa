package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Summary of one crawl run.
 *
 * @param newlyCached repositories downloaded and cached in this run
 * @param skippedDuplicates search hits skipped because the repository was already
 * processed
 * @param failures repositories that could not be fetched in this run
 * @param exhaustedStrategies strategies fully paged through (this or earlier runs)
 * @param failedStrategies strategies whose search failed; retried on the next run
 * @param totalStrategies strategies in the request
 * @param totalFetched configs fetched across all runs
 * @param stopReason why the run ended
 * @param stopDetail extra information for early stops
 */
public record CrawlResult(int newlyCached, int skippedDuplicates, List<ItemFailure> failures,
		int exhaustedStrategies, int failedStrategies, int totalStrategies, long totalFetched, StopReason stopReason,
		@Nullable String stopDetail) {

	public CrawlResult {
		failures = List.copyOf(failures);
	}

	/**
	 * Returns true if the run ended before every strategy was exhausted or failed.
	 */
	public boolean stoppedEarly() {
		return stopReason != StopReason.COMPLETED;
	}

	/**
	 * Why a crawl run ended.
	 */
	public enum StopReason {

		/** Every strategy is exhausted or failed. */
		COMPLETED,

		/** The repository budget of the request was reached. */
		MAX_REPOSITORIES,

		/** A rate limit would have needed a longer wait than allowed; resume later. */
		RATE_LIMITED,

		/** A {@link StopSignal} was raised. */
		STOP_REQUESTED

	}

}
