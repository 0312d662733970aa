package org.springaicommunity.eigen.neovim;

import java.util.List;

/**
 * Parameters of one crawl run.
 *
 * @param strategies query partitions to work through, in order
 * @param maxRepositories stop after caching this many new repositories
 * @param resume continue from the saved checkpoint instead of starting fresh
 * @param resetQueries put every strategy back to its first page, keeping the processed set
 * @param checkpointInterval save the checkpoint after this many cached repositories (in
 * addition to every page boundary)
 * @param workers concurrent content downloads per page
 */
public record CrawlRequest(List<QueryStrategy> strategies, long maxRepositories, boolean resume, boolean resetQueries,
		int checkpointInterval, int workers) {

	public CrawlRequest {
		strategies = List.copyOf(strategies);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link CrawlRequest}. Defaults: the default strategies, one million
	 * repositories, resume on, checkpoint every 10 items, 4 workers.
	 */
	public static class Builder {

		private List<QueryStrategy> strategies = QueryStrategies.defaults();

		private long maxRepositories = 1_000_000;

		private boolean resume = true;

		private boolean resetQueries = false;

		private int checkpointInterval = 10;

		private int workers = 4;

		private Builder() {
		}

		public Builder strategies(List<QueryStrategy> strategies) {
			this.strategies = strategies;
			return this;
		}

		public Builder maxRepositories(long maxRepositories) {
			this.maxRepositories = maxRepositories;
			return this;
		}

		public Builder resume(boolean resume) {
			this.resume = resume;
			return this;
		}

		public Builder resetQueries(boolean resetQueries) {
			this.resetQueries = resetQueries;
			return this;
		}

		public Builder checkpointInterval(int checkpointInterval) {
			this.checkpointInterval = checkpointInterval;
			return this;
		}

		public Builder workers(int workers) {
			this.workers = workers;
			return this;
		}

		/**
		 * Build the request.
		 * @return validated CrawlRequest
		 * @throws IllegalStateException if a parameter is out of range
		 */
		public CrawlRequest build() {
			if (strategies == null || strategies.isEmpty()) {
				throw new IllegalStateException("At least one query strategy is required");
			}
			if (maxRepositories < 1) {
				throw new IllegalStateException("maxRepositories must be positive");
			}
			if (checkpointInterval < 1) {
				throw new IllegalStateException("checkpointInterval must be positive");
			}
			if (workers < 1) {
				throw new IllegalStateException("workers must be positive");
			}
			return new CrawlRequest(strategies, maxRepositories, resume, resetQueries, checkpointInterval, workers);
		}

	}

}
