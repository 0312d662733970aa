package org.springaicommunity.eigen.neovim;

/**
 * One partition of the code search space. GitHub returns at most 1000 results per query,
 * so the crawl rotates across many narrower queries whose union approximates the corpus.
 *
 * @param query the search query string; also the strategy's identity in the checkpoint
 * @param kind how the query narrows the search space
 */
public record QueryStrategy(String query, Kind kind) {

	public QueryStrategy {
		if (query == null || query.isBlank()) {
			throw new IllegalArgumentException("query must not be blank");
		}
	}

	/**
	 * Stable identity of this strategy, used as the checkpoint key.
	 */
	public String id() {
		return query;
	}

	/**
	 * Dimension a query partitions on.
	 */
	public enum Kind {

		PATH, POPULARITY, CREATED, PUSHED, LANGUAGE, TOPIC, CUSTOM

	}

}
