package org.springaicommunity.eigen.neovim;

import java.util.Optional;

/**
 * Search and download operations the crawl needs from GitHub.
 */
public interface CodeSearchService {

	/**
	 * Fetch one page of code search results.
	 * @param strategy the query partition
	 * @param page 1-based page number
	 * @return the page, whose {@code nextPage} is null once the query is exhausted
	 */
	SearchPage search(QueryStrategy strategy, int page);

	/**
	 * Resolve repository details for a search hit. Falls back to 0 stars and branch
	 * "main" if the lookup fails.
	 */
	RepositoryRef describe(SearchHit hit, QueryStrategy strategy);

	/**
	 * Download a file from the repository's default branch.
	 * @return the file content, or empty if the file does not exist
	 * @throws TransientFetchException if the download keeps failing
	 */
	Optional<String> fetchContent(RepositoryRef repository, String path);

}
