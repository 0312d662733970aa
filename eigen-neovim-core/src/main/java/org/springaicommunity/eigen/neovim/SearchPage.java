package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of code search results.
 *
 * @param hits the results on this page, in API order
 * @param totalCount total results GitHub reports for the query
 * @param nextPage the next page to request, or null when the query is exhausted
 */
public record SearchPage(List<SearchHit> hits, long totalCount, @Nullable Integer nextPage) {

	public SearchPage {
		hits = List.copyOf(hits);
	}

	/**
	 * An empty page that ends the query.
	 */
	public static SearchPage end() {
		return new SearchPage(List.of(), 0, null);
	}

	public boolean isLast() {
		return nextPage == null;
	}

}
