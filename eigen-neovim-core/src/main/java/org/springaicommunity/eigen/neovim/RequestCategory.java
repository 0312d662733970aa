package org.springaicommunity.eigen.neovim;

/**
 * GitHub request buckets with independent rate limits.
 */
public enum RequestCategory {

	/** Code search: 10 requests per minute for authenticated users. */
	SEARCH,

	/** Everything else under api.github.com. */
	CORE,

	/** Downloads from raw.githubusercontent.com. */
	RAW;

	/**
	 * Category of a REST path or full API URL.
	 */
	public static RequestCategory ofPath(String path) {
		return path.contains("/search/") ? SEARCH : CORE;
	}

	/**
	 * Category of an {@code X-RateLimit-Resource} header value.
	 */
	public static RequestCategory ofResource(String resource) {
		switch (resource) {
			case "search", "code_search":
				return SEARCH;
			default:
				return CORE;
		}
	}

}
