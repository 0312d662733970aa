package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST API and the raw content host, enabling
 * testability and decorator implementations (throttling, retrying).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?), already URL-encoded
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String getWithQuery(String path, @Nullable String queryString);

	/**
	 * Download a raw file from the content host.
	 * @param owner repository owner
	 * @param name repository name
	 * @param branch branch name
	 * @param path file path inside the repository
	 * @return file content decoded as UTF-8
	 * @throws GitHubHttpClient.GitHubApiException if the request fails (404 when absent)
	 */
	String getRaw(String owner, String name, String branch, String path);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
