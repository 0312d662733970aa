package org.springaicommunity.eigen.neovim;

import java.time.Instant;

/**
 * Rate limit information from the GitHub API.
 *
 * @param limit the maximum number of requests allowed in the current window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 * @param resource the rate limit resource the headers describe (e.g. "core", "code_search")
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used, String resource) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

}
