package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Thrown when waiting out a rate limit would exceed the configured wait budget. The crawl
 * stops, saves its checkpoint and can be resumed once the limit resets.
 */
public class RateLimitedException extends RuntimeException {

	private final @Nullable Instant resetAt;

	public RateLimitedException(String message, @Nullable Instant resetAt) {
		super(message);
		this.resetAt = resetAt;
	}

	/**
	 * Returns when the provider reported the limit resets, if known.
	 */
	public @Nullable Instant getResetAt() {
		return resetAt;
	}

}
