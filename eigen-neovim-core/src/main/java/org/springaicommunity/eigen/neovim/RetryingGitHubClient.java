package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.eigen.neovim.GitHubHttpClient.GitHubApiException;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Decorator that applies a {@link RetryPolicy} to every call of a {@link GitHubClient}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Exponential backoff for transient errors (5xx, network), then
 * {@link TransientFetchException}</li>
 * <li>Reset-aware waits for rate limit errors: sleeps for {@code Retry-After} or until
 * {@code X-RateLimit-Reset} instead of a blind delay, and retries the same request</li>
 * <li>{@link RateLimitedException} once a call would wait longer than the policy's rate
 * limit budget</li>
 * <li>{@link AuthRequiredException} on 401</li>
 * </ul>
 *
 * <p>
 * Code search calls get their own, more patient policy.
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .policy(RetryPolicy.defaults())
 *     .searchPolicy(RetryPolicy.forSearch())
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private final GitHubClient delegate;

	private final RetryPolicy policy;

	private final RetryPolicy searchPolicy;

	private final Sleeper sleeper;

	private final Clock clock;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.policy = builder.policy;
		this.searchPolicy = builder.searchPolicy;
		this.sleeper = builder.sleeper;
		this.clock = builder.clock;
	}

	/**
	 * Create a new builder for RetryingGitHubClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path, policyFor(path));
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc, policyFor(path));
	}

	@Override
	public String getRaw(String owner, String name, String branch, String path) {
		String desc = "RAW " + owner + "/" + name + "/" + branch + "/" + path;
		return executeWithRetry(() -> delegate.getRaw(owner, name, branch, path), desc, policy);
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private RetryPolicy policyFor(String path) {
		return RequestCategory.ofPath(path) == RequestCategory.SEARCH ? searchPolicy : policy;
	}

	private String executeWithRetry(Supplier<String> supplier, String description, RetryPolicy policy) {
		int failures = 0;
		int rateLimitHits = 0;
		long rateLimitWaitedMs = 0;

		while (true) {
			try {
				return supplier.get();
			}
			catch (GitHubApiException e) {
				if (e.getStatusCode() == 401) {
					throw new AuthRequiredException(e.getMessage(), e);
				}
				if (e.isRateLimitError()) {
					long waitMs = computeRateLimitWait(e, policy, rateLimitHits++);
					if (rateLimitWaitedMs + waitMs > policy.rateLimitWaitBudget().toMillis()) {
						Instant resetAt = e.getResetEpochSeconds() > 0 ? Instant.ofEpochSecond(e.getResetEpochSeconds())
								: null;
						throw new RateLimitedException(description + ": rate limited, waiting " + waitMs
								+ "ms would exceed the wait budget of " + policy.rateLimitWaitBudget(), resetAt);
					}
					logger.info("{} hit a rate limit. Waiting {}ms before retrying", description, waitMs);
					rateLimitWaitedMs += waitMs;
					sleep(waitMs);
					continue;
				}
				if (!policy.isRetryable(e)) {
					throw e;
				}
				failures = retryOrGiveUp(e, description, policy, failures);
			}
			catch (AuthRequiredException | RateLimitedException | TransientFetchException e) {
				throw e;
			}
			catch (RuntimeException e) {
				if (!policy.isRetryable(e)) {
					throw e;
				}
				failures = retryOrGiveUp(e, description, policy, failures);
			}
		}
	}

	private int retryOrGiveUp(RuntimeException e, String description, RetryPolicy policy, int failures) {
		int attempt = failures + 1;
		if (attempt >= policy.maxAttempts()) {
			logger.warn("{} failed after {} attempts: {}", description, attempt, e.getMessage());
			throw new TransientFetchException(description + " failed after " + attempt + " attempts", e);
		}
		long delay = policy.backoff(failures).toMillis();
		logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt, policy.maxAttempts(),
				e.getMessage(), delay);
		sleep(delay);
		return attempt;
	}

	/**
	 * Wait before retrying a rate limited call. {@code Retry-After} wins, then the reset
	 * epoch (+1s buffer), then exponential backoff.
	 */
	long computeRateLimitWait(GitHubApiException e, RetryPolicy policy, int hit) {
		if (e.getRetryAfterSeconds() > 0) {
			return e.getRetryAfterSeconds() * 1000;
		}
		if (e.getResetEpochSeconds() > 0) {
			long waitSeconds = e.getResetEpochSeconds() - clock.instant().getEpochSecond() + 1;
			if (waitSeconds > 0) {
				return waitSeconds * 1000;
			}
			// reset is in the past, use backoff
		}
		return policy.backoff(hit).toMillis();
	}

	private void sleep(long ms) {
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransientFetchException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingGitHubClient}.
	 *
	 * <p>
	 * Defaults: {@link RetryPolicy#defaults()} for REST and raw calls,
	 * {@link RetryPolicy#forSearch()} for code search, real sleeps and the system clock.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private RetryPolicy policy = RetryPolicy.defaults();

		private RetryPolicy searchPolicy = RetryPolicy.forSearch();

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Policy for REST and raw content calls.
		 */
		public Builder policy(RetryPolicy policy) {
			this.policy = policy;
			return this;
		}

		/**
		 * Policy for code search calls.
		 */
		public Builder searchPolicy(RetryPolicy searchPolicy) {
			this.searchPolicy = searchPolicy;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
