package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.GitHubHttpClient.GitHubApiException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry settings applied uniformly by {@link RetryingGitHubClient}: how many attempts a
 * transient failure gets, how the delay between them grows, and how long a single call
 * may spend waiting out rate limits before giving up with {@link RateLimitedException}.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofSeconds(2))
 *     .maxDelay(Duration.ofSeconds(60))
 *     .build();
 * }
 * </pre>
 */
public final class RetryPolicy {

	private final int maxAttempts;

	private final Duration baseDelay;

	private final Duration maxDelay;

	private final Duration rateLimitWaitBudget;

	private final Predicate<RuntimeException> retryable;

	private RetryPolicy(Builder builder) {
		this.maxAttempts = builder.maxAttempts;
		this.baseDelay = builder.baseDelay;
		this.maxDelay = builder.maxDelay;
		this.rateLimitWaitBudget = builder.rateLimitWaitBudget;
		this.retryable = builder.retryable;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Policy for ordinary REST and raw content calls: 3 attempts, 1s doubling to 10s.
	 */
	public static RetryPolicy defaults() {
		return builder().build();
	}

	/**
	 * Policy for code search calls, which are throttled much harder: 5 attempts, 2s
	 * doubling to 60s.
	 */
	public static RetryPolicy forSearch() {
		return builder().maxAttempts(5).baseDelay(Duration.ofSeconds(2)).maxDelay(Duration.ofSeconds(60)).build();
	}

	/**
	 * Default predicate: network failures and 5xx responses are retryable, other HTTP
	 * errors are not.
	 */
	public static boolean isTransientFailure(RuntimeException e) {
		if (e instanceof GitHubApiException apiException) {
			return apiException.isTransient();
		}
		return true;
	}

	/**
	 * Exponential backoff for the given zero-based retry number, capped at the maximum
	 * delay.
	 */
	public Duration backoff(int retry) {
		long base = baseDelay.toMillis();
		long capped = maxDelay.toMillis();
		long delay = base;
		for (int i = 0; i < retry && delay < capped; i++) {
			delay *= 2;
		}
		return Duration.ofMillis(Math.min(delay, capped));
	}

	public boolean isRetryable(RuntimeException e) {
		return retryable.test(e);
	}

	public int maxAttempts() {
		return maxAttempts;
	}

	public Duration baseDelay() {
		return baseDelay;
	}

	public Duration maxDelay() {
		return maxDelay;
	}

	public Duration rateLimitWaitBudget() {
		return rateLimitWaitBudget;
	}

	/**
	 * Builder for {@link RetryPolicy}.
	 *
	 * <p>
	 * Defaults: 3 attempts, 1 second base delay, 10 second maximum delay, 1 hour rate
	 * limit wait budget, {@link #isTransientFailure(RuntimeException)} as predicate.
	 */
	public static class Builder {

		private int maxAttempts = 3;

		private Duration baseDelay = Duration.ofSeconds(1);

		private Duration maxDelay = Duration.ofSeconds(10);

		private Duration rateLimitWaitBudget = Duration.ofHours(1);

		private Predicate<RuntimeException> retryable = RetryPolicy::isTransientFailure;

		private Builder() {
		}

		/**
		 * Total attempts for a transient failure, the first one included.
		 */
		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		public Builder baseDelay(Duration baseDelay) {
			this.baseDelay = baseDelay;
			return this;
		}

		public Builder maxDelay(Duration maxDelay) {
			this.maxDelay = maxDelay;
			return this;
		}

		/**
		 * Longest cumulative time one call may spend waiting for rate limits to reset.
		 */
		public Builder rateLimitWaitBudget(Duration budget) {
			this.rateLimitWaitBudget = budget;
			return this;
		}

		public Builder retryable(Predicate<RuntimeException> retryable) {
			this.retryable = retryable;
			return this;
		}

		/**
		 * Build the policy.
		 * @return configured RetryPolicy
		 * @throws IllegalStateException if a parameter is out of range
		 */
		public RetryPolicy build() {
			if (maxAttempts < 1) {
				throw new IllegalStateException("maxAttempts must be at least 1");
			}
			if (baseDelay.isNegative() || baseDelay.isZero()) {
				throw new IllegalStateException("baseDelay must be positive");
			}
			if (maxDelay.compareTo(baseDelay) < 0) {
				throw new IllegalStateException("maxDelay must not be shorter than baseDelay");
			}
			if (rateLimitWaitBudget.isNegative()) {
				throw new IllegalStateException("rateLimitWaitBudget must not be negative");
			}
			return new RetryPolicy(this);
		}

	}

}
