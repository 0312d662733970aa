package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.util.function.Supplier;

/**
 * Decorator that routes every request of a {@link GitHubClient} through a shared
 * {@link RequestThrottle}: the throttle is consulted before the request and fed the rate
 * limit headers observed after it, whether the request succeeded or not.
 *
 * <p>
 * Place it inside {@link RetryingGitHubClient} so that each retry attempt is throttled
 * too.
 */
public final class ThrottledGitHubClient implements GitHubClient {

	private final GitHubClient delegate;

	private final RequestThrottle throttle;

	public ThrottledGitHubClient(GitHubClient delegate, RequestThrottle throttle) {
		this.delegate = delegate;
		this.throttle = throttle;
	}

	@Override
	public String get(String path) {
		return throttled(RequestCategory.ofPath(path), () -> delegate.get(path));
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		return throttled(RequestCategory.ofPath(path), () -> delegate.getWithQuery(path, queryString));
	}

	@Override
	public String getRaw(String owner, String name, String branch, String path) {
		return throttled(RequestCategory.RAW, () -> delegate.getRaw(owner, name, branch, path));
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String throttled(RequestCategory category, Supplier<String> request) {
		throttle.acquire(category);
		try {
			return request.get();
		}
		finally {
			RateLimitInfo info = delegate.getLastRateLimitInfo();
			if (category != RequestCategory.RAW && info != null) {
				// headers name their bucket; with concurrent workers the last one may not be ours
				throttle.observe(RequestCategory.ofResource(info.resource()), info);
			}
		}
	}

}
