package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * HTTP client for the GitHub REST API and the raw content host, built on the JDK
 * HttpClient.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}. The token is optional: without one, requests are sent
 * anonymously and GitHub applies its lower unauthenticated limits.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final String GITHUB_API_BASE = "https://api.github.com";

	private static final String RAW_CONTENT_BASE = "https://raw.githubusercontent.com";

	private static final String USER_AGENT = "eigen-neovim";

	private final HttpClient httpClient;

	private final @Nullable String token;

	private final Duration requestTimeout;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(@Nullable String token) {
		this(token, Duration.ofSeconds(30));
	}

	public GitHubHttpClient(@Nullable String token, Duration requestTimeout) {
		this.token = (token == null || token.isBlank()) ? null : token;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	/**
	 * Returns true if requests carry a credential.
	 */
	public boolean isAuthenticated() {
		return token != null;
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : GITHUB_API_BASE + path;
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Accept", "application/vnd.github+json")
			.header("User-Agent", USER_AGENT)
			.GET();
		if (token != null) {
			builder.header("Authorization", "Bearer " + token);
		}
		return timed(builder.build());
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String url = GITHUB_API_BASE + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	@Override
	public String getRaw(String owner, String name, String branch, String path) {
		String url = RAW_CONTENT_BASE + "/" + owner + "/" + name + "/" + encodeSegment(branch) + "/"
				+ encodePath(path);
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("User-Agent", USER_AGENT)
			.GET();
		if (token != null) {
			builder.header("Authorization", "Bearer " + token);
		}
		return timed(builder.build());
	}

	private String timed(HttpRequest request) {
		logger.debug("GET {}", request.uri());
		long start = System.currentTimeMillis();
		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", request.uri(), System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", request.uri(), System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request,
					HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

			// Extract rate limit headers from ALL responses (2xx included)
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);
			long retryAfter = parseLongHeader(response, "Retry-After", -1);
			String resource = response.headers().firstValue("X-RateLimit-Resource").orElse("core");

			if (remaining >= 0) {
				this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used, resource);
				if (remaining < 5) {
					logger.info("Rate limit low ({}): {}/{} remaining, resets at epoch {}", resource, remaining, limit,
							reset);
				}
				else {
					logger.debug("Rate limit ({}): {}/{} remaining, resets at epoch {}", resource, remaining, limit,
							reset);
				}
			}

			int statusCode = response.statusCode();
			String body = response.body();
			if (statusCode >= 200 && statusCode < 300) {
				return body;
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check GH_TOKEN or GITHUB_TOKEN.",
						statusCode, body, remaining, reset, retryAfter);
			}
			else if (statusCode == 403) {
				if (remaining == 0 || mentionsRateLimit(body)) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode, body,
							remaining, reset, retryAfter);
				}
				throw new GitHubApiException("Forbidden: " + body, statusCode, body, remaining, reset, retryAfter);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, body, remaining, reset,
						retryAfter);
			}
			else if (statusCode == 422) {
				throw new GitHubApiException("Unprocessable query: " + request.uri(), statusCode, body, remaining,
						reset, retryAfter);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode, body,
						remaining, reset, retryAfter);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, body, remaining, reset,
						retryAfter);
			}
		}
		catch (IOException e) {
			logger.debug("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	static boolean mentionsRateLimit(@Nullable String body) {
		return body != null && body.toLowerCase(Locale.ROOT).contains("rate limit");
	}

	private static String encodePath(String path) {
		StringBuilder sb = new StringBuilder();
		for (String segment : path.split("/")) {
			if (segment.isEmpty()) {
				continue;
			}
			if (sb.length() > 0) {
				sb.append('/');
			}
			sb.append(encodeSegment(segment));
		}
		return sb.toString();
	}

	private static String encodeSegment(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub calls fail.
	 *
	 * <p>
	 * Carries rate limit information when available, enabling reset-aware waits in
	 * {@link RetryingGitHubClient}.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		private final long retryAfterSeconds;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds, long retryAfterSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
			this.retryAfterSeconds = retryAfterSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
			this.retryAfterSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		public long getRetryAfterSeconds() {
			return retryAfterSeconds;
		}

		/**
		 * Returns true if this exception represents a rate limit error (429, 403 with
		 * remaining=0, or 403 whose body mentions the rate limit).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429)
					|| (statusCode == 403 && (rateLimitRemaining == 0 || mentionsRateLimit(responseBody)));
		}

		/**
		 * Returns true for failures worth retrying: network errors (no status) and 5xx.
		 */
		public boolean isTransient() {
			return statusCode == -1 || statusCode >= 500;
		}

	}

}
