package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Shared throttle state consulted before every GitHub request.
 *
 * <p>
 * Each {@link RequestCategory} has a sliding-window budget (for example 10 code searches
 * per minute). On top of that, the last rate limit headers observed for a category drive
 * two further waits:
 * <ul>
 * <li>quota exhausted: wait until the reported reset, or throw
 * {@link RateLimitedException} when the reset is further away than the allowed wait</li>
 * <li>quota low: pace requests evenly across the time left until reset (100ms to 10s per
 * request)</li>
 * </ul>
 *
 * <p>
 * Thread-safe. Waiting happens outside the lock so concurrent workers do not serialize
 * their sleeps.
 */
public class RequestThrottle {

	private static final Logger logger = LoggerFactory.getLogger(RequestThrottle.class);

	private static final long MIN_PACE_MS = 100;

	private static final long MAX_PACE_MS = 10_000;

	private final Map<RequestCategory, Budget> budgets;

	private final Map<RequestCategory, Deque<Instant>> issued = new EnumMap<>(RequestCategory.class);

	private final Map<RequestCategory, RateLimitInfo> observed = new EnumMap<>(RequestCategory.class);

	private final Map<RequestCategory, Instant> blockedUntil = new EnumMap<>(RequestCategory.class);

	private final int pacingThreshold;

	private final Duration maxResetWait;

	private final Sleeper sleeper;

	private final Clock clock;

	private RequestThrottle(Builder builder) {
		this.budgets = new EnumMap<>(builder.budgets);
		this.pacingThreshold = builder.pacingThreshold;
		this.maxResetWait = builder.maxResetWait;
		this.sleeper = builder.sleeper;
		this.clock = builder.clock;
		for (RequestCategory category : RequestCategory.values()) {
			issued.put(category, new ArrayDeque<>());
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Block until a request in the given category may be issued, then record it against
	 * the category's budget.
	 * @throws RateLimitedException if the quota is exhausted and resets too far in the
	 * future
	 */
	public void acquire(RequestCategory category) {
		Permit permit;
		while (!(permit = tryReserve(category)).granted()) {
			logger.debug("Throttling {} request for {}ms", category, permit.sleepMs());
			sleep(permit.sleepMs());
		}
		if (permit.sleepMs() > 0) {
			sleep(permit.sleepMs());
		}
	}

	/**
	 * Record rate limit headers seen on a response in the given category.
	 */
	public synchronized void observe(RequestCategory category, @Nullable RateLimitInfo info) {
		if (info != null && info.remaining() >= 0) {
			observed.put(category, info);
		}
	}

	/**
	 * Returns the last rate limit headers recorded for a category, if any.
	 */
	public synchronized @Nullable RateLimitInfo lastObserved(RequestCategory category) {
		return observed.get(category);
	}

	/**
	 * Either reserves a slot (possibly with a pacing delay to observe afterwards) or
	 * reports how long to wait before asking again.
	 */
	private synchronized Permit tryReserve(RequestCategory category) {
		Instant now = clock.instant();

		RateLimitInfo info = observed.get(category);
		if (info != null && info.isExceeded() && info.reset() > 0) {
			Instant resumeAt = info.getResetTime().plusSeconds(1);
			if (Duration.between(now, resumeAt).compareTo(maxResetWait) > 0) {
				throw new RateLimitedException(category + " quota exhausted until " + info.getResetTime(),
						info.getResetTime());
			}
			// stale headers must not block again once the reset has passed
			observed.remove(category);
			blockedUntil.merge(category, resumeAt, (a, b) -> a.isAfter(b) ? a : b);
			logger.info("{} quota exhausted. Waiting until reset at {}", category, info.getResetTime());
		}

		Instant blocked = blockedUntil.get(category);
		if (blocked != null) {
			if (blocked.isAfter(now)) {
				return Permit.waitFor(Duration.between(now, blocked).toMillis());
			}
			blockedUntil.remove(category);
		}

		Budget budget = budgets.get(category);
		Deque<Instant> window = issued.get(category);
		if (budget != null) {
			Instant windowStart = now.minus(budget.window());
			while (!window.isEmpty() && !window.peekFirst().isAfter(windowStart)) {
				window.pollFirst();
			}
			if (window.size() >= budget.maxRequests()) {
				return Permit.waitFor(Math.max(1, Duration.between(windowStart, window.peekFirst()).toMillis()));
			}
		}
		window.addLast(now);

		long pace = paceFor(info, now);
		if (pace > 0) {
			logger.debug("Pacing {}: {}/{} remaining, sleeping {}ms", category, info.remaining(), info.limit(), pace);
		}
		return new Permit(true, pace);
	}

	private long paceFor(@Nullable RateLimitInfo info, Instant now) {
		if (info == null || info.remaining() <= 0 || info.remaining() >= pacingThreshold) {
			return 0;
		}
		long secondsUntilReset = info.reset() - now.getEpochSecond();
		if (secondsUntilReset <= 0) {
			return 0;
		}
		long paceMs = (secondsUntilReset * 1000) / info.remaining();
		return Math.max(MIN_PACE_MS, Math.min(paceMs, MAX_PACE_MS));
	}

	private void sleep(long ms) {
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransientFetchException("Throttle wait interrupted", e);
		}
	}

	private record Permit(boolean granted, long sleepMs) {

		static Permit waitFor(long sleepMs) {
			return new Permit(false, sleepMs);
		}

	}

	/**
	 * Requests allowed per sliding window.
	 *
	 * @param maxRequests requests allowed inside one window
	 * @param window length of the window
	 */
	public record Budget(int maxRequests, Duration window) {

		public Budget {
			if (maxRequests < 1) {
				throw new IllegalArgumentException("maxRequests must be at least 1");
			}
			if (window.isNegative() || window.isZero()) {
				throw new IllegalArgumentException("window must be positive");
			}
		}

		public static Budget perMinute(int maxRequests) {
			return new Budget(maxRequests, Duration.ofMinutes(1));
		}

	}

	/**
	 * Builder for {@link RequestThrottle}.
	 *
	 * <p>
	 * Defaults: 10 code searches per minute, no window budget for CORE and RAW, pacing
	 * below 100 remaining requests, waits of at most 1 hour for a reset.
	 */
	public static class Builder {

		private final Map<RequestCategory, Budget> budgets = new EnumMap<>(RequestCategory.class);

		private int pacingThreshold = 100;

		private Duration maxResetWait = Duration.ofHours(1);

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Clock clock = Clock.systemUTC();

		private Builder() {
			budgets.put(RequestCategory.SEARCH, Budget.perMinute(10));
		}

		public Builder budget(RequestCategory category, Budget budget) {
			budgets.put(category, budget);
			return this;
		}

		/**
		 * Start pacing when the observed remaining quota drops below this value.
		 */
		public Builder pacingThreshold(int pacingThreshold) {
			this.pacingThreshold = pacingThreshold;
			return this;
		}

		public Builder maxResetWait(Duration maxResetWait) {
			this.maxResetWait = maxResetWait;
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

		public RequestThrottle build() {
			if (pacingThreshold < 0) {
				throw new IllegalStateException("pacingThreshold must be non-negative");
			}
			return new RequestThrottle(this);
		}

	}

}
