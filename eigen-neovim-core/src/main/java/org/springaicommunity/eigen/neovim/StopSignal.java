package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop request for a running crawl. The crawl checks it between items,
 * finishes what is in flight, saves its checkpoint and returns.
 */
public final class StopSignal {

	private final AtomicReference<@Nullable String> reason = new AtomicReference<>();

	/**
	 * Request a stop. Only the first reason is kept.
	 */
	public void request(String why) {
		reason.compareAndSet(null, why);
	}

	public boolean isRequested() {
		return reason.get() != null;
	}

	public @Nullable String reason() {
		return reason.get();
	}

}
