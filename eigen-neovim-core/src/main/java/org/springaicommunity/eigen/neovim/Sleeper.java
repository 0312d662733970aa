package org.springaicommunity.eigen.neovim;

/**
 * Blocking wait used by the throttle and retry decorators. Tests substitute a recording
 * implementation so that backoff and pacing can be asserted without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper SYSTEM = Thread::sleep;

	void sleep(long millis) throws InterruptedException;

}
