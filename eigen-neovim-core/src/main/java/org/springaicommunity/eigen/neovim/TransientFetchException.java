package org.springaicommunity.eigen.neovim;

/**
 * Thrown after a network call kept failing with retryable errors (timeouts, connection
 * resets, 5xx) for every allowed attempt. Callers usually skip the affected item and
 * continue.
 */
public class TransientFetchException extends RuntimeException {

	public TransientFetchException(String message, Throwable cause) {
		super(message, cause);
	}

}
