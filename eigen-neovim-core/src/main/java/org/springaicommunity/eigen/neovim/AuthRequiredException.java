package org.springaicommunity.eigen.neovim;

/**
 * Thrown when a command needs a GitHub credential and none (or an invalid one) is
 * available. Fatal for the invoking command.
 */
public class AuthRequiredException extends RuntimeException {

	public AuthRequiredException(String message) {
		super(message);
	}

	public AuthRequiredException(String message, Throwable cause) {
		super(message, cause);
	}

}
