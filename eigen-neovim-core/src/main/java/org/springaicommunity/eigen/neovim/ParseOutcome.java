package org.springaicommunity.eigen.neovim;

/**
 * Whether a config file could be parsed.
 */
public enum ParseOutcome {

	PARSED, UNPARSEABLE

}
