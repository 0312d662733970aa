package org.springaicommunity.eigen.neovim;

/**
 * Crawl state of one query strategy: {@code PENDING -> PAGINATING -> (EXHAUSTED | FAILED)}.
 */
public enum StrategyStatus {

	PENDING, PAGINATING, EXHAUSTED, FAILED;

	public boolean isTerminal() {
		return this == EXHAUSTED || this == FAILED;
	}

}
