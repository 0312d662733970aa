package org.springaicommunity.eigen.neovim;

/**
 * Saved position of one query strategy.
 *
 * @param status current state
 * @param nextPage the 1-based page to request next
 */
public record StrategyProgress(StrategyStatus status, int nextPage) {

	public static final StrategyProgress PENDING = new StrategyProgress(StrategyStatus.PENDING, 1);

	public StrategyProgress {
		if (nextPage < 1) {
			throw new IllegalArgumentException("nextPage must be at least 1, got: " + nextPage);
		}
	}

	StrategyProgress paginating(int page) {
		return new StrategyProgress(StrategyStatus.PAGINATING, page);
	}

	StrategyProgress exhausted() {
		return new StrategyProgress(StrategyStatus.EXHAUSTED, nextPage);
	}

	/**
	 * Failed at the current page; a later run resumes from it.
	 */
	StrategyProgress failed() {
		return new StrategyProgress(StrategyStatus.FAILED, nextPage);
	}

}
