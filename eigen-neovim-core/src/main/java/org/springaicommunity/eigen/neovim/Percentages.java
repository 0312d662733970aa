package org.springaicommunity.eigen.neovim;

import java.math.BigDecimal;

final class Percentages {

	private Percentages() {
	}

	/**
	 * A threshold as written by a user: {@code 40} rather than {@code 40.0}.
	 */
	static String threshold(double value) {
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

}
