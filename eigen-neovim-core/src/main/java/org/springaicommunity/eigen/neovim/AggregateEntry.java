package org.springaicommunity.eigen.neovim;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;

/**
 * One ranked row of aggregated statistics.
 *
 * @param key what was counted: a setting key, plugin, colorscheme or keymap
 * @param count number of distinct configs with the key
 * @param total number of configs analyzed
 * @param percentage {@code 100 * count / total}, rounded half-up to two decimals
 */
public record AggregateEntry(String key, int count, int total, BigDecimal percentage) {

	/**
	 * Descending by percentage, ties ascending by key.
	 */
	public static final Comparator<AggregateEntry> RANKING = Comparator.comparingInt(AggregateEntry::count)
		.reversed()
		.thenComparing(AggregateEntry::key);

	public AggregateEntry {
		if (count < 0 || total < 0 || count > total) {
			throw new IllegalArgumentException("count must be between 0 and total, got: " + count + "/" + total);
		}
	}

	public static AggregateEntry of(String key, int count, int total) {
		return new AggregateEntry(key, count, total, percentage(count, total));
	}

	/**
	 * Whether the exact, unrounded percentage reaches the threshold.
	 */
	public boolean reaches(double threshold) {
		return total > 0 && count * 100.0 / total >= threshold;
	}

	static BigDecimal percentage(int count, int total) {
		if (total == 0) {
			return BigDecimal.ZERO.setScale(2);
		}
		return BigDecimal.valueOf(count * 100L).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
	}

}
