package org.springaicommunity.eigen.neovim;

/**
 * A setting row of the statistics together with its consensus value.
 *
 * @param entry how many configs set the key
 * @param namespace {@code opt} or {@code g}
 * @param name option or variable name
 * @param consensusValue the value most configs chose, rendered as Lua
 * @param consensusCount how many configs chose it
 */
public record RankedSetting(AggregateEntry entry, String namespace, String name, String consensusValue,
		int consensusCount) {

	public String key() {
		return entry.key();
	}

}
