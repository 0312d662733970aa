package org.springaicommunity.eigen.neovim;

import java.util.List;
import java.util.Optional;

/**
 * Ranked, threshold-filtered statistics over a set of configs.
 *
 * <p>
 * Each view is cut at its own threshold from the full ranking, so a consensus or
 * plugin-spec threshold below the report threshold still selects entries the report
 * leaves out.
 *
 * @param totalConfigs configs analyzed, including unparseable ones
 * @param settings settings at or above the report threshold
 * @param consensusSettings settings at or above the consensus threshold
 * @param colorschemes colorschemes at or above the report threshold
 * @param plugins plugins at or above the report threshold
 * @param pluginSpecEntries plugins at or above the plugin-spec threshold
 * @param keymaps keymaps ({@code mode lhs}) at or above the report threshold
 * @param leaderKeys values assigned to {@code vim.g.mapleader}, rendered as Lua
 * @param unparseable configs that could not be parsed
 * @param nonNeovimSkipped files skipped because they are not Neovim configs
 * @param unreadable cache units that could not be read
 * @param thresholds thresholds the statistics were computed with
 */
public record AggregatedStatistics(int totalConfigs, List<RankedSetting> settings,
		List<RankedSetting> consensusSettings, List<AggregateEntry> colorschemes, List<AggregateEntry> plugins,
		List<AggregateEntry> pluginSpecEntries, List<AggregateEntry> keymaps, List<AggregateEntry> leaderKeys,
		int unparseable, int nonNeovimSkipped, int unreadable, Thresholds thresholds) {

	public AggregatedStatistics {
		settings = List.copyOf(settings);
		consensusSettings = List.copyOf(consensusSettings);
		colorschemes = List.copyOf(colorschemes);
		plugins = List.copyOf(plugins);
		pluginSpecEntries = List.copyOf(pluginSpecEntries);
		keymaps = List.copyOf(keymaps);
		leaderKeys = List.copyOf(leaderKeys);
	}

	/**
	 * The same statistics with the number of unreadable cache units set.
	 */
	public AggregatedStatistics withUnreadable(int count) {
		return new AggregatedStatistics(totalConfigs, settings, consensusSettings, colorschemes, plugins,
				pluginSpecEntries, keymaps, leaderKeys, unparseable, nonNeovimSkipped, count, thresholds);
	}

	/**
	 * The most common leader key, rendered as Lua.
	 */
	public Optional<String> leaderKey() {
		return leaderKeys.stream().findFirst().map(AggregateEntry::key);
	}

}
