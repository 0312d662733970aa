package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.lua.LuaRenderer;

/**
 * {@code plugins.lua}: a lazy.nvim spec with every plugin at or above the plugin-spec
 * threshold.
 */
public class PluginSpecWriter implements ArtifactWriter {

	static final int MAX_PLUGINS = 30;

	@Override
	public String render(AggregatedStatistics statistics) {
		StringBuilder lua = new StringBuilder();
		lua.append("-- Popular plugins for lazy.nvim\n");
		lua.append("-- Based on analysis of ").append(statistics.totalConfigs()).append(" configurations\n");
		lua.append("-- Plugins appearing in ")
			.append(Percentages.threshold(statistics.thresholds().pluginSpec()))
			.append("%+ of configs\n\n");
		lua.append("return {\n");
		statistics.pluginSpecEntries()
			.stream()
			.limit(MAX_PLUGINS)
			.forEach(plugin -> lua.append("  { ")
				.append(LuaRenderer.quote(plugin.key()))
				.append(" },  -- ")
				.append(plugin.percentage().toPlainString())
				.append("%\n"));
		lua.append("}\n");
		return lua.toString();
	}

}
