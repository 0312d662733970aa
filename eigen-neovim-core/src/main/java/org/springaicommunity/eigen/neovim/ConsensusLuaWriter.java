package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.lua.LuaRenderer;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@code eigen.lua}: a Lua module whose {@code setup()} applies the consensus settings.
 *
 * <p>
 * The leader key comes first so that it is set before any plugin manager loads. Every
 * other setting at or above the consensus threshold follows with its consensus value.
 * When no setting reaches the threshold the options block is simply empty. The module
 * also lists the most popular plugins and colorschemes for reference.
 */
public class ConsensusLuaWriter implements ArtifactWriter {

	static final int MAX_PLUGINS = 30;

	static final int MAX_COLORSCHEMES = 10;

	/** Written separately or machine specific. */
	static final Set<String> EXCLUDED_NAMES = Set.of("mapleader", "maplocalleader", "loaded_netrw",
			"loaded_netrwPlugin", "base46_cache", "have_nerd_font");

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private static final String SPACE = "\" \"";

	@Override
	public String render(AggregatedStatistics statistics) {
		StringBuilder lua = new StringBuilder();
		lua.append("-- eigen.lua\n");
		lua.append("-- Community-consensus Neovim configuration\n");
		lua.append("-- Based on analysis of ").append(statistics.totalConfigs()).append(" configurations\n");
		lua.append("-- Settings appearing in ")
			.append(Percentages.threshold(statistics.thresholds().consensus()))
			.append("%+ of configs\n\n");
		lua.append("local M = {}\n\n");
		lua.append("function M.setup()\n");
		statistics.leaderKey().ifPresent(leader -> {
			lua.append("  -- Leader key (set before lazy.nvim)\n");
			lua.append("  vim.g.mapleader = ").append(leader).append('\n');
			if (SPACE.equals(leader)) {
				lua.append("  vim.g.maplocalleader = ").append(leader).append('\n');
			}
			lua.append('\n');
		});
		lua.append("  -- Options\n");
		for (RankedSetting setting : statistics.consensusSettings()) {
			if (EXCLUDED_NAMES.contains(setting.name())) {
				continue;
			}
			lua.append("  ")
				.append(target(setting))
				.append(" = ")
				.append(setting.consensusValue())
				.append("  -- ")
				.append(setting.entry().percentage().toPlainString())
				.append("%\n");
		}
		lua.append("end\n\n");

		lua.append("-- Popular plugins (for reference)\n");
		appendList(lua, "M.recommended_plugins", statistics.plugins(), MAX_PLUGINS);
		lua.append('\n');
		lua.append("-- Popular colorschemes\n");
		appendList(lua, "M.colorschemes", statistics.colorschemes(), MAX_COLORSCHEMES);
		lua.append('\n');
		lua.append("return M\n");
		return lua.toString();
	}

	private static String target(RankedSetting setting) {
		String root = "vim." + setting.namespace();
		return IDENTIFIER.matcher(setting.name()).matches() ? root + "." + setting.name()
				: root + "[" + LuaRenderer.quote(setting.name()) + "]";
	}

	private static void appendList(StringBuilder lua, String field, List<AggregateEntry> entries, int max) {
		lua.append(field).append(" = {\n");
		entries.stream()
			.limit(max)
			.forEach(entry -> lua.append("  ")
				.append(LuaRenderer.quote(entry.key()))
				.append(",  -- ")
				.append(entry.percentage().toPlainString())
				.append("%\n"));
		lua.append("}\n");
	}

}
