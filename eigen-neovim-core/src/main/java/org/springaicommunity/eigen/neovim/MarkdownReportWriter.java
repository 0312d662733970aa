package org.springaicommunity.eigen.neovim;

import java.util.List;

/**
 * The Markdown report: ranked tables of settings, colorschemes, plugins and keymaps, and
 * a summary of the files that were skipped.
 */
public class MarkdownReportWriter implements ArtifactWriter {

	static final int MAX_SETTINGS = 100;

	static final int MAX_COLORSCHEMES = 20;

	static final int MAX_PLUGINS = 30;

	static final int MAX_KEYMAPS = 30;

	@Override
	public String render(AggregatedStatistics statistics) {
		StringBuilder md = new StringBuilder();
		md.append("# Eigen-Neovim\n\n");
		md.append("Statistics over ")
			.append(statistics.totalConfigs())
			.append(" Neovim configurations found on GitHub. Entries used by at least ")
			.append(Percentages.threshold(statistics.thresholds().report()))
			.append("% of configurations are listed.\n\n");

		md.append("## Settings\n\n");
		if (statistics.settings().isEmpty()) {
			md.append("No settings reached the threshold.\n\n");
		}
		else {
			md.append("| Setting | Usage | Most common value |\n");
			md.append("|---|---:|---|\n");
			for (RankedSetting setting : limit(statistics.settings(), MAX_SETTINGS)) {
				md.append("| ")
					.append(code(setting.key()))
					.append(" | ")
					.append(setting.entry().percentage().toPlainString())
					.append("% | ")
					.append(code(setting.consensusValue()))
					.append(" |\n");
			}
			md.append('\n');
		}

		appendTable(md, "Colorschemes", "Colorscheme", limit(statistics.colorschemes(), MAX_COLORSCHEMES));
		appendTable(md, "Plugins", "Plugin", limit(statistics.plugins(), MAX_PLUGINS));

		md.append("## Keymaps\n\n");
		List<AggregateEntry> keymaps = limit(statistics.keymaps(), MAX_KEYMAPS);
		if (keymaps.isEmpty()) {
			md.append("No keymaps reached the threshold.\n\n");
		}
		else {
			md.append("| Mode | Keys | Usage |\n");
			md.append("|---|---|---:|\n");
			for (AggregateEntry keymap : keymaps) {
				int space = keymap.key().indexOf(' ');
				md.append("| ")
					.append(code(keymap.key().substring(0, space)))
					.append(" | ")
					.append(code(keymap.key().substring(space + 1)))
					.append(" | ")
					.append(keymap.percentage().toPlainString())
					.append("% |\n");
			}
			md.append('\n');
		}

		md.append("## Skipped files\n\n");
		md.append("- Unparseable: ").append(statistics.unparseable()).append('\n');
		md.append("- Not Neovim configurations: ").append(statistics.nonNeovimSkipped()).append('\n');
		md.append("- Unreadable cache entries: ").append(statistics.unreadable()).append('\n');
		return md.toString();
	}

	private static void appendTable(StringBuilder md, String title, String column, List<AggregateEntry> entries) {
		md.append("## ").append(title).append("\n\n");
		if (entries.isEmpty()) {
			md.append("No ").append(title.toLowerCase()).append(" reached the threshold.\n\n");
			return;
		}
		md.append("| ").append(column).append(" | Usage |\n");
		md.append("|---|---:|\n");
		for (AggregateEntry entry : entries) {
			md.append("| ")
				.append(code(entry.key()))
				.append(" | ")
				.append(entry.percentage().toPlainString())
				.append("% |\n");
		}
		md.append('\n');
	}

	private static <T> List<T> limit(List<T> entries, int max) {
		return entries.size() <= max ? entries : entries.subList(0, max);
	}

	/**
	 * A code span safe inside a table cell.
	 */
	static String code(String text) {
		String cell = text.replace("|", "\\|").replace('\n', ' ');
		String fence = cell.contains("`") ? "``" : "`";
		String pad = cell.startsWith("`") || cell.endsWith("`") ? " " : "";
		return fence + pad + cell + pad + fence;
	}

}
