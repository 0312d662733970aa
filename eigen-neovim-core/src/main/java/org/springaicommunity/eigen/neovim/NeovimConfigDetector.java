package org.springaicommunity.eigen.neovim;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Heuristic classification of Lua files found by code search that are not Neovim configs
 * at all: window manager, game engine, terminal emulator and web server scripts also
 * ship an {@code init.lua}.
 *
 * <p>
 * The confidence is the share of Neovim signals found (three or more count as certain),
 * reduced by a penalty per foreign-platform signal. The penalty is softened when the file
 * uses the {@code vim.*} API directly.
 */
public class NeovimConfigDetector {

	public static final double DEFAULT_THRESHOLD = 0.5;

	private static final List<Pattern> POSITIVE = compile(Stream.concat(Stream.of(
			// vim API
			"\\bvim\\.opt\\b", "\\bvim\\.o\\b", "\\bvim\\.g\\b", "\\bvim\\.bo\\b", "\\bvim\\.wo\\b", "\\bvim\\.go\\b",
			"\\bvim\\.api\\b", "\\bvim\\.fn\\b", "\\bvim\\.cmd\\b", "\\bvim\\.keymap\\b", "\\bvim\\.lsp\\b",
			"\\bvim\\.treesitter\\b", "\\bvim\\.diagnostic\\b", "\\bvim\\.highlight\\b", "\\bvim\\.loop\\b",
			"\\bvim\\.uv\\b", "\\bvim\\.schedule\\b", "\\bvim\\.defer_fn\\b", "\\bvim\\.notify\\b",
			"\\bvim\\.inspect\\b", "\\bvim\\.tbl_", "\\bvim\\.validate\\b", "\\bvim\\.env\\b",
			// plugin managers
			"require\\s*\\(\\s*[\"']lazy[\"']", "require\\s*\\(\\s*[\"']packer[\"']", "Packer\\s*\\{",
			"lazy\\.setup\\s*\\(", "packer\\.startup\\s*\\("),
			Stream.concat(
					Stream.of("lspconfig", "nvim-lspconfig", "telescope", "nvim-cmp", "cmp", "nvim-treesitter",
							"treesitter", "mason", "which-key", "neo-tree", "nvim-tree", "lualine", "bufferline",
							"gitsigns", "null-ls", "none-ls", "luasnip")
						.map(NeovimConfigDetector::requirePattern),
					Stream.of("require\\s*\\(\\s*[\"']mini\\.", "\\bcolorscheme\\b", "\\bmapleader\\b",
							"\\blocalleader\\b", "\\baugroup\\b", "\\bautocmd\\b", "\\bnvim_create_autocmd\\b",
							"\\bnvim_set_keymap\\b", "\\bnvim_buf_set_keymap\\b"))));

	private static final List<Pattern> NEGATIVE = compile(Stream.of(
			// AwesomeWM
			"\\bawful\\.", "\\bwibox\\.", "\\bbeautiful\\.", "\\bnaughty\\.", "\\bgears\\.", "\\bruled\\.",
			"\\bmenubar\\.", requirePattern("awful"), requirePattern("wibox"), requirePattern("beautiful"),
			requirePattern("naughty"), requirePattern("gears"),
			// LOVE
			"\\blove\\.load\\b", "\\blove\\.update\\b", "\\blove\\.draw\\b", "\\blove\\.keypressed\\b",
			"\\blove\\.graphics\\b", "\\blove\\.audio\\b", "\\blove\\.physics\\b",
			// plain module
			"^return\\s+\\w+\\s*$", "^local\\s+M\\s*=\\s*\\{\\s*\\}",
			// OpenResty
			"\\bngx\\.", "\\bngx\\.req\\b", "\\bngx\\.resp\\b",
			// library packaging
			"rockspec_format", "package\\.loaded",
			// Hammerspoon
			"\\bhs\\.", "\\bhs\\.hotkey\\b", "\\bhs\\.window\\b",
			// WezTerm
			"\\bwezterm\\.", requirePattern("wezterm"),
			// Conky
			"\\bconky\\.",
			// mpv
			"\\bmp\\.", "\\bmp\\.command\\b", "\\bmp\\.observe_property\\b"));

	private static final Pattern MODULE_TABLE_RETURN = Pattern.compile("^return\\s+\\{", Pattern.MULTILINE);

	private final double threshold;

	public NeovimConfigDetector() {
		this(DEFAULT_THRESHOLD);
	}

	/**
	 * @param threshold minimum confidence, between 0 and 1, for a file to count as a
	 * Neovim config
	 */
	public NeovimConfigDetector(double threshold) {
		if (threshold < 0 || threshold > 1) {
			throw new IllegalArgumentException("threshold must be between 0 and 1, got: " + threshold);
		}
		this.threshold = threshold;
	}

	public boolean isNeovimConfig(String content) {
		return detect(content).neovim();
	}

	public Detection detect(String content) {
		if (content.isBlank()) {
			return new Detection(false, 0.0, List.of(), List.of());
		}
		List<String> positive = matching(POSITIVE, content);
		List<String> negative = matching(NEGATIVE, content);
		if (!negative.isEmpty() && positive.isEmpty()) {
			return new Detection(false, 0.0, positive, negative);
		}

		double positiveScore = Math.min(positive.size() / 3.0, 1.0);
		double penalty = Math.min(negative.size() * 0.3, 0.9);
		if (positive.stream().anyMatch(pattern -> pattern.contains("vim\\."))) {
			penalty *= 0.3;
		}
		double confidence = Math.max(0.0, positiveScore - penalty);

		if (positive.isEmpty() && MODULE_TABLE_RETURN.matcher(content).find()) {
			confidence = 0.1;
		}
		if (positive.isEmpty() && content.strip().length() < 50) {
			confidence = 0.0;
		}
		return new Detection(confidence >= threshold, confidence, positive, negative);
	}

	private static List<String> matching(List<Pattern> patterns, String content) {
		List<String> matched = new ArrayList<>();
		for (Pattern pattern : patterns) {
			if (pattern.matcher(content).find()) {
				matched.add(pattern.pattern());
			}
		}
		return matched;
	}

	private static String requirePattern(String module) {
		return "require\\s*\\(\\s*[\"']" + Pattern.quote(module) + "[\"']";
	}

	private static List<Pattern> compile(Stream<String> patterns) {
		return patterns.map(pattern -> Pattern.compile(pattern, Pattern.MULTILINE)).toList();
	}

	/**
	 * Outcome of classifying one file.
	 *
	 * @param neovim whether the confidence reached the threshold
	 * @param confidence score between 0 and 1
	 * @param positiveSignals patterns of Neovim signals found
	 * @param negativeSignals patterns of foreign-platform signals found
	 */
	public record Detection(boolean neovim, double confidence, List<String> positiveSignals,
			List<String> negativeSignals) {

		public Detection {
			positiveSignals = List.copyOf(positiveSignals);
			negativeSignals = List.copyOf(negativeSignals);
		}

	}

}
