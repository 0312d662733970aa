package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.eigen.neovim.lua.Expr;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Colorschemes applied with {@code vim.cmd.colorscheme}, with a {@code colorscheme} command
 * string passed to {@code vim.cmd}, {@code vim.command} or {@code vim.api.nvim_command}
 * (directly or through {@code pcall}), or by loading a known colorscheme module with
 * {@code require("...").load()}.
 */
final class ColorschemeMatcher implements CallMatcher {

	private static final Pattern COMMAND = Pattern.compile("\\bcolorscheme\\s+([A-Za-z0-9_.-]+)",
			Pattern.CASE_INSENSITIVE);

	private static final Set<String> FALSE_POSITIVES = Set.of("vim", "cmd", "colorscheme", "that", "the", "a", "an",
			"my", "your", "this", "new", "old", "default", "custom", "config");

	private static final Set<List<String>> COMMAND_FUNCTIONS = Set.of(List.of("vim", "cmd"),
			List.of("vim", "command"), List.of("vim", "api", "nvim_command"));

	private static final List<String> COLORSCHEME_FUNCTION = List.of("vim", "cmd", "colorscheme");

	/**
	 * Colorscheme plugin modules and the colorscheme they provide.
	 */
	static final Map<String, String> KNOWN_MODULES = Map.ofEntries(Map.entry("tokyonight", "tokyonight"),
			Map.entry("tokyonight.nvim", "tokyonight"), Map.entry("catppuccin", "catppuccin"),
			Map.entry("gruvbox", "gruvbox"), Map.entry("gruvbox-material", "gruvbox-material"),
			Map.entry("onedark", "onedark"), Map.entry("onedarkpro", "onedark"), Map.entry("rose-pine", "rose-pine"),
			Map.entry("dracula", "dracula"), Map.entry("nord", "nord"), Map.entry("nightfox", "nightfox"),
			Map.entry("kanagawa", "kanagawa"), Map.entry("everforest", "everforest"),
			Map.entry("material", "material"), Map.entry("monokai", "monokai"), Map.entry("solarized", "solarized"),
			Map.entry("github-theme", "github"), Map.entry("vscode", "vscode"), Map.entry("one_monokai", "monokai"),
			Map.entry("ayu", "ayu"), Map.entry("melange", "melange"), Map.entry("oxocarbon", "oxocarbon"),
			Map.entry("cyberdream", "cyberdream"), Map.entry("bamboo", "bamboo"),
			Map.entry("lackluster", "lackluster"), Map.entry("fluoromachine", "fluoromachine"),
			Map.entry("moonfly", "moonfly"), Map.entry("nightfly", "nightfly"), Map.entry("sonokai", "sonokai"),
			Map.entry("edge", "edge"), Map.entry("aurora", "aurora"), Map.entry("palenight", "palenight"),
			Map.entry("onehalf", "onehalf"), Map.entry("jellybeans", "jellybeans"), Map.entry("molokai", "molokai"),
			Map.entry("iceberg", "iceberg"), Map.entry("tender", "tender"), Map.entry("srcery", "srcery"),
			Map.entry("vim-monokai-tasty", "monokai"), Map.entry("vim-one", "one"),
			Map.entry("papercolor", "papercolor"), Map.entry("base16", "base16"), Map.entry("doom-one", "doom-one"),
			Map.entry("onenord", "onenord"), Map.entry("zephyr", "zephyr"));

	@Override
	public Optional<List<StructuralFact>> match(Expr.Call call, LocalBindings bindings, String source) {
		@Nullable String name = colorscheme(call, bindings);
		return name == null ? Optional.empty()
				: Optional.of(List.of(new StructuralFact.ColorschemeRef(name, source)));
	}

	private static @Nullable String colorscheme(Expr.Call call, LocalBindings bindings) {
		List<Expr> args = call.args();
		List<String> callee = bindings.segments(call.callee());
		if (callee != null) {
			if (callee.equals(COLORSCHEME_FUNCTION) && !args.isEmpty()) {
				return accept(bindings.stringValue(args.get(0)));
			}
			if (COMMAND_FUNCTIONS.contains(callee) && !args.isEmpty()) {
				return fromCommand(bindings.stringValue(args.get(0)));
			}
			if (callee.equals(List.of("pcall")) && args.size() >= 2) {
				List<String> target = bindings.segments(args.get(0));
				if (COLORSCHEME_FUNCTION.equals(target)) {
					return accept(bindings.stringValue(args.get(1)));
				}
				if (target != null && COMMAND_FUNCTIONS.contains(target)) {
					return fromCommand(bindings.stringValue(args.get(1)));
				}
			}
		}
		if (bindings.resolve(call.callee()) instanceof Expr.FieldAccess field && field.name().equals("load")) {
			String module = bindings.requiredModule(field.target());
			if (module != null) {
				return KNOWN_MODULES.get(module);
			}
		}
		return null;
	}

	private static @Nullable String fromCommand(@Nullable String command) {
		if (command == null) {
			return null;
		}
		Matcher matcher = COMMAND.matcher(command);
		return matcher.find() ? accept(matcher.group(1)) : null;
	}

	private static @Nullable String accept(@Nullable String name) {
		if (name == null) {
			return null;
		}
		String trimmed = name.strip();
		if (trimmed.length() <= 1 || FALSE_POSITIVES.contains(trimmed.toLowerCase(Locale.ROOT))) {
			return null;
		}
		return trimmed;
	}

}
