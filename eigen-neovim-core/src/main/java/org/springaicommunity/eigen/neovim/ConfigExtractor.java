package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.eigen.neovim.lua.Block;
import org.springaicommunity.eigen.neovim.lua.Expr;
import org.springaicommunity.eigen.neovim.lua.LuaParser;
import org.springaicommunity.eigen.neovim.lua.LuaSyntaxException;
import org.springaicommunity.eigen.neovim.lua.LuaTreeWalker;
import org.springaicommunity.eigen.neovim.lua.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts {@link StructuralFact}s from the text of one config file.
 *
 * <p>
 * The text is parsed into a syntax tree and walked in source order. Assignments to an
 * option namespace ({@code vim.opt}, {@code vim.o}, {@code vim.g}, ...) become settings;
 * calls are offered to the setting, keymap, colorscheme and plugin manager matchers in
 * that order. Local aliases are tracked so that {@code local opt = vim.opt} and
 * {@code local plugins = { ... }} are seen through.
 *
 * <p>
 * Extraction is pure and thread-safe: a syntax error or a tree too deep to walk yields
 * {@link ParseOutcome#UNPARSEABLE} and no facts, never an exception.
 */
public class ConfigExtractor {

	private static final Logger logger = LoggerFactory.getLogger(ConfigExtractor.class);

	/** Source identity used when extracting text that did not come from the cache. */
	public static final String INLINE_SOURCE = "<inline>";

	private final List<CallMatcher> matchers;

	public ConfigExtractor() {
		this(PluginSpecRecognizer.defaults());
	}

	public ConfigExtractor(List<PluginSpecRecognizer> recognizers) {
		this.matchers = List.of(new SettingCallMatcher(), new KeymapMatcher(), new ColorschemeMatcher(),
				new PluginManagerMatcher(recognizers));
	}

	public ExtractionResult extract(String text) {
		return extract(text, INLINE_SOURCE);
	}

	public ExtractionResult extract(CachedConfig config) {
		return extract(config.content(), config.identity());
	}

	public ExtractionResult extract(String text, String source) {
		Block chunk;
		try {
			chunk = LuaParser.parse(text);
		}
		catch (LuaSyntaxException e) {
			logger.debug("Could not parse {}: {}", source, e.getMessage());
			return ExtractionResult.unparseable(e.getMessage());
		}
		catch (StackOverflowError e) {
			logger.warn("Syntax tree of {} is too deep to parse", source);
			return ExtractionResult.unparseable("syntax tree too deep");
		}
		List<StructuralFact> facts = new ArrayList<>();
		try {
			LuaTreeWalker.walk(chunk, new FactCollector(source, facts));
		}
		catch (StackOverflowError e) {
			logger.warn("Syntax tree of {} is too deep to walk", source);
			return ExtractionResult.unparseable("syntax tree too deep");
		}
		return ExtractionResult.parsed(facts);
	}

	private final class FactCollector implements LuaTreeWalker.Visitor {

		private final String source;

		private final List<StructuralFact> facts;

		private final LocalBindings bindings = new LocalBindings();

		FactCollector(String source, List<StructuralFact> facts) {
			this.source = source;
			this.facts = facts;
		}

		@Override
		public void visitStatement(Stmt statement) {
			if (statement instanceof Stmt.Assignment assignment) {
				List<Expr> targets = assignment.targets();
				List<Expr> values = assignment.values();
				for (int i = 0; i < targets.size() && i < values.size(); i++) {
					StructuralFact.Setting setting = SettingCallMatcher.fromAssignment(targets.get(i), values.get(i),
							bindings, source);
					if (setting != null) {
						facts.add(setting);
					}
				}
				for (int i = 0; i < targets.size(); i++) {
					if (targets.get(i) instanceof Expr.Name name) {
						rebind(name.name(), i < values.size() ? values.get(i) : null);
					}
				}
			}
			else if (statement instanceof Stmt.LocalAssignment local) {
				for (int i = 0; i < local.names().size(); i++) {
					rebind(local.names().get(i), i < local.values().size() ? local.values().get(i) : null);
				}
			}
			else if (statement instanceof Stmt.LocalFunction function) {
				bindings.unbind(function.name());
			}
			else if (statement instanceof Stmt.FunctionDecl decl && decl.namePath().size() == 1
					&& decl.method() == null) {
				bindings.unbind(decl.namePath().get(0));
			}
		}

		@Override
		public void visitExpression(Expr expression) {
			if (!(expression instanceof Expr.Call call)) {
				return;
			}
			for (CallMatcher matcher : matchers) {
				Optional<List<StructuralFact>> matched = matcher.match(call, bindings, source);
				if (matched.isPresent()) {
					facts.addAll(matched.get());
					return;
				}
			}
		}

		private void rebind(String name, @Nullable Expr value) {
			if (value == null) {
				bindings.unbind(name);
			}
			else {
				bindings.bind(name, value);
			}
		}

	}

}
