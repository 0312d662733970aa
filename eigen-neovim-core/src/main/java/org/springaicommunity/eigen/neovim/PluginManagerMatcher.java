package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.lua.Expr;

import java.util.List;
import java.util.Optional;

/**
 * Adapts the plugin manager recognizers to {@link CallMatcher}, trying them in order.
 */
final class PluginManagerMatcher implements CallMatcher {

	private final List<PluginSpecRecognizer> recognizers;

	PluginManagerMatcher(List<PluginSpecRecognizer> recognizers) {
		this.recognizers = List.copyOf(recognizers);
	}

	@Override
	public Optional<List<StructuralFact>> match(Expr.Call call, LocalBindings bindings, String source) {
		for (PluginSpecRecognizer recognizer : recognizers) {
			Optional<List<StructuralFact.PluginRef>> plugins = recognizer.tryExtract(call, bindings, source);
			if (plugins.isPresent()) {
				return Optional.of(List.copyOf(plugins.get()));
			}
		}
		return Optional.empty();
	}

}
