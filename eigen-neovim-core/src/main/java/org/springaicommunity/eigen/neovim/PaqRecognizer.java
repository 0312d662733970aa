package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.lua.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * paq-nvim: {@code require("paq") { "owner/name", { "owner/name", opt = true } }}.
 */
final class PaqRecognizer implements PluginSpecRecognizer {

	@Override
	public Optional<List<StructuralFact.PluginRef>> tryExtract(Expr.Call call, LocalBindings bindings, String source) {
		if (!"paq".equals(bindings.requiredModule(call.callee())) || call.args().size() != 1) {
			return Optional.empty();
		}
		List<StructuralFact.PluginRef> plugins = new ArrayList<>();
		if (bindings.resolve(call.args().get(0)) instanceof Expr.TableConstructor table) {
			for (Expr entry : PluginSpecTables.positional(table)) {
				PluginSpecTables.collect(entry, PluginSpecKind.STRING, "requires", bindings, source, plugins, 1);
			}
		}
		return Optional.of(plugins);
	}

}
