package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.lua.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * lazy.nvim: {@code require("lazy").setup(spec, opts)}, where the spec may also be given
 * as the {@code spec} field of either argument.
 */
final class LazyNvimRecognizer implements PluginSpecRecognizer {

	@Override
	public Optional<List<StructuralFact.PluginRef>> tryExtract(Expr.Call call, LocalBindings bindings, String source) {
		if (!(bindings.resolve(call.callee()) instanceof Expr.FieldAccess field) || !field.name().equals("setup")
				|| !"lazy".equals(bindings.requiredModule(field.target()))) {
			return Optional.empty();
		}
		List<StructuralFact.PluginRef> plugins = new ArrayList<>();
		boolean specField = false;
		for (Expr arg : call.args()) {
			if (bindings.resolve(arg) instanceof Expr.TableConstructor table) {
				Expr spec = PluginSpecTables.named(table, "spec");
				if (spec != null) {
					PluginSpecTables.collect(spec, PluginSpecKind.STRING, "dependencies", bindings, source, plugins, 0);
					specField = true;
				}
			}
		}
		if (!specField && !call.args().isEmpty()) {
			PluginSpecTables.collect(call.args().get(0), PluginSpecKind.STRING, "dependencies", bindings, source,
					plugins, 0);
		}
		return Optional.of(plugins);
	}

}
