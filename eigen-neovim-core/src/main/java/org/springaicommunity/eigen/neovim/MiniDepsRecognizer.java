package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.eigen.neovim.lua.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * mini.deps: {@code MiniDeps.add("owner/name")} or
 * {@code require("mini.deps").add({ source = "owner/name", depends = { ... } })}.
 */
final class MiniDepsRecognizer implements PluginSpecRecognizer {

	@Override
	public Optional<List<StructuralFact.PluginRef>> tryExtract(Expr.Call call, LocalBindings bindings, String source) {
		if (!isAdd(call.callee(), bindings) || call.args().isEmpty()) {
			return Optional.empty();
		}
		List<StructuralFact.PluginRef> plugins = new ArrayList<>();
		Expr spec = bindings.resolve(call.args().get(0));
		if (spec instanceof Expr.StringLiteral string) {
			PluginSpecTables.addPlugin(string.value(), PluginSpecKind.STRING, source, plugins);
		}
		else if (spec instanceof Expr.TableConstructor table) {
			Expr sourceField = PluginSpecTables.named(table, "source");
			List<Expr> positional = PluginSpecTables.positional(table);
			@Nullable Expr name = sourceField != null ? sourceField : positional.isEmpty() ? null : positional.get(0);
			if (name != null) {
				PluginSpecTables.addPlugin(bindings.stringValue(name), PluginSpecKind.TABLE, source, plugins);
			}
			Expr depends = PluginSpecTables.named(table, "depends");
			if (depends != null && bindings.resolve(depends) instanceof Expr.TableConstructor dependsTable) {
				for (Expr dependency : PluginSpecTables.positional(dependsTable)) {
					PluginSpecTables.addPlugin(bindings.stringValue(dependency), PluginSpecKind.DEPENDENCY, source,
							plugins);
				}
			}
		}
		return Optional.of(plugins);
	}

	private static boolean isAdd(Expr callee, LocalBindings bindings) {
		List<String> path = bindings.segments(callee);
		if (List.of("MiniDeps", "add").equals(path)) {
			return true;
		}
		return bindings.resolve(callee) instanceof Expr.FieldAccess field && field.name().equals("add")
				&& "mini.deps".equals(bindings.requiredModule(field.target()));
	}

}
