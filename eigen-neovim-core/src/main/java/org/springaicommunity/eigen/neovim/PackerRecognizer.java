package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.eigen.neovim.lua.Expr;
import org.springaicommunity.eigen.neovim.lua.FunctionBody;
import org.springaicommunity.eigen.neovim.lua.LuaTreeWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * packer.nvim: {@code require("packer").startup(function(use) use "owner/name" end)}, also
 * in the {@code startup({ function(use) ... end, config = ... })} form.
 */
final class PackerRecognizer implements PluginSpecRecognizer {

	private static final String DEFAULT_USE = "use";

	@Override
	public Optional<List<StructuralFact.PluginRef>> tryExtract(Expr.Call call, LocalBindings bindings, String source) {
		if (!(bindings.resolve(call.callee()) instanceof Expr.FieldAccess field) || !field.name().equals("startup")
				|| !"packer".equals(bindings.requiredModule(field.target())) || call.args().isEmpty()) {
			return Optional.empty();
		}
		FunctionBody startup = startupFunction(call.args().get(0), bindings);
		List<StructuralFact.PluginRef> plugins = new ArrayList<>();
		if (startup == null) {
			return Optional.of(plugins);
		}
		String use = startup.parameters().isEmpty() ? DEFAULT_USE : startup.parameters().get(0);
		LuaTreeWalker.walk(startup.body(), new LuaTreeWalker.Visitor() {
			@Override
			public void visitExpression(Expr expression) {
				if (expression instanceof Expr.Call useCall && useCall.callee() instanceof Expr.Name name
						&& name.name().equals(use) && !useCall.args().isEmpty()) {
					PluginSpecTables.collect(useCall.args().get(0), PluginSpecKind.STRING, "requires", bindings,
							source, plugins, 0);
				}
			}
		});
		return Optional.of(plugins);
	}

	private static @Nullable FunctionBody startupFunction(Expr arg, LocalBindings bindings) {
		Expr resolved = bindings.resolve(arg);
		if (resolved instanceof Expr.FunctionExpr function) {
			return function.body();
		}
		if (resolved instanceof Expr.TableConstructor table) {
			List<Expr> positional = PluginSpecTables.positional(table);
			if (!positional.isEmpty() && bindings.resolve(positional.get(0)) instanceof Expr.FunctionExpr function) {
				return function.body();
			}
		}
		return null;
	}

}
