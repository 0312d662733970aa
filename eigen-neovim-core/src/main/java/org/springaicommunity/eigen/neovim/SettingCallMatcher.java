package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.eigen.neovim.lua.Expr;
import org.springaicommunity.eigen.neovim.lua.LuaRenderer;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Settings made through assignment to an option namespace and through the
 * {@code nvim_set_option_value}, {@code nvim_set_option} and {@code nvim_set_var} API
 * calls.
 */
final class SettingCallMatcher implements CallMatcher {

	static final Set<String> OPTION_ROOTS = Set.of("opt", "o", "go", "bo", "wo", "opt_local", "opt_global");

	@Override
	public Optional<List<StructuralFact>> match(Expr.Call call, LocalBindings bindings, String source) {
		List<String> callee = bindings.segments(call.callee());
		if (callee == null || callee.size() != 3 || !callee.get(0).equals("vim") || !callee.get(1).equals("api")
				|| call.args().size() < 2) {
			return Optional.empty();
		}
		String namespace = switch (callee.get(2)) {
			case "nvim_set_option_value", "nvim_set_option" -> StructuralFact.Setting.OPTIONS;
			case "nvim_set_var" -> StructuralFact.Setting.GLOBALS;
			default -> null;
		};
		if (namespace == null) {
			return Optional.empty();
		}
		String name = bindings.stringValue(call.args().get(0));
		if (name == null) {
			return Optional.of(List.of());
		}
		return Optional.of(List.of(new StructuralFact.Setting(namespace, name,
				LuaRenderer.render(call.args().get(1)), source)));
	}

	/**
	 * The setting made by assigning {@code value} to {@code target}, if the target is an
	 * option or global variable.
	 */
	static StructuralFact.@Nullable Setting fromAssignment(Expr target, Expr value, LocalBindings bindings,
			String source) {
		List<String> path = bindings.segments(target);
		if (path == null || path.size() != 3 || !path.get(0).equals("vim")) {
			return null;
		}
		String root = path.get(1);
		String namespace;
		if (OPTION_ROOTS.contains(root)) {
			namespace = StructuralFact.Setting.OPTIONS;
		}
		else if (root.equals("g")) {
			namespace = StructuralFact.Setting.GLOBALS;
		}
		else {
			return null;
		}
		return new StructuralFact.Setting(namespace, path.get(2), LuaRenderer.render(value), source);
	}

}
