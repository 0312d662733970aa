package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.lua.Expr;
import org.springaicommunity.eigen.neovim.lua.LuaRenderer;
import org.springaicommunity.eigen.neovim.lua.TableField;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Key mappings registered with {@code vim.keymap.set}, {@code vim.api.nvim_set_keymap} or
 * {@code vim.api.nvim_buf_set_keymap}.
 */
final class KeymapMatcher implements CallMatcher {

	static final String FUNCTION_RHS = "<function>";

	@Override
	public Optional<List<StructuralFact>> match(Expr.Call call, LocalBindings bindings, String source) {
		List<String> callee = bindings.segments(call.callee());
		if (callee == null) {
			return Optional.empty();
		}
		int offset;
		if (callee.equals(List.of("vim", "keymap", "set")) || callee.equals(List.of("vim", "api", "nvim_set_keymap"))) {
			offset = 0;
		}
		else if (callee.equals(List.of("vim", "api", "nvim_buf_set_keymap"))) {
			offset = 1;
		}
		else {
			return Optional.empty();
		}
		List<Expr> args = call.args();
		if (args.size() < offset + 3) {
			return Optional.of(List.of());
		}
		String mode = mode(args.get(offset), bindings);
		String lhs = text(args.get(offset + 1), bindings);
		String rhs = text(args.get(offset + 2), bindings);
		return Optional.of(List.of(new StructuralFact.Keymap(mode, lhs, rhs, source)));
	}

	private static String mode(Expr expr, LocalBindings bindings) {
		Expr resolved = bindings.resolve(expr);
		if (resolved instanceof Expr.TableConstructor table) {
			List<String> modes = new ArrayList<>();
			for (TableField field : table.fields()) {
				String mode = bindings.stringValue(field.value());
				if (!(field instanceof TableField.PositionalField) || mode == null) {
					return LuaRenderer.render(table);
				}
				modes.add(mode);
			}
			return String.join(",", modes);
		}
		return text(expr, bindings);
	}

	private static String text(Expr expr, LocalBindings bindings) {
		String value = bindings.stringValue(expr);
		if (value != null) {
			return value;
		}
		if (bindings.resolve(expr) instanceof Expr.FunctionExpr) {
			return FUNCTION_RHS;
		}
		return LuaRenderer.render(expr);
	}

}
