package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.eigen.neovim.lua.Expr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Names bound to expressions while walking one config file, so that aliases such as
 * {@code local opt = vim.opt} or {@code local plugins = { ... }} resolve to what they
 * stand for.
 *
 * <p>
 * Scoping is flat: the most recent binding of a name wins, wherever it was
 * made. This is not thread-safe; each extraction owns its own instance.
 */
public final class LocalBindings {

	private static final int MAX_DEPTH = 16;

	private final Map<String, Expr> bindings = new HashMap<>();

	public void bind(String name, Expr value) {
		// local vim = vim and friends would loop forever
		if (value instanceof Expr.Name other && other.name().equals(name)) {
			bindings.remove(name);
			return;
		}
		bindings.put(name, value);
	}

	public void unbind(String name) {
		bindings.remove(name);
	}

	public boolean isBound(String name) {
		return bindings.containsKey(name);
	}

	/**
	 * Follow name bindings and parentheses until an unbound expression is reached.
	 */
	public Expr resolve(Expr expr) {
		Expr current = expr;
		for (int depth = 0; depth < MAX_DEPTH; depth++) {
			if (current instanceof Expr.Paren paren) {
				current = paren.inner();
			}
			else if (current instanceof Expr.Name name && bindings.containsKey(name.name())) {
				current = bindings.get(name.name());
			}
			else {
				return current;
			}
		}
		return current;
	}

	/**
	 * The dotted path an expression denotes, with aliases expanded: {@code opt["number"]}
	 * after {@code local opt = vim.opt} yields {@code [vim, opt, number]}.
	 * @return the path segments, or {@code null} when the expression is not a plain path
	 */
	public @Nullable List<String> segments(Expr expr) {
		return segments(expr, 0);
	}

	private @Nullable List<String> segments(Expr expr, int depth) {
		if (depth > MAX_DEPTH) {
			return null;
		}
		Expr resolved = resolve(expr);
		if (resolved instanceof Expr.Name name) {
			List<String> path = new ArrayList<>();
			path.add(name.name());
			return path;
		}
		if (resolved instanceof Expr.FieldAccess field) {
			List<String> path = segments(field.target(), depth + 1);
			if (path != null) {
				path.add(field.name());
			}
			return path;
		}
		if (resolved instanceof Expr.Index index && resolve(index.key()) instanceof Expr.StringLiteral key) {
			List<String> path = segments(index.target(), depth + 1);
			if (path != null) {
				path.add(key.value());
			}
			return path;
		}
		return null;
	}

	/**
	 * The module name when the expression is {@code require("x")} or a name bound to one.
	 */
	public @Nullable String requiredModule(Expr expr) {
		Expr resolved = resolve(expr);
		if (resolved instanceof Expr.Call call && call.args().size() == 1
				&& resolve(call.callee()) instanceof Expr.Name callee && callee.name().equals("require")
				&& resolve(call.args().get(0)) instanceof Expr.StringLiteral module) {
			return module.value();
		}
		return null;
	}

	/**
	 * The string value of an expression, following aliases.
	 */
	public @Nullable String stringValue(Expr expr) {
		return resolve(expr) instanceof Expr.StringLiteral string ? string.value() : null;
	}

}
