package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.eigen.neovim.lua.Expr;
import org.springaicommunity.eigen.neovim.lua.TableField;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reading plugin spec tables, shared by the plugin manager recognizers.
 */
final class PluginSpecTables {

	private static final Pattern PLUGIN_NAME = Pattern.compile("[A-Za-z0-9_-]+/[A-Za-z0-9_.-]+");

	private static final String GITHUB_PREFIX = "https://github.com/";

	private PluginSpecTables() {
	}

	/**
	 * Normalize a plugin source to "owner/name", or {@code null} if it does not name a
	 * GitHub repository.
	 */
	static @Nullable String pluginName(@Nullable String source) {
		if (source == null) {
			return null;
		}
		String name = source.strip();
		if (name.startsWith(GITHUB_PREFIX)) {
			name = name.substring(GITHUB_PREFIX.length());
			if (name.endsWith(".git")) {
				name = name.substring(0, name.length() - 4);
			}
		}
		return PLUGIN_NAME.matcher(name).matches() ? name : null;
	}

	static void addPlugin(@Nullable String source, PluginSpecKind kind, String config,
			List<StructuralFact.PluginRef> out) {
		String name = pluginName(source);
		if (name != null) {
			out.add(new StructuralFact.PluginRef(name, kind, config));
		}
	}

	static List<Expr> positional(Expr.TableConstructor table) {
		List<Expr> values = new ArrayList<>();
		for (TableField field : table.fields()) {
			if (field instanceof TableField.PositionalField positional) {
				values.add(positional.value());
			}
		}
		return values;
	}

	static @Nullable Expr named(Expr.TableConstructor table, String name) {
		for (TableField field : table.fields()) {
			if (field instanceof TableField.NamedField named && named.name().equals(name)) {
				return named.value();
			}
		}
		return null;
	}

	/**
	 * Whether the table is a list of specs rather than a single spec. A table with more
	 * than one positional element, or with nothing but positional elements, is a list; a
	 * table with one positional name plus options is a single spec.
	 */
	static boolean isSpecList(Expr.TableConstructor table) {
		List<Expr> positional = positional(table);
		return positional.size() > 1 || positional.size() == table.fields().size();
	}

	/**
	 * Collect plugins from a spec that may be a name, a single spec table or a nested list
	 * of specs. {@code dependencyField} names the field listing dependencies of a spec table.
	 */
	static void collect(Expr spec, PluginSpecKind stringKind, String dependencyField, LocalBindings bindings,
			String config, List<StructuralFact.PluginRef> out, int depth) {
		if (depth > 16) {
			return;
		}
		Expr resolved = bindings.resolve(spec);
		if (resolved instanceof Expr.StringLiteral string) {
			addPlugin(string.value(), stringKind, config, out);
			return;
		}
		if (!(resolved instanceof Expr.TableConstructor table)) {
			return;
		}
		List<Expr> positional = positional(table);
		if (isSpecList(table)) {
			// { "owner/name" } nested in a list is a one-element spec table
			PluginSpecKind elementKind = depth > 0 && positional.size() == 1 && stringKind == PluginSpecKind.STRING
					? PluginSpecKind.TABLE : stringKind;
			for (Expr element : positional) {
				collect(element, elementKind, dependencyField, bindings, config, out, depth + 1);
			}
			return;
		}
		if (positional.isEmpty()) {
			return;
		}
		String name = bindings.stringValue(positional.get(0));
		addPlugin(name, stringKind == PluginSpecKind.DEPENDENCY ? PluginSpecKind.DEPENDENCY : PluginSpecKind.TABLE,
				config, out);
		Expr dependencies = named(table, dependencyField);
		if (dependencies != null) {
			collect(dependencies, PluginSpecKind.DEPENDENCY, dependencyField, bindings, config, out, depth + 1);
		}
	}

}
