package org.springaicommunity.eigen.neovim;

/**
 * A normalized unit of configuration meaning extracted from one config file.
 *
 * <p>
 * Facts are derived from the file content alone and are never stored; they can always be
 * recomputed from the cache.
 */
public sealed interface StructuralFact {

	/**
	 * The aggregation key: facts with equal keys count as the same thing across configs.
	 */
	String key();

	/**
	 * Identity of the config the fact was extracted from.
	 */
	String source();

	/**
	 * An option or global variable assignment.
	 *
	 * @param namespace {@code opt} for any option namespace, {@code g} for globals
	 * @param name option or variable name
	 * @param value canonical rendering of the assigned value
	 * @param source identity of the config
	 */
	record Setting(String namespace, String name, String value, String source) implements StructuralFact {

		public static final String OPTIONS = "opt";

		public static final String GLOBALS = "g";

		@Override
		public String key() {
			return "vim." + namespace + "." + name;
		}

	}

	/**
	 * A key mapping.
	 *
	 * @param mode mode string; several modes are joined with commas ({@code n,v})
	 * @param lhs the key sequence
	 * @param rhs the mapped command, or canonical rendering of a non-string right-hand side
	 * @param source identity of the config
	 */
	record Keymap(String mode, String lhs, String rhs, String source) implements StructuralFact {

		@Override
		public String key() {
			return mode + " " + lhs;
		}

	}

	/**
	 * A plugin declared through a plugin manager.
	 *
	 * @param name plugin repository in "owner/name" format
	 * @param kind how the plugin was declared
	 * @param source identity of the config
	 */
	record PluginRef(String name, PluginSpecKind kind, String source) implements StructuralFact {

		@Override
		public String key() {
			return name;
		}

	}

	/**
	 * A colorscheme applied by the config.
	 *
	 * @param name colorscheme name
	 * @param source identity of the config
	 */
	record ColorschemeRef(String name, String source) implements StructuralFact {

		@Override
		public String key() {
			return name;
		}

	}

}
