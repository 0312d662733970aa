package org.springaicommunity.eigen.neovim.lua;

/**
 * One field of a table constructor.
 */
public sealed interface TableField {

	Expr value();

	/**
	 * {@code value}: takes the next array index.
	 */
	record PositionalField(Expr value) implements TableField {
	}

	/**
	 * {@code name = value}.
	 */
	record NamedField(String name, Expr value) implements TableField {
	}

	/**
	 * {@code [key] = value}.
	 */
	record KeyedField(Expr key, Expr value) implements TableField {
	}

}
