package org.springaicommunity.eigen.neovim.lua;

import java.util.List;

/**
 * Lua expression node.
 */
public sealed interface Expr {

	record Nil() implements Expr {
	}

	record BooleanLiteral(boolean value) implements Expr {
	}

	/**
	 * A numeral, kept exactly as written.
	 */
	record NumberLiteral(String text) implements Expr {
	}

	/**
	 * A string literal; {@code value} is the decoded content.
	 */
	record StringLiteral(String value) implements Expr {
	}

	record Vararg() implements Expr {
	}

	record FunctionExpr(FunctionBody body) implements Expr {
	}

	record TableConstructor(List<TableField> fields) implements Expr {

		public TableConstructor {
			fields = List.copyOf(fields);
		}

	}

	record Name(String name) implements Expr {
	}

	/**
	 * {@code target[key]}.
	 */
	record Index(Expr target, Expr key) implements Expr {
	}

	/**
	 * {@code target.name}.
	 */
	record FieldAccess(Expr target, String name) implements Expr {
	}

	record Call(Expr callee, List<Expr> args) implements Expr {

		public Call {
			args = List.copyOf(args);
		}

	}

	/**
	 * {@code receiver:method(args)}.
	 */
	record MethodCall(Expr receiver, String method, List<Expr> args) implements Expr {

		public MethodCall {
			args = List.copyOf(args);
		}

	}

	record BinaryOp(String operator, Expr left, Expr right) implements Expr {
	}

	record UnaryOp(String operator, Expr operand) implements Expr {
	}

	/**
	 * A parenthesized expression; kept because it truncates multiple results.
	 */
	record Paren(Expr inner) implements Expr {
	}

}
