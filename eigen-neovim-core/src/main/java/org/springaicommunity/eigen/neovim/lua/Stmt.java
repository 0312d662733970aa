package org.springaicommunity.eigen.neovim.lua;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Lua statement node.
 */
public sealed interface Stmt {

	/**
	 * {@code targets = values}; targets are names, index or field expressions.
	 */
	record Assignment(List<Expr> targets, List<Expr> values) implements Stmt {

		public Assignment {
			targets = List.copyOf(targets);
			values = List.copyOf(values);
		}

	}

	/**
	 * {@code local names = values}; attributes ({@code <const>}, {@code <close>}) are
	 * dropped.
	 */
	record LocalAssignment(List<String> names, List<Expr> values) implements Stmt {

		public LocalAssignment {
			names = List.copyOf(names);
			values = List.copyOf(values);
		}

	}

	/**
	 * A function or method call used as a statement.
	 */
	record CallStatement(Expr call) implements Stmt {
	}

	record Do(Block body) implements Stmt {
	}

	record While(Expr condition, Block body) implements Stmt {
	}

	record Repeat(Block body, Expr condition) implements Stmt {
	}

	/**
	 * {@code if}/{@code elseif} branches followed by an optional {@code else}.
	 */
	record If(List<ConditionalBlock> branches, @Nullable Block elseBlock) implements Stmt {

		public If {
			branches = List.copyOf(branches);
		}

	}

	record ConditionalBlock(Expr condition, Block body) {
	}

	record NumericFor(String variable, Expr start, Expr limit, @Nullable Expr step, Block body) implements Stmt {
	}

	record GenericFor(List<String> names, List<Expr> expressions, Block body) implements Stmt {

		public GenericFor {
			names = List.copyOf(names);
			expressions = List.copyOf(expressions);
		}

	}

	/**
	 * {@code function a.b.c:m() ... end}; {@code method} is null without a colon part.
	 */
	record FunctionDecl(List<String> namePath, @Nullable String method, FunctionBody body) implements Stmt {

		public FunctionDecl {
			namePath = List.copyOf(namePath);
		}

	}

	record LocalFunction(String name, FunctionBody body) implements Stmt {
	}

	record Return(List<Expr> values) implements Stmt {

		public Return {
			values = List.copyOf(values);
		}

	}

	record Break() implements Stmt {
	}

	record Goto(String label) implements Stmt {
	}

	record Label(String name) implements Stmt {
	}

}
