package org.springaicommunity.eigen.neovim.lua;

import java.util.List;

/**
 * Depth-first, source-order traversal of a syntax tree. Each statement is reported
 * before the statements and expressions inside it, each expression before its
 * sub-expressions. Function bodies are entered like any other block.
 */
public final class LuaTreeWalker {

	/**
	 * Callbacks for {@link LuaTreeWalker}. Unneeded callbacks can be left out.
	 */
	public interface Visitor {

		default void visitStatement(Stmt statement) {
		}

		default void visitExpression(Expr expression) {
		}

	}

	private final Visitor visitor;

	private LuaTreeWalker(Visitor visitor) {
		this.visitor = visitor;
	}

	public static void walk(Block block, Visitor visitor) {
		new LuaTreeWalker(visitor).block(block);
	}

	private void block(Block block) {
		for (Stmt statement : block.statements()) {
			statement(statement);
		}
	}

	private void statement(Stmt stmt) {
		visitor.visitStatement(stmt);
		if (stmt instanceof Stmt.Assignment assignment) {
			expressions(assignment.targets());
			expressions(assignment.values());
		}
		else if (stmt instanceof Stmt.LocalAssignment local) {
			expressions(local.values());
		}
		else if (stmt instanceof Stmt.CallStatement call) {
			expression(call.call());
		}
		else if (stmt instanceof Stmt.Do doBlock) {
			block(doBlock.body());
		}
		else if (stmt instanceof Stmt.While loop) {
			expression(loop.condition());
			block(loop.body());
		}
		else if (stmt instanceof Stmt.Repeat loop) {
			block(loop.body());
			expression(loop.condition());
		}
		else if (stmt instanceof Stmt.If ifStmt) {
			for (Stmt.ConditionalBlock branch : ifStmt.branches()) {
				expression(branch.condition());
				block(branch.body());
			}
			if (ifStmt.elseBlock() != null) {
				block(ifStmt.elseBlock());
			}
		}
		else if (stmt instanceof Stmt.NumericFor loop) {
			expression(loop.start());
			expression(loop.limit());
			if (loop.step() != null) {
				expression(loop.step());
			}
			block(loop.body());
		}
		else if (stmt instanceof Stmt.GenericFor loop) {
			expressions(loop.expressions());
			block(loop.body());
		}
		else if (stmt instanceof Stmt.FunctionDecl decl) {
			block(decl.body().body());
		}
		else if (stmt instanceof Stmt.LocalFunction function) {
			block(function.body().body());
		}
		else if (stmt instanceof Stmt.Return ret) {
			expressions(ret.values());
		}
		// Break, Goto, Label: nothing inside
	}

	private void expressions(List<Expr> exprs) {
		for (Expr expr : exprs) {
			expression(expr);
		}
	}

	private void expression(Expr expr) {
		visitor.visitExpression(expr);
		if (expr instanceof Expr.FunctionExpr function) {
			block(function.body().body());
		}
		else if (expr instanceof Expr.TableConstructor table) {
			for (TableField field : table.fields()) {
				if (field instanceof TableField.KeyedField keyed) {
					expression(keyed.key());
				}
				expression(field.value());
			}
		}
		else if (expr instanceof Expr.Index index) {
			expression(index.target());
			expression(index.key());
		}
		else if (expr instanceof Expr.FieldAccess field) {
			expression(field.target());
		}
		else if (expr instanceof Expr.Call call) {
			expression(call.callee());
			expressions(call.args());
		}
		else if (expr instanceof Expr.MethodCall call) {
			expression(call.receiver());
			expressions(call.args());
		}
		else if (expr instanceof Expr.BinaryOp op) {
			expression(op.left());
			expression(op.right());
		}
		else if (expr instanceof Expr.UnaryOp op) {
			expression(op.operand());
		}
		else if (expr instanceof Expr.Paren paren) {
			expression(paren.inner());
		}
	}

}
