package org.springaicommunity.eigen.neovim.lua;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Prints syntax trees in one canonical, single-line form, so that differently written
 * but equal literals compare equal as text.
 *
 * <ul>
 * <li>strings: double quotes, with {@code \\ \" \n \r \t} escaped and other control
 * characters as {@code \ddd}</li>
 * <li>booleans, {@code nil} and numerals: verbatim</li>
 * <li>tables: {@code {a, b, k=v, [expr]=v}}, positional elements in source order
 * followed by the keyed fields sorted by key; {@code ["k"]} is written {@code k} when
 * {@code k} is a name</li>
 * <li>everything else: tokens separated by single spaces where Lua needs them</li>
 * </ul>
 */
public final class LuaRenderer {

	private static final Set<String> KEYWORDS = Set.of("and", "break", "do", "else", "elseif", "end", "false", "for",
			"function", "goto", "if", "in", "local", "nil", "not", "or", "repeat", "return", "then", "true", "until",
			"while");

	private LuaRenderer() {
	}

	public static String render(Expr expr) {
		if (expr instanceof Expr.Nil) {
			return "nil";
		}
		if (expr instanceof Expr.BooleanLiteral bool) {
			return Boolean.toString(bool.value());
		}
		if (expr instanceof Expr.NumberLiteral number) {
			return number.text();
		}
		if (expr instanceof Expr.StringLiteral string) {
			return quote(string.value());
		}
		if (expr instanceof Expr.Vararg) {
			return "...";
		}
		if (expr instanceof Expr.FunctionExpr function) {
			return "function" + renderFunctionBody(function.body());
		}
		if (expr instanceof Expr.TableConstructor table) {
			return renderTable(table.fields());
		}
		if (expr instanceof Expr.Name name) {
			return name.name();
		}
		if (expr instanceof Expr.Index index) {
			return render(index.target()) + "[" + render(index.key()) + "]";
		}
		if (expr instanceof Expr.FieldAccess field) {
			return render(field.target()) + "." + field.name();
		}
		if (expr instanceof Expr.Call call) {
			return render(call.callee()) + renderArguments(call.args());
		}
		if (expr instanceof Expr.MethodCall call) {
			return render(call.receiver()) + ":" + call.method() + renderArguments(call.args());
		}
		if (expr instanceof Expr.BinaryOp op) {
			return render(op.left()) + " " + op.operator() + " " + render(op.right());
		}
		if (expr instanceof Expr.UnaryOp op) {
			return op.operator() + (op.operator().equals("not") ? " " : "") + render(op.operand());
		}
		if (expr instanceof Expr.Paren paren) {
			return "(" + render(paren.inner()) + ")";
		}
		throw new IllegalArgumentException("Unknown expression node: " + expr);
	}

	public static String render(Block block) {
		return block.statements().stream().map(LuaRenderer::render).collect(Collectors.joining("; "));
	}

	public static String render(Stmt stmt) {
		if (stmt instanceof Stmt.Assignment assignment) {
			return renderList(assignment.targets()) + " = " + renderList(assignment.values());
		}
		if (stmt instanceof Stmt.LocalAssignment local) {
			String names = "local " + String.join(", ", local.names());
			return local.values().isEmpty() ? names : names + " = " + renderList(local.values());
		}
		if (stmt instanceof Stmt.CallStatement call) {
			return render(call.call());
		}
		if (stmt instanceof Stmt.Do doBlock) {
			return "do " + body(doBlock.body()) + "end";
		}
		if (stmt instanceof Stmt.While loop) {
			return "while " + render(loop.condition()) + " do " + body(loop.body()) + "end";
		}
		if (stmt instanceof Stmt.Repeat loop) {
			return "repeat " + body(loop.body()) + "until " + render(loop.condition());
		}
		if (stmt instanceof Stmt.If ifStmt) {
			StringBuilder sb = new StringBuilder();
			for (int i = 0; i < ifStmt.branches().size(); i++) {
				Stmt.ConditionalBlock branch = ifStmt.branches().get(i);
				sb.append(i == 0 ? "if " : "elseif ")
					.append(render(branch.condition()))
					.append(" then ")
					.append(body(branch.body()));
			}
			if (ifStmt.elseBlock() != null) {
				sb.append("else ").append(body(ifStmt.elseBlock()));
			}
			return sb.append("end").toString();
		}
		if (stmt instanceof Stmt.NumericFor loop) {
			return "for " + loop.variable() + " = " + render(loop.start()) + ", " + render(loop.limit())
					+ (loop.step() != null ? ", " + render(loop.step()) : "") + " do " + body(loop.body()) + "end";
		}
		if (stmt instanceof Stmt.GenericFor loop) {
			return "for " + String.join(", ", loop.names()) + " in " + renderList(loop.expressions()) + " do "
					+ body(loop.body()) + "end";
		}
		if (stmt instanceof Stmt.FunctionDecl decl) {
			return "function " + String.join(".", decl.namePath()) + (decl.method() != null ? ":" + decl.method() : "")
					+ renderFunctionBody(decl.body());
		}
		if (stmt instanceof Stmt.LocalFunction function) {
			return "local function " + function.name() + renderFunctionBody(function.body());
		}
		if (stmt instanceof Stmt.Return ret) {
			return ret.values().isEmpty() ? "return" : "return " + renderList(ret.values());
		}
		if (stmt instanceof Stmt.Break) {
			return "break";
		}
		if (stmt instanceof Stmt.Goto gotoStmt) {
			return "goto " + gotoStmt.label();
		}
		if (stmt instanceof Stmt.Label label) {
			return "::" + label.name() + "::";
		}
		throw new IllegalArgumentException("Unknown statement node: " + stmt);
	}

	/**
	 * Quote a string the canonical way.
	 */
	public static String quote(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20 || c == 0x7f) {
						sb.append('\\').append((int) c);
					}
					else {
						sb.append(c);
					}
				}
			}
		}
		return sb.append('"').toString();
	}

	private static String renderTable(List<TableField> fields) {
		List<String> positional = new ArrayList<>();
		List<String[]> keyed = new ArrayList<>();
		for (TableField field : fields) {
			if (field instanceof TableField.NamedField named) {
				keyed.add(new String[] { named.name(), render(named.value()) });
			}
			else if (field instanceof TableField.KeyedField entry) {
				keyed.add(new String[] { renderKey(entry.key()), render(entry.value()) });
			}
			else {
				positional.add(render(field.value()));
			}
		}
		// stable, so repeated keys keep their source order
		keyed.sort(Comparator.comparing(pair -> pair[0]));
		List<String> rendered = new ArrayList<>(positional);
		for (String[] pair : keyed) {
			rendered.add(pair[0] + "=" + pair[1]);
		}
		return rendered.stream().collect(Collectors.joining(", ", "{", "}"));
	}

	private static String renderKey(Expr key) {
		if (key instanceof Expr.StringLiteral string && isName(string.value())) {
			return string.value();
		}
		return "[" + render(key) + "]";
	}

	private static boolean isName(String value) {
		if (value.isEmpty() || KEYWORDS.contains(value) || Character.isDigit(value.charAt(0))) {
			return false;
		}
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (!(c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
				return false;
			}
		}
		return true;
	}

	private static String renderFunctionBody(FunctionBody function) {
		StringBuilder params = new StringBuilder(String.join(", ", function.parameters()));
		if (function.vararg()) {
			params.append(function.parameters().isEmpty() ? "..." : ", ...");
		}
		return "(" + params + ") " + body(function.body()) + "end";
	}

	private static String body(Block block) {
		String rendered = render(block);
		return rendered.isEmpty() ? "" : rendered + " ";
	}

	private static String renderArguments(List<Expr> args) {
		return "(" + renderList(args) + ")";
	}

	private static String renderList(List<Expr> exprs) {
		return exprs.stream().map(LuaRenderer::render).collect(Collectors.joining(", "));
	}

}
