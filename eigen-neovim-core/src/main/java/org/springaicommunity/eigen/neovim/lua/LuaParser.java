package org.springaicommunity.eigen.neovim.lua;

import org.jspecify.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterLua;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parses Lua 5.4 with tree-sitter and converts the concrete syntax tree into a
 * {@link Block} of {@link Stmt} nodes.
 *
 * <p>
 * A tree with any error or missing node is rejected as a whole. Conversion is limited to
 * {@value #MAX_NESTING} nested blocks and expressions, postfix chains such as
 * {@code a.b.c} or {@code f()()} included, so that nothing downstream walks a tree deeper
 * than that. Nothing is evaluated.
 *
 * <pre>
 * {@code
 * Block chunk = LuaParser.parse("vim.opt.number = true");
 * }
 * </pre>
 */
public final class LuaParser {

	/** Same limit as the stock Lua interpreter. */
	static final int MAX_NESTING = 200;

	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
		TSParser parser = new TSParser();
		if (!parser.setLanguage(new TreeSitterLua())) {
			throw new IllegalStateException("Failed to set the Lua language on the tree-sitter parser");
		}
		return parser;
	});

	private final SourceText source;

	private int nesting;

	private LuaParser(SourceText source) {
		this.source = source;
	}

	/**
	 * Parse a chunk of Lua source. A leading byte-order mark is ignored.
	 * @throws LuaSyntaxException if the source is not valid Lua
	 */
	public static Block parse(String text) {
		String stripped = !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
		SourceText source = new SourceText(stripped);
		TSTree tree = PARSER.get().parseString(null, source.parsed());
		TSNode root = tree.getRootNode();
		if (root.isNull()) {
			throw new LuaSyntaxException("no syntax tree produced", 1);
		}
		if (root.hasError()) {
			throw syntaxError(root);
		}
		return new LuaParser(source).chunk(root);
	}

	// statements

	private Block chunk(TSNode root) {
		List<Stmt> statements = new ArrayList<>();
		for (TSNode child : namedChildren(root)) {
			if (!child.getType().equals("hash_bang_line")) {
				addStatement(statements, child);
			}
		}
		return new Block(statements);
	}

	private Block block(@Nullable TSNode node) {
		if (node == null || node.isNull()) {
			return new Block(List.of());
		}
		enter(node);
		try {
			List<Stmt> statements = new ArrayList<>();
			if (node.getType().equals("block")) {
				for (TSNode child : namedChildren(node)) {
					addStatement(statements, child);
				}
			}
			else {
				addStatement(statements, node);
			}
			return new Block(statements);
		}
		finally {
			nesting--;
		}
	}

	private void addStatement(List<Stmt> statements, TSNode node) {
		Stmt statement = statement(node);
		if (statement != null) {
			statements.add(statement);
		}
	}

	private @Nullable Stmt statement(TSNode node) {
		switch (node.getType()) {
			case "empty_statement":
				return null;
			case "assignment_statement": {
				TSNode targets = firstNamedOfType(node, "variable_list");
				TSNode values = firstNamedOfType(node, "expression_list");
				return new Stmt.Assignment(expressions(targets), expressions(values));
			}
			case "variable_declaration":
				return localAssignment(node);
			case "function_call":
				return new Stmt.CallStatement(expression(node));
			case "label_statement":
				return new Stmt.Label(text(firstNamedOfType(node, "identifier")));
			case "break_statement":
				return new Stmt.Break();
			case "goto_statement":
				return new Stmt.Goto(text(firstNamedOfType(node, "identifier")));
			case "do_statement":
				return new Stmt.Do(block(field(node, "body")));
			case "while_statement":
				return new Stmt.While(expression(required(node, "condition")), block(field(node, "body")));
			case "repeat_statement":
				return new Stmt.Repeat(block(field(node, "body")), expression(required(node, "condition")));
			case "if_statement":
				return ifStatement(node);
			case "for_statement":
				return forStatement(node);
			case "function_declaration":
				return functionDeclaration(node);
			case "return_statement": {
				TSNode values = firstNamedOfType(node, "expression_list");
				return new Stmt.Return(values == null ? List.of() : expressions(values));
			}
			default:
				throw error(node, "unexpected " + node.getType());
		}
	}

	private Stmt localAssignment(TSNode node) {
		TSNode assignment = firstNamedOfType(node, "assignment_statement");
		TSNode nameList = assignment != null ? firstNamedOfType(assignment, "variable_list")
				: firstNamedOfType(node, "attribute_name_list");
		if (nameList == null) {
			throw error(node, "<name> expected");
		}
		List<String> names = new ArrayList<>();
		for (TSNode child : namedChildren(nameList)) {
			if (child.getType().equals("identifier")) {
				names.add(text(child));
			}
			else if (child.getType().equals("attribute")) {
				String attribute = text(firstNamedOfType(child, "identifier"));
				if (!attribute.equals("const") && !attribute.equals("close")) {
					throw error(child, "unknown attribute '" + attribute + "'");
				}
			}
		}
		List<Expr> values = assignment == null ? List.of()
				: expressions(firstNamedOfType(assignment, "expression_list"));
		return new Stmt.LocalAssignment(names, values);
	}

	private Stmt ifStatement(TSNode node) {
		List<Stmt.ConditionalBlock> branches = new ArrayList<>();
		branches.add(new Stmt.ConditionalBlock(expression(required(node, "condition")),
				block(field(node, "consequence"))));
		Block elseBlock = null;
		for (TSNode child : namedChildren(node)) {
			if (child.getType().equals("elseif_statement")) {
				branches.add(new Stmt.ConditionalBlock(expression(required(child, "condition")),
						block(field(child, "consequence"))));
			}
			else if (child.getType().equals("else_statement")) {
				elseBlock = block(field(child, "body"));
			}
		}
		return new Stmt.If(branches, elseBlock);
	}

	private Stmt forStatement(TSNode node) {
		TSNode clause = required(node, "clause");
		Block body = block(field(node, "body"));
		if (clause.getType().equals("for_numeric_clause")) {
			TSNode step = field(clause, "step");
			return new Stmt.NumericFor(text(required(clause, "name")), expression(required(clause, "start")),
					expression(required(clause, "end")), step == null ? null : expression(step), body);
		}
		List<String> names = new ArrayList<>();
		for (TSNode name : namedChildren(firstNamedOfType(clause, "variable_list"))) {
			names.add(text(name));
		}
		return new Stmt.GenericFor(names, expressions(firstNamedOfType(clause, "expression_list")), body);
	}

	private Stmt functionDeclaration(TSNode node) {
		TSNode name = required(node, "name");
		FunctionBody body = functionBody(node);
		if (node.getChildCount() > 0 && node.getChild(0).getType().equals("local")) {
			return new Stmt.LocalFunction(text(name), body);
		}
		String method = null;
		TSNode path = name;
		if (name.getType().equals("method_index_expression")) {
			method = text(required(name, "method"));
			path = required(name, "table");
		}
		return new Stmt.FunctionDecl(namePath(path), method, body);
	}

	private List<String> namePath(TSNode node) {
		Deque<String> path = new ArrayDeque<>();
		TSNode current = node;
		while (current.getType().equals("dot_index_expression")) {
			path.addFirst(text(required(current, "field")));
			current = required(current, "table");
		}
		path.addFirst(text(current));
		return new ArrayList<>(path);
	}

	private FunctionBody functionBody(TSNode node) {
		List<String> parameters = new ArrayList<>();
		boolean vararg = false;
		TSNode parameterList = field(node, "parameters");
		if (parameterList != null) {
			for (TSNode parameter : namedChildren(parameterList)) {
				if (parameter.getType().equals("vararg_expression")) {
					vararg = true;
				}
				else {
					parameters.add(text(parameter));
				}
			}
		}
		return new FunctionBody(parameters, vararg, block(field(node, "body")));
	}

	// expressions

	private List<Expr> expressions(@Nullable TSNode list) {
		if (list == null) {
			return List.of();
		}
		List<Expr> exprs = new ArrayList<>();
		for (TSNode child : namedChildren(list)) {
			exprs.add(expression(child));
		}
		return exprs;
	}

	private Expr expression(TSNode node) {
		enter(node);
		try {
			return expression0(node);
		}
		finally {
			nesting--;
		}
	}

	private Expr expression0(TSNode node) {
		switch (node.getType()) {
			case "nil":
				return new Expr.Nil();
			case "true":
				return new Expr.BooleanLiteral(true);
			case "false":
				return new Expr.BooleanLiteral(false);
			case "number":
				return new Expr.NumberLiteral(text(node));
			case "string":
				return new Expr.StringLiteral(decodeString(node));
			case "vararg_expression":
				return new Expr.Vararg();
			case "function_definition":
				return new Expr.FunctionExpr(functionBody(node));
			case "identifier":
				return new Expr.Name(text(node));
			case "dot_index_expression":
				return new Expr.FieldAccess(expression(required(node, "table")), text(required(node, "field")));
			case "bracket_index_expression":
				return new Expr.Index(expression(required(node, "table")), expression(required(node, "field")));
			case "function_call":
				return call(node);
			case "parenthesized_expression":
				return new Expr.Paren(expression(onlyNamedChild(node)));
			case "table_constructor":
				return table(node);
			case "binary_expression":
				return new Expr.BinaryOp(operator(node), expression(required(node, "left")),
						expression(required(node, "right")));
			case "unary_expression":
				return new Expr.UnaryOp(operator(node), expression(required(node, "operand")));
			default:
				throw error(node, "unexpected " + node.getType());
		}
	}

	private Expr call(TSNode node) {
		TSNode callee = required(node, "name");
		List<Expr> args = arguments(required(node, "arguments"));
		if (callee.getType().equals("method_index_expression")) {
			return new Expr.MethodCall(expression(required(callee, "table")), text(required(callee, "method")), args);
		}
		return new Expr.Call(expression(callee), args);
	}

	private List<Expr> arguments(TSNode node) {
		List<Expr> args = new ArrayList<>();
		for (TSNode child : namedChildren(node)) {
			args.add(expression(child));
		}
		return args;
	}

	private Expr.TableConstructor table(TSNode node) {
		List<TableField> fields = new ArrayList<>();
		for (TSNode child : namedChildren(node)) {
			if (!child.getType().equals("field")) {
				throw error(child, "unexpected " + child.getType() + " in table");
			}
			Expr value = expression(required(child, "value"));
			TSNode key = field(child, "name");
			if (key == null) {
				fields.add(new TableField.PositionalField(value));
			}
			else if (child.getChild(0).getType().equals("[")) {
				fields.add(new TableField.KeyedField(expression(key), value));
			}
			else {
				fields.add(new TableField.NamedField(text(key), value));
			}
		}
		return new Expr.TableConstructor(fields);
	}

	/**
	 * The operator of a unary or binary expression: its only anonymous child.
	 */
	private static String operator(TSNode node) {
		for (int i = 0; i < node.getChildCount(); i++) {
			TSNode child = node.getChild(i);
			if (!child.isNamed()) {
				return child.getType();
			}
		}
		throw error(node, "operator expected");
	}

	private String decodeString(TSNode node) {
		try {
			return LuaStrings.decode(text(node));
		}
		catch (IllegalArgumentException e) {
			throw error(node, e.getMessage());
		}
	}

	// tree helpers

	private void enter(TSNode node) {
		if (++nesting > MAX_NESTING) {
			nesting--;
			throw error(node, "chunk has too many syntax levels");
		}
	}

	private String text(@Nullable TSNode node) {
		if (node == null || node.isNull()) {
			throw new LuaSyntaxException("<name> expected", 1);
		}
		return source.slice(node.getStartByte(), node.getEndByte());
	}

	private static List<TSNode> namedChildren(@Nullable TSNode node) {
		List<TSNode> children = new ArrayList<>();
		if (node == null) {
			return children;
		}
		for (int i = 0; i < node.getNamedChildCount(); i++) {
			TSNode child = node.getNamedChild(i);
			if (!child.getType().equals("comment")) {
				children.add(child);
			}
		}
		return children;
	}

	private static @Nullable TSNode firstNamedOfType(@Nullable TSNode node, String type) {
		for (TSNode child : namedChildren(node)) {
			if (child.getType().equals(type)) {
				return child;
			}
		}
		return null;
	}

	private static TSNode onlyNamedChild(TSNode node) {
		List<TSNode> children = namedChildren(node);
		if (children.size() != 1) {
			throw error(node, "expression expected");
		}
		return children.get(0);
	}

	private static @Nullable TSNode field(TSNode node, String name) {
		TSNode child = node.getChildByFieldName(name);
		return child == null || child.isNull() ? null : child;
	}

	private static TSNode required(TSNode node, String name) {
		TSNode child = field(node, name);
		if (child == null) {
			throw error(node, name + " expected in " + node.getType());
		}
		return child;
	}

	private static LuaSyntaxException error(TSNode node, String message) {
		return new LuaSyntaxException(message, node.getStartPoint().getRow() + 1);
	}

	/**
	 * Locates the first error or missing node, descending only into subtrees that contain
	 * one. Iterative, so the depth of the tree does not matter.
	 */
	private static LuaSyntaxException syntaxError(TSNode root) {
		TSNode current = root;
		while (true) {
			if (current.getType().equals("ERROR")) {
				return error(current, "syntax error");
			}
			if (current.isMissing()) {
				return error(current, "'" + current.getType() + "' expected");
			}
			TSNode next = null;
			for (int i = 0; i < current.getChildCount(); i++) {
				TSNode child = current.getChild(i);
				if (child.hasError() || child.isMissing() || child.getType().equals("ERROR")) {
					next = child;
					break;
				}
			}
			if (next == null) {
				return error(current, "syntax error");
			}
			current = next;
		}
	}

	/**
	 * The parsed text and the way back from tree-sitter's byte offsets to characters.
	 * Surrogates and NUL are replaced by U+FFFD in what tree-sitter sees, so that each
	 * character has the same UTF-8 length however the text crosses into native code; node
	 * text is sliced from the original string.
	 */
	private static final class SourceText {

		private final String original;

		private final String parsed;

		private final int[] charAtByte;

		SourceText(String original) {
			this.original = original;
			StringBuilder sb = new StringBuilder(original.length());
			int bytes = 0;
			for (int i = 0; i < original.length(); i++) {
				char c = original.charAt(i);
				char safe = Character.isSurrogate(c) || c == 0 ? '\uFFFD' : c;
				sb.append(safe);
				bytes += utf8Length(safe);
			}
			this.parsed = sb.toString();
			this.charAtByte = new int[bytes + 1];
			int offset = 0;
			for (int i = 0; i < parsed.length(); i++) {
				int length = utf8Length(parsed.charAt(i));
				for (int k = 0; k < length; k++) {
					charAtByte[offset + k] = i;
				}
				offset += length;
			}
			charAtByte[bytes] = parsed.length();
		}

		String parsed() {
			return parsed;
		}

		String slice(int startByte, int endByte) {
			int start = charAtByte[Math.min(startByte, charAtByte.length - 1)];
			int end = charAtByte[Math.min(endByte, charAtByte.length - 1)];
			return original.substring(start, end);
		}

		private static int utf8Length(char c) {
			if (c < 0x80) {
				return 1;
			}
			return c < 0x800 ? 2 : 3;
		}

	}

}
