package org.springaicommunity.eigen.neovim.lua;

/**
 * Decodes the source text of a Lua string literal, quoted or long-bracketed, into its
 * value.
 */
final class LuaStrings {

	private LuaStrings() {
	}

	/**
	 * @throws IllegalArgumentException on a malformed escape sequence
	 */
	static String decode(String literal) {
		if (literal.startsWith("[")) {
			return longBracket(literal);
		}
		if (literal.length() < 2) {
			throw new IllegalArgumentException("unfinished string");
		}
		return quoted(literal.substring(1, literal.length() - 1));
	}

	private static String longBracket(String literal) {
		int level = 0;
		while (literal.charAt(level + 1) == '=') {
			level++;
		}
		int start = level + 2;
		int end = literal.length() - level - 2;
		// a newline right after the opening bracket is skipped
		if (literal.startsWith("\r\n", start)) {
			start += 2;
		}
		else if (start < end && (literal.charAt(start) == '\n' || literal.charAt(start) == '\r')) {
			start++;
		}
		return start >= end ? "" : literal.substring(start, end);
	}

	private static String quoted(String body) {
		StringBuilder sb = new StringBuilder(body.length());
		int pos = 0;
		while (pos < body.length()) {
			char c = body.charAt(pos);
			if (c != '\\') {
				sb.append(c);
				pos++;
				continue;
			}
			pos++;
			if (pos >= body.length()) {
				throw new IllegalArgumentException("unfinished string");
			}
			pos = escape(body, pos, sb);
		}
		return sb.toString();
	}

	/**
	 * Decodes the escape whose first character after the backslash is at {@code pos}.
	 * @return the position after the escape
	 */
	private static int escape(String body, int pos, StringBuilder sb) {
		char c = body.charAt(pos);
		switch (c) {
			case 'n' -> sb.append('\n');
			case 't' -> sb.append('\t');
			case 'r' -> sb.append('\r');
			case 'a' -> sb.append('\u0007');
			case 'b' -> sb.append('\b');
			case 'f' -> sb.append('\f');
			case 'v' -> sb.append('\u000B');
			case '\\', '"', '\'' -> sb.append(c);
			case '\n', '\r' -> {
				sb.append('\n');
				if (pos + 1 < body.length() && body.charAt(pos + 1) != c
						&& (body.charAt(pos + 1) == '\n' || body.charAt(pos + 1) == '\r')) {
					return pos + 2;
				}
			}
			case 'z' -> {
				int p = pos + 1;
				while (p < body.length() && Character.isWhitespace(body.charAt(p))) {
					p++;
				}
				return p;
			}
			case 'x' -> {
				if (pos + 2 >= body.length() || !isHex(body.charAt(pos + 1)) || !isHex(body.charAt(pos + 2))) {
					throw new IllegalArgumentException("hexadecimal digit expected");
				}
				sb.append((char) Integer.parseInt(body.substring(pos + 1, pos + 3), 16));
				return pos + 3;
			}
			case 'u' -> {
				int close = body.indexOf('}', pos);
				if (pos + 1 >= body.length() || body.charAt(pos + 1) != '{' || close < 0) {
					throw new IllegalArgumentException("missing '{' or '}' in \\u{xxxx}");
				}
				try {
					sb.appendCodePoint(Integer.parseInt(body.substring(pos + 2, close), 16));
				}
				catch (IllegalArgumentException e) {
					throw new IllegalArgumentException("UTF-8 value too large", e);
				}
				return close + 1;
			}
			default -> {
				if (c < '0' || c > '9') {
					throw new IllegalArgumentException("invalid escape sequence '\\" + c + "'");
				}
				int end = pos;
				while (end < body.length() && end - pos < 3 && body.charAt(end) >= '0' && body.charAt(end) <= '9') {
					end++;
				}
				int value = Integer.parseInt(body.substring(pos, end));
				if (value > 255) {
					throw new IllegalArgumentException("decimal escape too large");
				}
				sb.append((char) value);
				return end;
			}
		}
		return pos + 1;
	}

	private static boolean isHex(char c) {
		return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

}
