package org.springaicommunity.eigen.neovim.lua;

/**
 * Thrown by {@link LuaParser} when the source is not valid Lua.
 */
public class LuaSyntaxException extends RuntimeException {

	private final int line;

	public LuaSyntaxException(String message, int line) {
		super("line " + line + ": " + message);
		this.line = line;
	}

	public int getLine() {
		return line;
	}

}
