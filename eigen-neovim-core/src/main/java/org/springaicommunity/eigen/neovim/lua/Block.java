package org.springaicommunity.eigen.neovim.lua;

import java.util.List;

/**
 * A sequence of statements; a whole chunk is a block too.
 */
public record Block(List<Stmt> statements) {

	public Block {
		statements = List.copyOf(statements);
	}

}
