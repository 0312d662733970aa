package org.springaicommunity.eigen.neovim.lua;

import java.util.List;

/**
 * Parameters and body of a function.
 *
 * @param parameters named parameters
 * @param vararg whether the parameter list ends with {@code ...}
 * @param body the function body
 */
public record FunctionBody(List<String> parameters, boolean vararg, Block body) {

	public FunctionBody {
		parameters = List.copyOf(parameters);
	}

}
