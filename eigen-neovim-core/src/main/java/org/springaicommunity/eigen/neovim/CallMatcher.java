package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.lua.Expr;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes one family of calls and turns a matching call into facts.
 */
interface CallMatcher {

	/**
	 * @return the facts when the call belongs to this family, otherwise empty
	 */
	Optional<List<StructuralFact>> match(Expr.Call call, LocalBindings bindings, String source);

}
