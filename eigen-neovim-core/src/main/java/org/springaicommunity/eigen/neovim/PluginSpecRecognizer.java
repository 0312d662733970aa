package org.springaicommunity.eigen.neovim;

import org.springaicommunity.eigen.neovim.lua.Expr;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes the plugin declarations of one plugin manager.
 *
 * <p>
 * Recognizers are independent of each other and tried in a fixed order; the first one
 * that claims a call wins. A claimed call may still declare no plugins (a lazy.nvim setup
 * that only imports a module, for instance), in which case the result is an empty list
 * rather than empty.
 */
public interface PluginSpecRecognizer {

	/**
	 * @param call the call expression being inspected
	 * @param bindings local names in scope, used to resolve spec tables held in variables
	 * @param source identity of the config
	 * @return the declared plugins when this manager owns the call, otherwise empty
	 */
	Optional<List<StructuralFact.PluginRef>> tryExtract(Expr.Call call, LocalBindings bindings, String source);

	/**
	 * The recognizers for lazy.nvim, packer, paq and mini.deps, in matching order.
	 */
	static List<PluginSpecRecognizer> defaults() {
		return List.of(new LazyNvimRecognizer(), new PackerRecognizer(), new PaqRecognizer(),
				new MiniDepsRecognizer());
	}

}
