package org.springaicommunity.eigen.neovim;

/**
 * How a plugin appeared in a plugin manager spec.
 */
public enum PluginSpecKind {

	/** A bare string entry: {@code "owner/name"}. */
	STRING,

	/** A table entry whose first element is the name: {@code { "owner/name", ... }}. */
	TABLE,

	/** Listed as a dependency of another plugin. */
	DEPENDENCY

}
