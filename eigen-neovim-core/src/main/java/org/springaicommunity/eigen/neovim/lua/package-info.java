/**
 * Lua 5.4 syntax tree used by the config extractor, converted from a tree-sitter parse.
 *
 * <p>
 * The tree is a tagged-variant hierarchy of records behind sealed interfaces
 * ({@link org.springaicommunity.eigen.neovim.lua.Expr},
 * {@link org.springaicommunity.eigen.neovim.lua.Stmt},
 * {@link org.springaicommunity.eigen.neovim.lua.TableField}). Nothing in this package
 * performs I/O; parsing itself goes through the native tree-sitter library.
 */
@NullMarked
package org.springaicommunity.eigen.neovim.lua;

import org.jspecify.annotations.NullMarked;
