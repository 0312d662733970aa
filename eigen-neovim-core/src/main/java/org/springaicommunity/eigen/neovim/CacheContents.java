package org.springaicommunity.eigen.neovim;

import java.util.List;

/**
 * Everything read from a {@link ConfigCache} in one pass.
 *
 * @param configs the configs that could be read, in cache order
 * @param unreadable units that were skipped because they could not be read
 */
public record CacheContents(List<CachedConfig> configs, List<ItemFailure> unreadable) {

	public CacheContents {
		configs = List.copyOf(configs);
		unreadable = List.copyOf(unreadable);
	}

	public static CacheContents of(List<CachedConfig> configs) {
		return new CacheContents(configs, List.of());
	}

}
