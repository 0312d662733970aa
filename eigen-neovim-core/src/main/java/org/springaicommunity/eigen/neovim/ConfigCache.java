package org.springaicommunity.eigen.neovim;

import java.util.List;
import java.util.Set;

/**
 * Storage for fetched config files, one unit per repository identity. Absence of a unit
 * means the repository has not been fetched yet.
 */
public interface ConfigCache {

	/**
	 * Returns true if a config for the repository is stored.
	 * @param fullName repository in "owner/name" format
	 */
	boolean contains(String fullName);

	/**
	 * Store a config and its discovery metadata. Either both become visible or the
	 * config is not considered cached.
	 */
	void write(CachedConfig config);

	/**
	 * Identities of all cached repositories.
	 */
	Set<String> identities();

	/**
	 * Load every cached config, most popular first and by identity within equal
	 * popularity. A unit that cannot be read is skipped and reported, not thrown.
	 */
	CacheContents load();

	/**
	 * The readable configs of {@link #load()}.
	 */
	default List<CachedConfig> loadAll() {
		return load().configs();
	}

}
