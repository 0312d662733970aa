package org.springaicommunity.eigen.neovim;

import java.util.Optional;

/**
 * Persistence for {@link CrawlCheckpoint}.
 */
public interface CheckpointStore {

	/**
	 * Load the saved checkpoint.
	 * @return the checkpoint, or empty if none was saved yet
	 * @throws CheckpointCorruptException if a saved checkpoint cannot be read
	 */
	Optional<CrawlCheckpoint> load();

	/**
	 * Persist the checkpoint, replacing the previous one atomically.
	 */
	void save(CrawlCheckpoint checkpoint);

}
