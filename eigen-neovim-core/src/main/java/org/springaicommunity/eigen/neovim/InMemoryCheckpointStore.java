package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * {@link CheckpointStore} that keeps the last saved checkpoint in memory. Used by the
 * single-query {@code fetch} command, which has no state file, and by tests.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

	private @Nullable CrawlCheckpoint saved;

	private int saveCount;

	@Override
	public synchronized Optional<CrawlCheckpoint> load() {
		return Optional.ofNullable(saved).map(CrawlCheckpoint::copy);
	}

	@Override
	public synchronized void save(CrawlCheckpoint checkpoint) {
		this.saved = checkpoint.copy();
		this.saveCount++;
	}

	/**
	 * Number of times {@link #save(CrawlCheckpoint)} was called.
	 */
	public synchronized int getSaveCount() {
		return saveCount;
	}

}
