package org.springaicommunity.eigen.neovim;

import java.nio.file.Path;

/**
 * Thrown when a persisted crawl checkpoint cannot be read back. Resuming is impossible;
 * running with resume disabled starts from a fresh checkpoint.
 */
public class CheckpointCorruptException extends RuntimeException {

	private final Path file;

	public CheckpointCorruptException(Path file, Throwable cause) {
		super("Checkpoint file is corrupt: " + file + " (" + cause.getMessage()
				+ "). Use --no-resume to start fresh.", cause);
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

}
