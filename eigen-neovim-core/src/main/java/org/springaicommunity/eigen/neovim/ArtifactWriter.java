package org.springaicommunity.eigen.neovim;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Renders aggregated statistics into one output file. Rendering is a pure function of
 * the statistics: the same statistics always give the same text.
 */
public interface ArtifactWriter {

	String render(AggregatedStatistics statistics);

	/**
	 * Render and write the artifact, replacing the target atomically.
	 * @throws UncheckedIOException if the file cannot be written
	 */
	default void write(AggregatedStatistics statistics, Path target) {
		try {
			AtomicFiles.write(target, render(statistics).getBytes(StandardCharsets.UTF_8));
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write " + target, e);
		}
	}

}
