package org.springaicommunity.eigen.neovim;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File system implementation of {@link CheckpointStore}: one JSON document, replaced
 * atomically on every save.
 *
 * <p>
 * Unknown fields are ignored on load so files written by newer versions still resume.
 */
public class FileSystemCheckpointStore implements CheckpointStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCheckpointStore.class);

	static final int FORMAT_VERSION = 1;

	private final Path file;

	private final ObjectMapper objectMapper;

	public FileSystemCheckpointStore(Path file, ObjectMapper objectMapper) {
		this.file = file;
		this.objectMapper = objectMapper;
	}

	public Path getFile() {
		return file;
	}

	@Override
	public Optional<CrawlCheckpoint> load() {
		if (!Files.exists(file)) {
			logger.debug("No checkpoint at {}", file);
			return Optional.empty();
		}
		try {
			CheckpointDocument document = objectMapper.readValue(file.toFile(), CheckpointDocument.class);
			if (document == null) {
				throw new IOException("empty document");
			}
			CrawlCheckpoint checkpoint = document.toCheckpoint();
			logger.info("Loaded checkpoint from {}: {} processed, {} failed, {} strategies tracked", file,
					checkpoint.processed().size(), checkpoint.failed().size(), checkpoint.strategies().size());
			return Optional.of(checkpoint);
		}
		catch (IOException | IllegalArgumentException e) {
			throw new CheckpointCorruptException(file, e);
		}
	}

	@Override
	public void save(CrawlCheckpoint checkpoint) {
		checkpoint.markSaved(Instant.now());
		try {
			AtomicFiles.write(file,
					objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(CheckpointDocument.of(checkpoint)));
			logger.debug("Saved checkpoint to {} ({} processed)", file, checkpoint.processed().size());
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to save checkpoint " + file, e);
		}
	}

	/**
	 * On-disk shape of a checkpoint.
	 *
	 * @param version format version
	 * @param processed processed repository identities, sorted
	 * @param failed failed identities mapped to the failure reason
	 * @param strategies progress per strategy id, in crawl order
	 * @param totalFetched configs fetched across all runs
	 * @param savedAt time of this save
	 */
	record CheckpointDocument(int version, @Nullable List<String> processed, @Nullable Map<String, String> failed,
			@Nullable Map<String, StrategyProgress> strategies, long totalFetched, @Nullable Instant savedAt) {

		static CheckpointDocument of(CrawlCheckpoint checkpoint) {
			return new CheckpointDocument(FORMAT_VERSION, List.copyOf(checkpoint.processed()),
					new LinkedHashMap<>(checkpoint.failed()), new LinkedHashMap<>(checkpoint.strategies()),
					checkpoint.totalFetched(), checkpoint.savedAt());
		}

		CrawlCheckpoint toCheckpoint() {
			return new CrawlCheckpoint(processed != null ? processed : List.of(), failed != null ? failed : Map.of(),
					strategies != null ? strategies : Map.of(), totalFetched, savedAt);
		}

	}

}
