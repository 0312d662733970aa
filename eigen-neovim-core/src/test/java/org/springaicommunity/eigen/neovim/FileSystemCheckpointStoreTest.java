package org.springaicommunity.eigen.neovim;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FileSystemCheckpointStore} and {@link CrawlCheckpoint}.
 */
@DisplayName("FileSystemCheckpointStore Tests")
class FileSystemCheckpointStoreTest {

	@TempDir
	Path tempDir;

	private Path stateFile;

	private FileSystemCheckpointStore store;

	@BeforeEach
	void setUp() {
		stateFile = tempDir.resolve("fetch_state.json");
		store = new FileSystemCheckpointStore(stateFile, ObjectMapperFactory.create());
	}

	@Nested
	@DisplayName("Persistence Tests")
	class PersistenceTest {

		@Test
		@DisplayName("Should return empty when no checkpoint was saved")
		void shouldReturnEmptyWhenMissing() {
			assertThat(store.load()).isEmpty();
		}

		@Test
		@DisplayName("Should restore processed, failed, strategy progress and totals")
		void shouldRoundTrip() {
			CrawlCheckpoint checkpoint = new CrawlCheckpoint();
			checkpoint.markProcessed("b/two");
			checkpoint.markProcessed("a/one");
			checkpoint.markFailed("c/three", "HTTP 500");
			checkpoint.updateProgress("q1", new StrategyProgress(StrategyStatus.PAGINATING, 4));
			checkpoint.updateProgress("q2", StrategyProgress.PENDING.exhausted());
			checkpoint.incrementFetched();
			checkpoint.incrementFetched();

			store.save(checkpoint);
			CrawlCheckpoint loaded = store.load().orElseThrow();

			assertThat(loaded.processed()).containsExactly("a/one", "b/two");
			assertThat(loaded.failed()).containsEntry("c/three", "HTTP 500");
			assertThat(loaded.progress("q1")).isEqualTo(new StrategyProgress(StrategyStatus.PAGINATING, 4));
			assertThat(loaded.progress("q2").status()).isEqualTo(StrategyStatus.EXHAUSTED);
			assertThat(loaded.strategies().keySet()).containsExactly("q1", "q2");
			assertThat(loaded.totalFetched()).isEqualTo(2);
			assertThat(loaded.savedAt()).isNotNull();
		}

		@Test
		@DisplayName("Should write the processed set sorted")
		void shouldWriteSortedProcessedSet() throws Exception {
			CrawlCheckpoint checkpoint = new CrawlCheckpoint(List.of("z/z", "a/a", "m/m"), java.util.Map.of(),
					java.util.Map.of(), 3, null);

			store.save(checkpoint);

			String json = Files.readString(stateFile);
			assertThat(json.indexOf("a/a")).isLessThan(json.indexOf("m/m"));
			assertThat(json.indexOf("m/m")).isLessThan(json.indexOf("z/z"));
			assertThat(json).contains("\"version\" : 1");
		}

		@Test
		@DisplayName("Should ignore unknown fields")
		void shouldIgnoreUnknownFields() throws Exception {
			Files.writeString(stateFile, "{\"version\":2,\"processed\":[\"a/one\"],\"future_field\":true}");

			CrawlCheckpoint loaded = store.load().orElseThrow();

			assertThat(loaded.isProcessed("a/one")).isTrue();
			assertThat(loaded.strategies()).isEmpty();
		}

		@Test
		@DisplayName("Should report a corrupt file")
		void shouldRejectCorruptFile() throws Exception {
			Files.writeString(stateFile, "{\"processed\": [\"a/one\"");

			assertThatThrownBy(() -> store.load()).isInstanceOf(CheckpointCorruptException.class)
				.hasMessageContaining("--no-resume");
		}

	}

	@Nested
	@DisplayName("Checkpoint Semantics Tests")
	class CheckpointSemanticsTest {

		@Test
		@DisplayName("Processing a repository should clear its failure")
		void processingClearsFailure() {
			CrawlCheckpoint checkpoint = new CrawlCheckpoint();
			checkpoint.markFailed("a/one", "timeout");

			assertThat(checkpoint.markProcessed("a/one")).isTrue();
			assertThat(checkpoint.isFailed("a/one")).isFalse();
			assertThat(checkpoint.markProcessed("a/one")).isFalse();
		}

		@Test
		@DisplayName("A processed repository should never be marked failed")
		void processedIsNotFailed() {
			CrawlCheckpoint checkpoint = new CrawlCheckpoint();
			checkpoint.markProcessed("a/one");
			checkpoint.markFailed("a/one", "late failure");

			assertThat(checkpoint.isFailed("a/one")).isFalse();
		}

		@Test
		@DisplayName("Resetting strategies should keep the processed set")
		void resetKeepsProcessed() {
			CrawlCheckpoint checkpoint = new CrawlCheckpoint();
			checkpoint.markProcessed("a/one");
			checkpoint.updateProgress("q", StrategyProgress.PENDING.exhausted());

			checkpoint.resetStrategies();

			assertThat(checkpoint.progress("q")).isEqualTo(StrategyProgress.PENDING);
			assertThat(checkpoint.isProcessed("a/one")).isTrue();
		}

		@Test
		@DisplayName("Merging cache identities should count only new ones")
		void mergeCountsNewIdentities() {
			CrawlCheckpoint checkpoint = new CrawlCheckpoint();
			checkpoint.markProcessed("a/one");

			assertThat(checkpoint.mergeProcessed(List.of("a/one", "b/two"))).isEqualTo(1);
		}

		@Test
		@DisplayName("Copies should be independent")
		void copiesAreIndependent() {
			CrawlCheckpoint checkpoint = new CrawlCheckpoint();
			CrawlCheckpoint copy = checkpoint.copy();

			checkpoint.markProcessed("a/one");

			assertThat(copy.isProcessed("a/one")).isFalse();
		}

	}

}
