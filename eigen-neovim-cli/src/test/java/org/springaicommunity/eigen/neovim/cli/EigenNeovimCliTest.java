package org.springaicommunity.eigen.neovim.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.eigen.neovim.CachedConfig;
import org.springaicommunity.eigen.neovim.CodeSearchService;
import org.springaicommunity.eigen.neovim.EigenNeovimBuilder;
import org.springaicommunity.eigen.neovim.EigenProperties;
import org.springaicommunity.eigen.neovim.FileSystemConfigCache;
import org.springaicommunity.eigen.neovim.ObjectMapperFactory;
import org.springaicommunity.eigen.neovim.QueryStrategy;
import org.springaicommunity.eigen.neovim.RepositoryRef;
import org.springaicommunity.eigen.neovim.SearchHit;
import org.springaicommunity.eigen.neovim.SearchPage;
import org.springaicommunity.eigen.neovim.ThresholdConfigException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the command-line entry point. Commands run against a temporary cache and a
 * fake search service; nothing touches the network.
 */
@DisplayName("EigenNeovimCli Tests")
class EigenNeovimCliTest {

	private static final String CONFIG = """
			vim.g.mapleader = " "
			vim.opt.number = true
			vim.keymap.set("n", "<leader>w", "<cmd>w<cr>")
			require("lazy").setup({ "folke/tokyonight.nvim" })
			""";

	@TempDir
	Path tempDir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();

	private PrintStream originalOut;

	@BeforeEach
	void captureOutput() {
		originalOut = System.out;
		System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
	}

	@AfterEach
	void restoreOutput() {
		System.setOut(originalOut);
	}

	private String output() {
		return out.toString(StandardCharsets.UTF_8);
	}

	private String[] withOutputs(String... args) {
		List<String> all = new ArrayList<>(List.of(args));
		all.addAll(List.of("--cache-dir", tempDir.resolve("data").toString(), "-o",
				tempDir.resolve("README.md").toString(), "--eigen-lua", tempDir.resolve("eigen.lua").toString(),
				"--state-file", tempDir.resolve("state.json").toString()));
		return all.toArray(new String[0]);
	}

	private void cache(String fullName, int stars) {
		RepositoryRef repo = new RepositoryRef(fullName, stars, "main", "filename:init.lua",
				"https://github.com/" + fullName, Instant.parse("2024-06-01T00:00:00Z"));
		new FileSystemConfigCache(tempDir.resolve("data"), ObjectMapperFactory.create())
			.write(CachedConfig.of(repo, "init.lua", CONFIG, Instant.parse("2024-06-02T00:00:00Z")));
	}

	@Nested
	@DisplayName("Informational Commands")
	class InformationalTest {

		@Test
		@DisplayName("Should print help without arguments")
		void shouldPrintHelp() {
			int exitCode = EigenNeovimCli.run(new String[0], new EigenProperties(), EigenNeovimBuilder.create());

			assertThat(exitCode).isZero();
			assertThat(output()).contains("Usage: eigen-neovim COMMAND [OPTIONS]");
		}

		@Test
		@DisplayName("Should list the query strategies without a token")
		void shouldShowQueries() {
			int exitCode = EigenNeovimCli.run(new String[] { "fetch-all", "--show-queries" }, new EigenProperties(),
					EigenNeovimBuilder.create());

			assertThat(exitCode).isZero();
			assertThat(output()).contains("Query strategies (").contains("1. [");
			assertThat(tempDir.resolve("state.json")).doesNotExist();
		}

	}

	@Nested
	@DisplayName("Analyze Command")
	class AnalyzeTest {

		@Test
		@DisplayName("Should write the report and the consensus config")
		void shouldWriteArtifacts() throws Exception {
			cache("alice/nvim", 10);
			cache("bob/dotfiles", 5);

			int exitCode = EigenNeovimCli.run(withOutputs("analyze", "--plugins-lua",
					tempDir.resolve("plugins.lua").toString()), new EigenProperties(), EigenNeovimBuilder.create());

			assertThat(exitCode).isZero();
			assertThat(Files.readString(tempDir.resolve("README.md"))).contains("Statistics over 2 Neovim")
				.contains("| `vim.opt.number` | 100.00% | `true` |");
			assertThat(Files.readString(tempDir.resolve("eigen.lua"))).contains("vim.opt.number = true  -- 100.00%");
			assertThat(Files.readString(tempDir.resolve("plugins.lua"))).contains("{ \"folke/tokyonight.nvim\" }");
		}

		@Test
		@DisplayName("An invalid threshold should fail before anything is written")
		void shouldRejectInvalidThreshold() {
			cache("alice/nvim", 10);

			assertThatThrownBy(() -> EigenNeovimCli.run(withOutputs("analyze", "--threshold", "150"),
					new EigenProperties(), EigenNeovimBuilder.create()))
				.isInstanceOf(ThresholdConfigException.class);
			assertThat(tempDir.resolve("README.md")).doesNotExist();
			assertThat(tempDir.resolve("eigen.lua")).doesNotExist();
		}

		@Test
		@DisplayName("An empty cache should still produce valid artifacts")
		void shouldHandleEmptyCache() throws Exception {
			int exitCode = EigenNeovimCli.run(withOutputs("analyze"), new EigenProperties(),
					EigenNeovimBuilder.create());

			assertThat(exitCode).isZero();
			assertThat(Files.readString(tempDir.resolve("README.md"))).contains("No settings reached the threshold.");
			assertThat(Files.readString(tempDir.resolve("eigen.lua"))).contains("return M");
		}

	}

	@Nested
	@DisplayName("Fetch Commands")
	class FetchTest {

		@Test
		@DisplayName("Run should fetch into the cache and then analyze it")
		void shouldFetchThenAnalyze() throws Exception {
			EigenNeovimBuilder builder = EigenNeovimBuilder.create().searchService(new SingleConfigSearch());

			int exitCode = EigenNeovimCli.run(withOutputs("run", "--token", "test-token"), new EigenProperties(),
					builder);

			assertThat(exitCode).isZero();
			assertThat(tempDir.resolve("data/carol__nvim.lua")).hasContent(CONFIG);
			assertThat(Files.readString(tempDir.resolve("README.md"))).contains("Statistics over 1 Neovim");
		}

		@Test
		@DisplayName("Fetch-all should save its checkpoint to the state file")
		void shouldSaveCheckpoint() {
			EigenNeovimBuilder builder = EigenNeovimBuilder.create().searchService(new SingleConfigSearch());

			int exitCode = EigenNeovimCli.run(withOutputs("fetch-all", "--token", "test-token", "--max-repos", "1"),
					new EigenProperties(), builder);

			assertThat(exitCode).isZero();
			assertThat(tempDir.resolve("state.json")).exists();
			assertThat(tempDir.resolve("data/carol__nvim.lua")).exists();
		}

		@Test
		@DisplayName("Unknown commands should be rejected")
		void shouldRejectUnknownCommand() {
			assertThatThrownBy(
					() -> EigenNeovimCli.run(new String[] { "crawl" }, new EigenProperties(), EigenNeovimBuilder.create()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown command: crawl");
		}

	}

	/**
	 * Every query finds the same single repository.
	 */
	static class SingleConfigSearch implements CodeSearchService {

		@Override
		public SearchPage search(QueryStrategy strategy, int page) {
			if (page > 1) {
				return SearchPage.end();
			}
			return new SearchPage(List.of(new SearchHit("carol/nvim", "init.lua", "https://github.com/carol/nvim")), 1,
					null);
		}

		@Override
		public RepositoryRef describe(SearchHit hit, QueryStrategy strategy) {
			return new RepositoryRef(hit.fullName(), 42, "main", strategy.id(), hit.htmlUrl(),
					Instant.parse("2024-06-01T00:00:00Z"));
		}

		@Override
		public Optional<String> fetchContent(RepositoryRef repository, String path) {
			return Optional.of(CONFIG);
		}

	}

}
