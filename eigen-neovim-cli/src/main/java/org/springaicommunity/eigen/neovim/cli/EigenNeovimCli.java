package org.springaicommunity.eigen.neovim.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.eigen.neovim.*;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Eigen-Neovim CLI Application
 *
 * Plain Java command-line application that harvests Neovim init.lua files from GitHub
 * code search and computes a consensus configuration. Uses EigenNeovimBuilder for
 * service wiring.
 *
 * Usage: java -jar eigen-neovim-cli.jar COMMAND [OPTIONS]
 *
 * Environment Variables: GH_TOKEN or GITHUB_TOKEN - GitHub personal access token, needed
 * by fetch, fetch-all and run
 *
 * Examples: java -jar eigen-neovim-cli.jar fetch --max-repos 100; java -jar
 * eigen-neovim-cli.jar fetch-all --reset-queries; java -jar eigen-neovim-cli.jar analyze
 * --threshold 50 --plugins-lua plugins.lua
 */
public class EigenNeovimCli {

	private static final Logger logger = LoggerFactory.getLogger(EigenNeovimCli.class);

	private static final String LOGGER_ROOT = "org.springaicommunity.eigen";

	private static final long SHUTDOWN_GRACE_SECONDS = 30;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("eigen-neovim failed: {}", e.getMessage());
			logger.debug("Failure details", e);
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		return run(args, new EigenProperties(), EigenNeovimBuilder.create());
	}

	/**
	 * Run a command with the given defaults and builder, which tests use to inject doubles.
	 */
	static int run(String[] args, EigenProperties properties, EigenNeovimBuilder builder) {
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		// Thresholds and --since are validated here, before any network or file work
		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		if (config.verbose) {
			enableDebugLogging();
		}
		logConfiguration(config);

		if (ArgumentParser.FETCH_ALL.equals(config.command) && config.showQueries) {
			showQueries();
			return 0;
		}

		properties.setCacheDirectory(config.cacheDirectory);
		properties.setStateFile(config.stateFile);
		properties.setWorkers(config.workers);
		builder.properties(properties);

		if (config.needsToken()) {
			builder.token(argumentParser.resolveToken(config));
		}

		switch (config.command) {
			case ArgumentParser.FETCH:
				fetch(config, properties, builder);
				break;
			case ArgumentParser.FETCH_ALL:
				fetchAll(config, properties, builder);
				break;
			case ArgumentParser.RUN:
				fetch(config, properties, builder);
				analyze(config, builder);
				break;
			default:
				analyze(config, builder);
				break;
		}
		return 0;
	}

	private static CrawlResult fetch(ParsedConfiguration config, EigenProperties properties,
			EigenNeovimBuilder builder) {
		// A single query keeps no checkpoint; the cache alone prevents duplicate fetches
		CrawlOrchestrator orchestrator = builder.checkpointStore(new InMemoryCheckpointStore()).buildOrchestrator();
		CrawlRequest request = CrawlRequest.builder()
			.strategies(QueryStrategies.custom(config.query))
			.maxRepositories(config.maxRepositories != null ? config.maxRepositories : properties.getMaxRepositories())
			.resume(false)
			.checkpointInterval(properties.getCheckpointInterval())
			.workers(config.workers)
			.build();
		logger.info("Fetching up to {} configs for query: {}", request.maxRepositories(), config.query);
		CrawlResult result = runInterruptibly(orchestrator, request);
		logResults(result, config.verbose);
		return result;
	}

	private static CrawlResult fetchAll(ParsedConfiguration config, EigenProperties properties,
			EigenNeovimBuilder builder) {
		CrawlOrchestrator orchestrator = builder.buildOrchestrator();
		CrawlRequest request = CrawlRequest.builder()
			.strategies(QueryStrategies.defaults())
			.maxRepositories(
					config.maxRepositories != null ? config.maxRepositories : properties.getMaxRepositoriesAll())
			.resume(config.resume)
			.resetQueries(config.resetQueries)
			.checkpointInterval(properties.getCheckpointInterval())
			.workers(config.workers)
			.build();
		logger.info("Crawling {} query strategies (state file: {})", request.strategies().size(), config.stateFile);
		CrawlResult result = runInterruptibly(orchestrator, request);
		logResults(result, config.verbose);
		if (result.stoppedEarly()) {
			logger.info("Run fetch-all again to resume from {}", config.stateFile);
		}
		return result;
	}

	/**
	 * Run a crawl that Ctrl-C stops cleanly: in-flight downloads finish and the checkpoint
	 * is saved before the JVM exits.
	 */
	private static CrawlResult runInterruptibly(CrawlOrchestrator orchestrator, CrawlRequest request) {
		StopSignal stopSignal = new StopSignal();
		CountDownLatch finished = new CountDownLatch(1);
		Thread hook = new Thread(() -> {
			stopSignal.request("interrupted");
			try {
				if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
					logger.warn("Crawl did not stop within {} seconds", SHUTDOWN_GRACE_SECONDS);
				}
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}, "eigen-shutdown");
		Runtime.getRuntime().addShutdownHook(hook);
		try {
			return orchestrator.run(request, stopSignal);
		}
		finally {
			finished.countDown();
			try {
				Runtime.getRuntime().removeShutdownHook(hook);
			}
			catch (IllegalStateException e) {
				// JVM already shutting down; the hook is running
				logger.debug("Shutdown in progress, keeping hook");
			}
		}
	}

	private static AnalysisResult analyze(ParsedConfiguration config, EigenNeovimBuilder builder) {
		AnalysisRequest request = AnalysisRequest.builder()
			.thresholds(config.thresholds())
			.since(config.since)
			.build();
		logger.info("Analyzing configs in {}", config.cacheDirectory);
		AnalysisResult result = builder.buildAnalysisService().analyze(request);
		AggregatedStatistics statistics = result.statistics();

		logSummary(statistics);

		new MarkdownReportWriter().write(statistics, Path.of(config.reportFile));
		logger.info("Report saved to {}", config.reportFile);
		new ConsensusLuaWriter().write(statistics, Path.of(config.eigenLuaFile));
		logger.info("Eigen config saved to {}", config.eigenLuaFile);
		if (config.pluginsLuaFile != null) {
			new PluginSpecWriter().write(statistics, Path.of(config.pluginsLuaFile));
			logger.info("Plugin spec saved to {}", config.pluginsLuaFile);
		}
		return result;
	}

	private static void showQueries() {
		List<QueryStrategy> strategies = QueryStrategies.defaults();
		System.out.println("Query strategies (" + strategies.size() + "):");
		for (int i = 0; i < strategies.size(); i++) {
			QueryStrategy strategy = strategies.get(i);
			System.out.printf("  %2d. [%s] %s%n", i + 1, strategy.kind(), strategy.query());
		}
	}

	private static void enableDebugLogging() {
		org.slf4j.Logger root = LoggerFactory.getLogger(LOGGER_ROOT);
		if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.debug("Configuration:");
		logger.debug("  Command: {}", config.command);
		logger.debug("  Query: {}", config.query);
		logger.debug("  Max repositories: {}", config.maxRepositories != null ? config.maxRepositories : "(default)");
		logger.debug("  Cache directory: {}", config.cacheDirectory);
		logger.debug("  State file: {}", config.stateFile);
		logger.debug("  Resume: {}", config.resume);
		logger.debug("  Reset queries: {}", config.resetQueries);
		logger.debug("  Workers: {}", config.workers);
		logger.debug("  Thresholds: report {}%, consensus {}%, plugin spec {}%", config.reportThreshold,
				config.consensusThreshold, config.pluginSpecThreshold);
		logger.debug("  Since: {}", config.sinceText != null ? config.sinceText : "(not set)");
	}

	private static void logResults(CrawlResult result, boolean verbose) {
		logger.info("Fetch finished: {}", result.stopReason());
		logger.info("  Newly cached: {}", result.newlyCached());
		logger.info("  Duplicates skipped: {}", result.skippedDuplicates());
		logger.info("  Failures: {}", result.failures().size());
		logger.info("  Strategies exhausted: {}/{} ({} failed)", result.exhaustedStrategies(),
				result.totalStrategies(), result.failedStrategies());
		logger.info("  Total fetched across runs: {}", result.totalFetched());
		if (result.stopDetail() != null) {
			logger.info("  Stopped because: {}", result.stopDetail());
		}
		if (verbose) {
			for (ItemFailure failure : result.failures()) {
				logger.info("  FAILED: {}: {}", failure.fullName(), failure.reason());
			}
		}
	}

	private static void logSummary(AggregatedStatistics statistics) {
		logger.info("Analysis summary:");
		logger.info("  Configs analyzed: {}", statistics.totalConfigs());
		logger.info("  Skipped (not Neovim): {}", statistics.nonNeovimSkipped());
		logger.info("  Parse errors: {}", statistics.unparseable());
		logger.info("  Unreadable cache entries: {}", statistics.unreadable());
		logger.info("Top settings:");
		statistics.settings()
			.stream()
			.limit(10)
			.forEach(setting -> logger.info("  {} = {}  {}%", setting.key(), setting.consensusValue(),
					setting.entry().percentage()));
		logger.info("Top plugins:");
		statistics.plugins()
			.stream()
			.limit(10)
			.forEach(plugin -> logger.info("  {}  {}%", plugin.key(), plugin.percentage()));
		logger.info("Top colorschemes:");
		statistics.colorschemes()
			.stream()
			.limit(5)
			.forEach(colorscheme -> logger.info("  {}  {}%", colorscheme.key(), colorscheme.percentage()));
	}

}
