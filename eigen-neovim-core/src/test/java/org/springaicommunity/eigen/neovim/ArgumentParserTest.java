package org.springaicommunity.eigen.neovim;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only. No network or file access.
 */
@DisplayName("ArgumentParser Tests - Plain JUnit Only")
class ArgumentParserTest {

	private EigenProperties defaultProperties;

	private ArgumentParser argumentParser;

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-31T00:00:00Z"), ZoneOffset.UTC);

	@BeforeEach
	void setUp() {
		defaultProperties = new EigenProperties();
		argumentParser = new ArgumentParser(defaultProperties, CLOCK);
	}

	@Nested
	@DisplayName("Command Parsing Tests")
	class CommandParsingTest {

		@ParameterizedTest
		@ValueSource(strings = { "fetch", "fetch-all", "analyze", "run", "ANALYZE" })
		@DisplayName("Should accept every command")
		void shouldAcceptCommands(String command) {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { command });

			assertThat(config.command).isEqualTo(command.toLowerCase());
		}

		@Test
		@DisplayName("Should accept options before the command")
		void shouldAcceptOptionsBeforeCommand() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "-v", "analyze" });

			assertThat(config.command).isEqualTo("analyze");
			assertThat(config.verbose).isTrue();
		}

		@Test
		@DisplayName("Should require a command")
		void shouldRequireCommand() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--verbose" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("A command is required");
		}

		@Test
		@DisplayName("Should reject unknown commands and options")
		void shouldRejectUnknown() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "crawl" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown command: crawl");
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "analyze", "--fast" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown option: --fast");
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "fetch", "analyze" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("command already given");
		}

		@Test
		@DisplayName("Should use default values for unparsed arguments")
		void shouldUseDefaultValues() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "fetch" });

			assertThat(config.query).isEqualTo(defaultProperties.getDefaultQuery());
			assertThat(config.maxRepositories).isNull();
			assertThat(config.cacheDirectory).isEqualTo(defaultProperties.getCacheDirectory());
			assertThat(config.stateFile).isEqualTo(defaultProperties.getStateFile());
			assertThat(config.workers).isEqualTo(defaultProperties.getWorkers());
			assertThat(config.resume).isTrue();
			assertThat(config.thresholds()).isEqualTo(Thresholds.defaults());
			assertThat(config.reportFile).isEqualTo("README.md");
			assertThat(config.eigenLuaFile).isEqualTo("eigen.lua");
			assertThat(config.pluginsLuaFile).isNull();
			assertThat(config.since).isNull();
		}

	}

	@Nested
	@DisplayName("Fetch Option Tests")
	class FetchOptionTest {

		@Test
		@DisplayName("Should parse fetch options")
		void shouldParseFetchOptions() {
			String[] args = { "fetch", "-q", "filename:init.lua path:.config", "--max-repos", "50", "--cache-dir",
					"configs", "--workers", "8", "--token", "ghp_test" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.query).isEqualTo("filename:init.lua path:.config");
			assertThat(config.maxRepositories).isEqualTo(50);
			assertThat(config.cacheDirectory).isEqualTo("configs");
			assertThat(config.workers).isEqualTo(8);
			assertThat(config.token).isEqualTo("ghp_test");
		}

		@ParameterizedTest
		@ValueSource(strings = { "--output-dir", "--input-dir" })
		@DisplayName("Should accept the cache directory aliases")
		void shouldAcceptCacheDirAliases(String option) {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "analyze", option, "out" });

			assertThat(config.cacheDirectory).isEqualTo("out");
		}

		@Test
		@DisplayName("Should parse crawl flags")
		void shouldParseCrawlFlags() {
			String[] args = { "fetch-all", "--no-resume", "--reset-queries", "--show-queries", "--state-file",
					"crawl.json" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.resume).isFalse();
			assertThat(config.resetQueries).isTrue();
			assertThat(config.showQueries).isTrue();
			assertThat(config.stateFile).isEqualTo("crawl.json");
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-5", "many" })
		@DisplayName("Should reject non-positive counts")
		void shouldRejectNonPositiveCounts(String value) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "fetch", "--max-repos", value }))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject too many workers")
		void shouldRejectTooManyWorkers() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "fetch", "--workers", "64" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Too many workers");
		}

		@Test
		@DisplayName("Should reject an empty query")
		void shouldRejectEmptyQuery() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "fetch", "--query", " " }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Query cannot be empty");
		}

		@Test
		@DisplayName("Should report a missing option value")
		void shouldReportMissingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "fetch", "--query" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Missing value for query option");
		}

	}

	@Nested
	@DisplayName("Analyze Option Tests")
	class AnalyzeOptionTest {

		@Test
		@DisplayName("Should parse thresholds and output files")
		void shouldParseAnalyzeOptions() {
			String[] args = { "analyze", "--threshold", "50", "--min-percentage", "2.5", "--plugin-threshold", "10",
					"-o", "report.md", "--eigen-lua", "out/eigen.lua", "--plugins-lua", "plugins.lua" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.thresholds()).isEqualTo(Thresholds.of(2.5, 50, 10));
			assertThat(config.reportFile).isEqualTo("report.md");
			assertThat(config.eigenLuaFile).isEqualTo("out/eigen.lua");
			assertThat(config.pluginsLuaFile).isEqualTo("plugins.lua");
		}

		@ParameterizedTest
		@ValueSource(strings = { "150", "-1", "100.01" })
		@DisplayName("Should reject thresholds outside 0-100 before any work starts")
		void shouldRejectOutOfRangeThresholds(String value) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "analyze", "--threshold", value }))
				.isInstanceOfSatisfying(ThresholdConfigException.class,
						e -> assertThat(e.getThresholdName()).isEqualTo("threshold"));
		}

		@Test
		@DisplayName("Should reject a non-numeric threshold")
		void shouldRejectNonNumericThreshold() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "analyze", "--threshold", "high" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must be a number");
		}

		@Test
		@DisplayName("Should resolve --since against the clock")
		void shouldParseSince() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "analyze", "--since", "30d" });

			assertThat(config.sinceText).isEqualTo("30d");
			assertThat(config.since).isNotNull();
			assertThat(config.since.getCutoff()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
		}

		@Test
		@DisplayName("Should reject an invalid --since value")
		void shouldRejectInvalidSince() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "analyze", "--since", "recently" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid since value 'recently'");
		}

	}

	@Nested
	@DisplayName("Help Request Detection Tests")
	class HelpRequestDetectionTest {

		@Test
		@DisplayName("Should detect short and long help flags")
		void shouldDetectHelpFlags() {
			assertThat(argumentParser.isHelpRequested(new String[] { "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "analyze", "--help" })).isTrue();
		}

		@Test
		@DisplayName("No arguments at all should show help")
		void shouldShowHelpWithoutArguments() {
			assertThat(argumentParser.isHelpRequested(new String[0])).isTrue();
		}

		@Test
		@DisplayName("Help should skip validation")
		void shouldSkipValidationForHelp() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--help" });

			assertThat(config.helpRequested).isTrue();
			assertThat(config.command).isNull();
		}

		@Test
		@DisplayName("Should not detect help when not present")
		void shouldNotDetectHelpWhenNotPresent() {
			assertThat(argumentParser.isHelpRequested(new String[] { "analyze", "--verbose" })).isFalse();
		}

	}

	@Nested
	@DisplayName("Help Text Generation Tests")
	class HelpTextGenerationTest {

		@Test
		@DisplayName("Should generate help text with default values")
		void shouldGenerateHelpTextWithDefaultValues() {
			String helpText = argumentParser.generateHelpText();

			assertThat(helpText).contains("Usage: eigen-neovim COMMAND [OPTIONS]")
				.contains("(default: " + defaultProperties.getDefaultQuery() + ")")
				.contains("Minimum percentage for eigen.lua (default: 40)")
				.contains("Minimum percentage for the report (default: 1)")
				.contains("Checkpoint file for resumption (default: fetch_state.json)")
				.contains("GH_TOKEN, GITHUB_TOKEN");
		}

		@Test
		@DisplayName("Should document every command and section")
		void shouldGenerateCompleteHelpText() {
			String helpText = argumentParser.generateHelpText();

			assertThat(helpText).contains("COMMANDS:")
				.contains("FETCH OPTIONS:")
				.contains("FETCH-ALL OPTIONS:")
				.contains("ANALYZE OPTIONS:")
				.contains("ENVIRONMENT VARIABLES:")
				.contains("EXAMPLES:");
			for (String command : ArgumentParser.COMMANDS) {
				assertThat(helpText).contains("    " + command + " ");
			}
		}

	}

	@Nested
	@DisplayName("Token Resolution Tests")
	class TokenResolutionTest {

		@Test
		@DisplayName("An explicit token should win and be trimmed")
		void shouldPreferExplicitToken() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "fetch", "--token", " ghp_explicit " });

			assertThat(argumentParser.resolveToken(config)).isEqualTo("ghp_explicit");
		}

		@Test
		@DisplayName("Analyze should not need a token")
		void shouldNotRequireTokenForAnalyze() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "analyze" });

			assertThat(config.needsToken()).isFalse();
			assertThatCode(() -> argumentParser.resolveToken(config)).doesNotThrowAnyException();
		}

		@Test
		@DisplayName("Fetching without any token should fail before any request")
		void shouldRequireTokenForFetch() {
			ArgumentParser noEnvironment = new ArgumentParser(defaultProperties, CLOCK, () -> null);
			ParsedConfiguration config = noEnvironment.parseAndValidate(new String[] { "fetch" });

			assertThatThrownBy(() -> noEnvironment.resolveToken(config)).isInstanceOf(AuthRequiredException.class)
				.hasMessageContaining("GH_TOKEN or GITHUB_TOKEN");
		}

		@Test
		@DisplayName("Should fall back to the environment token when --token is absent")
		void shouldUseEnvironmentToken() {
			ArgumentParser withEnvironment = new ArgumentParser(defaultProperties, CLOCK, () -> "ghp_environment");
			ParsedConfiguration config = withEnvironment.parseAndValidate(new String[] { "fetch-all" });

			assertThat(withEnvironment.resolveToken(config)).isEqualTo("ghp_environment");
		}

		@Test
		@DisplayName("Showing the queries should not need a token")
		void shouldNotRequireTokenToShowQueries() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "fetch-all", "--show-queries" });

			assertThatCode(() -> argumentParser.resolveToken(config)).doesNotThrowAnyException();
		}

	}

	@Nested
	@DisplayName("ParsedConfiguration toString Tests")
	class ParsedConfigurationToStringTest {

		@Test
		@DisplayName("Should mask the token")
		void shouldMaskToken() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "fetch", "--token", "ghp_secret", "--max-repos", "5" });

			assertThat(config.toString()).contains("ParsedConfiguration{")
				.contains("command='fetch'")
				.contains("maxRepositories=5")
				.contains("token=***")
				.doesNotContain("ghp_secret");
		}

	}

}
