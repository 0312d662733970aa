package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Command-line argument parser for the eigen-neovim commands. Pure Java implementation
 * with no framework dependencies for maximum testability.
 *
 * <p>
 * The first argument that is not an option names the command. Thresholds are validated
 * here, before any network or file work starts.
 */
public class ArgumentParser {

	public static final String FETCH = "fetch";

	public static final String FETCH_ALL = "fetch-all";

	public static final String ANALYZE = "analyze";

	public static final String RUN = "run";

	static final List<String> COMMANDS = List.of(FETCH, FETCH_ALL, ANALYZE, RUN);

	private final EigenProperties defaultProperties;

	private final Clock clock;

	private final Supplier<@Nullable String> environmentToken;

	public ArgumentParser(EigenProperties defaultProperties) {
		this(defaultProperties, Clock.systemUTC());
	}

	/**
	 * @param clock resolves relative {@code --since} periods
	 */
	public ArgumentParser(EigenProperties defaultProperties, Clock clock) {
		this(defaultProperties, clock, EnvironmentSupport::githubToken);
	}

	/**
	 * @param clock resolves relative {@code --since} periods
	 * @param environmentToken looks up the token when {@code --token} is not given
	 */
	public ArgumentParser(EigenProperties defaultProperties, Clock clock,
			Supplier<@Nullable String> environmentToken) {
		this.defaultProperties = defaultProperties;
		this.clock = clock;
		this.environmentToken = environmentToken;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws ThresholdConfigException if a threshold lies outside 0-100
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--token":
					config.token = getRequiredValue(args, i, "token");
					i++;
					break;

				case "-q", "--query":
					config.query = getRequiredValue(args, i, "query");
					i++;
					break;

				case "--max-repos":
					config.maxRepositories = parsePositive(getRequiredValue(args, i, "max-repos"), "max repos");
					i++;
					break;

				case "--cache-dir", "--output-dir", "--input-dir":
					config.cacheDirectory = getRequiredValue(args, i, "cache-dir");
					i++;
					break;

				case "--state-file":
					config.stateFile = getRequiredValue(args, i, "state-file");
					i++;
					break;

				case "--workers":
					config.workers = parsePositive(getRequiredValue(args, i, "workers"), "workers");
					i++;
					break;

				case "--resume":
					config.resume = true;
					break;

				case "--no-resume":
					config.resume = false;
					break;

				case "--reset-queries":
					config.resetQueries = true;
					break;

				case "--show-queries":
					config.showQueries = true;
					break;

				case "--threshold":
					config.consensusThreshold = parsePercentage(getRequiredValue(args, i, "threshold"), "threshold");
					i++;
					break;

				case "--min-percentage":
					config.reportThreshold = parsePercentage(getRequiredValue(args, i, "min-percentage"),
							"min-percentage");
					i++;
					break;

				case "--plugin-threshold":
					config.pluginSpecThreshold = parsePercentage(getRequiredValue(args, i, "plugin-threshold"),
							"plugin-threshold");
					i++;
					break;

				case "--since":
					config.sinceText = getRequiredValue(args, i, "since");
					config.since = SinceFilter.parse(config.sinceText, clock);
					i++;
					break;

				case "-o", "--output":
					config.reportFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "--eigen-lua":
					config.eigenLuaFile = getRequiredValue(args, i, "eigen-lua");
					i++;
					break;

				case "--plugins-lua":
					config.pluginsLuaFile = getRequiredValue(args, i, "plugins-lua");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.command != null) {
						throw new IllegalArgumentException(
								"Unexpected argument '" + arg + "': command already given (" + config.command + ")");
					}
					config.command = arg.toLowerCase();
					break;
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		if (args.length == 0) {
			return true;
		}
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: eigen-neovim COMMAND [OPTIONS]\n");
		help.append("\n");
		help.append("Harvest Neovim init.lua files from GitHub and compute a consensus configuration.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    fetch                   Fetch configs for a single code search query\n");
		help.append("    fetch-all               Crawl every query strategy, resumable across runs\n");
		help.append("    analyze                 Analyze cached configs and write the report and eigen.lua\n");
		help.append("    run                     fetch followed by analyze\n");
		help.append("\n");
		help.append("FETCH OPTIONS:\n");
		help.append("    --token TOKEN           GitHub token (default: GH_TOKEN or GITHUB_TOKEN from .env or environment)\n");
		help.append("    -q, --query QUERY       Code search query for fetch and run (default: ")
			.append(defaultProperties.getDefaultQuery())
			.append(")\n");
		help.append("    --max-repos N           Maximum repositories to fetch (default: ")
			.append(defaultProperties.getMaxRepositories())
			.append(", fetch-all: ")
			.append(defaultProperties.getMaxRepositoriesAll())
			.append(")\n");
		help.append("    --cache-dir DIR         Config cache directory (default: ")
			.append(defaultProperties.getCacheDirectory())
			.append(")\n");
		help.append("                            Aliases: --output-dir, --input-dir\n");
		help.append("    --workers N             Concurrent downloads (default: ")
			.append(defaultProperties.getWorkers())
			.append(")\n");
		help.append("\n");
		help.append("FETCH-ALL OPTIONS:\n");
		help.append("    --state-file FILE       Checkpoint file for resumption (default: ")
			.append(defaultProperties.getStateFile())
			.append(")\n");
		help.append("    --resume, --no-resume   Resume from the checkpoint if present (default: resume)\n");
		help.append("    --reset-queries         Re-run all query strategies, keeping the repositories already seen\n");
		help.append("    --show-queries          Print the query strategies and exit\n");
		help.append("\n");
		help.append("ANALYZE OPTIONS:\n");
		help.append("    --threshold PCT         Minimum percentage for eigen.lua (default: ")
			.append(Percentages.threshold(defaultProperties.getConsensusThreshold()))
			.append(")\n");
		help.append("    --min-percentage PCT    Minimum percentage for the report (default: ")
			.append(Percentages.threshold(defaultProperties.getReportThreshold()))
			.append(")\n");
		help.append("    --plugin-threshold PCT  Minimum percentage for plugins.lua (default: ")
			.append(Percentages.threshold(defaultProperties.getPluginSpecThreshold()))
			.append(")\n");
		help.append("    --since WHEN            Only configs pushed since WHEN: 1y, 6m, 2w, 30d or YYYY-MM-DD\n");
		help.append("    -o, --output FILE       Markdown report (default: ")
			.append(defaultProperties.getReportFile())
			.append(")\n");
		help.append("    --eigen-lua FILE        Consensus config (default: ")
			.append(defaultProperties.getEigenLuaFile())
			.append(")\n");
		help.append("    --plugins-lua FILE      Also write a lazy.nvim plugin spec\n");
		help.append("\n");
		help.append("GENERAL OPTIONS:\n");
		help.append("    -v, --verbose           Enable debug logging\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GH_TOKEN, GITHUB_TOKEN  GitHub personal access token (required by fetch, fetch-all and run)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    eigen-neovim fetch --max-repos 100\n");
		help.append("    eigen-neovim fetch-all --show-queries\n");
		help.append("    eigen-neovim fetch-all --no-resume --state-file crawl.json\n");
		help.append("    eigen-neovim analyze --threshold 50 --plugins-lua plugins.lua --since 1y\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Resolve the GitHub token for commands that need one.
	 * @return the token from {@code --token}, else from the environment; null when the
	 * command needs none
	 * @throws AuthRequiredException if the command needs a token and none is available
	 */
	public @Nullable String resolveToken(ParsedConfiguration config) {
		String token = config.token != null && !config.token.isBlank() ? config.token.trim()
				: environmentToken.get();
		if (token == null && config.needsToken() && !config.showQueries) {
			throw new AuthRequiredException(
					"GitHub token required. Set GH_TOKEN or GITHUB_TOKEN in a .env file or the environment, or use --token");
		}
		return token;
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static int parsePositive(String value, String name) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException(capitalize(name) + " must be positive: " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
	}

	private static double parsePercentage(String value, String name) {
		double parsed;
		try {
			parsed = Double.parseDouble(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a number");
		}
		if (Double.isNaN(parsed) || parsed < 0 || parsed > 100) {
			throw new ThresholdConfigException(name, parsed);
		}
		return parsed;
	}

	private static String capitalize(String name) {
		return Character.toUpperCase(name.charAt(0)) + name.substring(1);
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("A command is required (one of " + String.join(", ", COMMANDS) + ")");
		}
		else if (!COMMANDS.contains(config.command)) {
			errors.add("Unknown command: " + config.command + " (must be one of " + String.join(", ", COMMANDS) + ")");
		}

		if (config.query.isBlank()) {
			errors.add("Query cannot be empty");
		}

		if (config.workers > 32) {
			errors.add("Too many workers (got: " + config.workers + ", max: 32)");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}

		// Thresholds are checked together so that the error names the offending one
		config.thresholds();
	}

}
