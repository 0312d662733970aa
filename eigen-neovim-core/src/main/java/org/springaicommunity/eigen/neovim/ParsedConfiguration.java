package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Command: fetch, fetch-all, analyze or run
	public @Nullable String command;

	// Credentials
	public @Nullable String token;

	// Crawl settings
	public String query;

	public @Nullable Integer maxRepositories; // null = command default

	public String cacheDirectory;

	public String stateFile;

	public int workers;

	public boolean resume = true;

	public boolean resetQueries = false;

	public boolean showQueries = false;

	// Analysis settings
	public double reportThreshold;

	public double consensusThreshold;

	public double pluginSpecThreshold;

	public @Nullable SinceFilter since;

	public @Nullable String sinceText;

	// Output files
	public String reportFile;

	public String eigenLuaFile;

	public @Nullable String pluginsLuaFile; // null = no plugin spec

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(EigenProperties defaultProperties) {
		this.query = defaultProperties.getDefaultQuery();
		this.cacheDirectory = defaultProperties.getCacheDirectory();
		this.stateFile = defaultProperties.getStateFile();
		this.workers = defaultProperties.getWorkers();
		this.reportThreshold = defaultProperties.getReportThreshold();
		this.consensusThreshold = defaultProperties.getConsensusThreshold();
		this.pluginSpecThreshold = defaultProperties.getPluginSpecThreshold();
		this.reportFile = defaultProperties.getReportFile();
		this.eigenLuaFile = defaultProperties.getEigenLuaFile();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Thresholds for the analysis.
	 * @throws ThresholdConfigException if a threshold lies outside 0-100
	 */
	public Thresholds thresholds() {
		return Thresholds.of(reportThreshold, consensusThreshold, pluginSpecThreshold);
	}

	public boolean needsToken() {
		return ArgumentParser.FETCH.equals(command) || ArgumentParser.FETCH_ALL.equals(command)
				|| ArgumentParser.RUN.equals(command);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", token=" + (token != null ? "***" : "null")
				+ ", query='" + query + '\'' + ", maxRepositories=" + maxRepositories + ", cacheDirectory='"
				+ cacheDirectory + '\'' + ", stateFile='" + stateFile + '\'' + ", workers=" + workers + ", resume="
				+ resume + ", resetQueries=" + resetQueries + ", showQueries=" + showQueries + ", reportThreshold="
				+ reportThreshold + ", consensusThreshold=" + consensusThreshold + ", pluginSpecThreshold="
				+ pluginSpecThreshold + ", since='" + sinceText + '\'' + ", reportFile='" + reportFile + '\''
				+ ", eigenLuaFile='" + eigenLuaFile + '\'' + ", pluginsLuaFile='" + pluginsLuaFile + '\''
				+ ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
