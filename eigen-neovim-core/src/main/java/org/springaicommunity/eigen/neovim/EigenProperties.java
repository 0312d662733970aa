package org.springaicommunity.eigen.neovim;

/**
 * Configuration properties for crawling and analysis.
 *
 * <p>
 * Every property has a default suitable for a full crawl with an authenticated token.
 * Properties can be set directly via setters or passed to {@link EigenNeovimBuilder}
 * and {@link ArgumentParser}, which use them as the defaults of the command line.
 */
public class EigenProperties {

	/**
	 * Directory holding cached configs and their metadata sidecars.
	 */
	private String cacheDirectory = "data";

	/**
	 * File the crawl checkpoint is saved to.
	 */
	private String stateFile = "fetch_state.json";

	/**
	 * Code search query used by the single-query commands.
	 */
	private String defaultQuery = "filename:init.lua path:nvim";

	/**
	 * Repository budget of the single-query commands.
	 */
	private int maxRepositories = 500;

	/**
	 * Repository budget of the multi-strategy crawl.
	 */
	private int maxRepositoriesAll = 1_000_000;

	/**
	 * Code search results requested per page (1-100).
	 */
	private int perPage = 100;

	/**
	 * Cached repositories between checkpoint saves.
	 */
	private int checkpointInterval = 10;

	/**
	 * Concurrent content downloads per page.
	 */
	private int workers = 4;

	/**
	 * Maximum attempts for a request failing transiently.
	 */
	private int maxRetries = 3;

	/**
	 * Base delay of the exponential retry backoff, in milliseconds.
	 */
	private long retryBaseDelayMillis = 1000;

	/**
	 * Cap of the exponential retry backoff, in milliseconds.
	 */
	private long retryMaxDelayMillis = 10_000;

	/**
	 * Longest cumulative wait for a rate limit reset before a crawl stops, in minutes.
	 */
	private long rateLimitWaitMinutes = 60;

	/**
	 * Code search requests allowed per minute.
	 */
	private int searchRequestsPerMinute = 10;

	/**
	 * HTTP request timeout in seconds.
	 */
	private int requestTimeoutSeconds = 30;

	/**
	 * Minimum percentage for an entry to appear in the report.
	 */
	private double reportThreshold = Thresholds.DEFAULT_REPORT;

	/**
	 * Minimum percentage for a setting to enter eigen.lua.
	 */
	private double consensusThreshold = Thresholds.DEFAULT_CONSENSUS;

	/**
	 * Minimum percentage for a plugin to enter plugins.lua.
	 */
	private double pluginSpecThreshold = Thresholds.DEFAULT_PLUGIN_SPEC;

	/**
	 * Markdown report output file.
	 */
	private String reportFile = "README.md";

	/**
	 * Consensus config output file.
	 */
	private String eigenLuaFile = "eigen.lua";

	/**
	 * Enable debug-level logging output.
	 */
	private boolean verbose = false;

	public String getCacheDirectory() {
		return cacheDirectory;
	}

	public void setCacheDirectory(String cacheDirectory) {
		this.cacheDirectory = cacheDirectory;
	}

	public String getStateFile() {
		return stateFile;
	}

	public void setStateFile(String stateFile) {
		this.stateFile = stateFile;
	}

	public String getDefaultQuery() {
		return defaultQuery;
	}

	public void setDefaultQuery(String defaultQuery) {
		this.defaultQuery = defaultQuery;
	}

	public int getMaxRepositories() {
		return maxRepositories;
	}

	public void setMaxRepositories(int maxRepositories) {
		this.maxRepositories = maxRepositories;
	}

	public int getMaxRepositoriesAll() {
		return maxRepositoriesAll;
	}

	public void setMaxRepositoriesAll(int maxRepositoriesAll) {
		this.maxRepositoriesAll = maxRepositoriesAll;
	}

	public int getPerPage() {
		return perPage;
	}

	public void setPerPage(int perPage) {
		this.perPage = perPage;
	}

	public int getCheckpointInterval() {
		return checkpointInterval;
	}

	public void setCheckpointInterval(int checkpointInterval) {
		this.checkpointInterval = checkpointInterval;
	}

	public int getWorkers() {
		return workers;
	}

	public void setWorkers(int workers) {
		this.workers = workers;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryBaseDelayMillis() {
		return retryBaseDelayMillis;
	}

	public void setRetryBaseDelayMillis(long retryBaseDelayMillis) {
		this.retryBaseDelayMillis = retryBaseDelayMillis;
	}

	public long getRetryMaxDelayMillis() {
		return retryMaxDelayMillis;
	}

	public void setRetryMaxDelayMillis(long retryMaxDelayMillis) {
		this.retryMaxDelayMillis = retryMaxDelayMillis;
	}

	public long getRateLimitWaitMinutes() {
		return rateLimitWaitMinutes;
	}

	public void setRateLimitWaitMinutes(long rateLimitWaitMinutes) {
		this.rateLimitWaitMinutes = rateLimitWaitMinutes;
	}

	public int getSearchRequestsPerMinute() {
		return searchRequestsPerMinute;
	}

	public void setSearchRequestsPerMinute(int searchRequestsPerMinute) {
		this.searchRequestsPerMinute = searchRequestsPerMinute;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public double getReportThreshold() {
		return reportThreshold;
	}

	public void setReportThreshold(double reportThreshold) {
		this.reportThreshold = reportThreshold;
	}

	public double getConsensusThreshold() {
		return consensusThreshold;
	}

	public void setConsensusThreshold(double consensusThreshold) {
		this.consensusThreshold = consensusThreshold;
	}

	public double getPluginSpecThreshold() {
		return pluginSpecThreshold;
	}

	public void setPluginSpecThreshold(double pluginSpecThreshold) {
		this.pluginSpecThreshold = pluginSpecThreshold;
	}

	public String getReportFile() {
		return reportFile;
	}

	public void setReportFile(String reportFile) {
		this.reportFile = reportFile;
	}

	public String getEigenLuaFile() {
		return eigenLuaFile;
	}

	public void setEigenLuaFile(String eigenLuaFile) {
		this.eigenLuaFile = eigenLuaFile;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/**
	 * Thresholds built from the three percentage properties.
	 * @throws ThresholdConfigException if one of them lies outside 0-100
	 */
	public Thresholds thresholds() {
		return Thresholds.of(reportThreshold, consensusThreshold, pluginSpecThreshold);
	}

}
