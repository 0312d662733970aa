package org.springaicommunity.eigen.neovim;

/**
 * Percentage thresholds applied to the aggregated statistics.
 *
 * @param report minimum percentage for an entry to appear in the report
 * @param consensus minimum percentage for a setting to enter the consensus config
 * @param pluginSpec minimum percentage for a plugin to enter the plugin spec
 */
public record Thresholds(double report, double consensus, double pluginSpec) {

	public static final double DEFAULT_REPORT = 1.0;

	public static final double DEFAULT_CONSENSUS = 40.0;

	public static final double DEFAULT_PLUGIN_SPEC = 5.0;

	public Thresholds {
		check("report threshold", report);
		check("consensus threshold", consensus);
		check("plugin-spec threshold", pluginSpec);
	}

	/**
	 * @throws ThresholdConfigException if any threshold lies outside 0-100
	 */
	public static Thresholds of(double report, double consensus, double pluginSpec) {
		return new Thresholds(report, consensus, pluginSpec);
	}

	public static Thresholds defaults() {
		return new Thresholds(DEFAULT_REPORT, DEFAULT_CONSENSUS, DEFAULT_PLUGIN_SPEC);
	}

	private static void check(String name, double value) {
		if (Double.isNaN(value) || value < 0 || value > 100) {
			throw new ThresholdConfigException(name, value);
		}
	}

}
