package org.springaicommunity.eigen.neovim;

/**
 * Thrown when a percentage threshold lies outside 0-100.
 */
public class ThresholdConfigException extends IllegalArgumentException {

	private final String thresholdName;

	private final double value;

	public ThresholdConfigException(String thresholdName, double value) {
		super(thresholdName + " must be between 0 and 100, got: " + value);
		this.thresholdName = thresholdName;
		this.value = value;
	}

	public String getThresholdName() {
		return thresholdName;
	}

	public double getValue() {
		return value;
	}

}
