package org.springaicommunity.eigen.neovim;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-key counts of distinct configs, folded from any number of extraction results.
 *
 * <p>
 * A tally is immutable. {@link #merge(FactTally)} is commutative and associative with
 * {@link #empty()} as identity, so configs can be tallied on a parallel stream and
 * reduced in any grouping with the same result. Each config's position in the analysis
 * order (its ordinal) is kept with every setting value it contributes; it decides ties
 * between equally common values.
 */
public final class FactTally {

	private static final FactTally EMPTY = new FactTally(0, 0, 0, Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

	private static final String LEADER_KEY = "vim.g.mapleader";

	private final int configs;

	private final int unparseable;

	private final int nonNeovim;

	private final Map<String, Map<String, ValueCount>> settings;

	private final Map<String, Integer> plugins;

	private final Map<String, Integer> colorschemes;

	private final Map<String, Integer> keymaps;

	private final Map<String, Integer> leaderKeys;

	private FactTally(int configs, int unparseable, int nonNeovim, Map<String, Map<String, ValueCount>> settings,
			Map<String, Integer> plugins, Map<String, Integer> colorschemes, Map<String, Integer> keymaps,
			Map<String, Integer> leaderKeys) {
		this.configs = configs;
		this.unparseable = unparseable;
		this.nonNeovim = nonNeovim;
		this.settings = settings;
		this.plugins = plugins;
		this.colorschemes = colorschemes;
		this.keymaps = keymaps;
		this.leaderKeys = leaderKeys;
	}

	public static FactTally empty() {
		return EMPTY;
	}

	/**
	 * A file that was skipped because it is not a Neovim config. It does not count towards
	 * the analyzed total.
	 */
	public static FactTally skippedNonNeovim() {
		return new FactTally(0, 0, 1, Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
	}

	/**
	 * Tally one analyzed config. Every key counts once; a setting assigned several times
	 * contributes its last value.
	 * @param result extraction result of the config
	 * @param ordinal position of the config in the analysis order
	 */
	public static FactTally ofConfig(ExtractionResult result, int ordinal) {
		if (!result.isParsed()) {
			return new FactTally(1, 1, 0, Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
		}
		Map<String, String> lastValues = new LinkedHashMap<>();
		Set<String> plugins = new LinkedHashSet<>();
		Set<String> colorschemes = new LinkedHashSet<>();
		Set<String> keymaps = new LinkedHashSet<>();
		for (StructuralFact fact : result.facts()) {
			if (fact instanceof StructuralFact.Setting setting) {
				lastValues.put(setting.key(), setting.value());
			}
			else if (fact instanceof StructuralFact.PluginRef plugin) {
				plugins.add(plugin.key());
			}
			else if (fact instanceof StructuralFact.ColorschemeRef colorscheme) {
				colorschemes.add(colorscheme.key());
			}
			else if (fact instanceof StructuralFact.Keymap keymap) {
				keymaps.add(keymap.key());
			}
		}
		Map<String, Map<String, ValueCount>> settings = new HashMap<>();
		lastValues.forEach((key, value) -> settings.put(key, Map.of(value, new ValueCount(1, ordinal))));
		String leader = lastValues.get(LEADER_KEY);
		return new FactTally(1, 0, 0, settings, ones(plugins), ones(colorschemes), ones(keymaps),
				leader == null ? Map.of() : Map.of(leader, 1));
	}

	public FactTally merge(FactTally other) {
		if (this == EMPTY) {
			return other;
		}
		if (other == EMPTY) {
			return this;
		}
		Map<String, Map<String, ValueCount>> mergedSettings = new HashMap<>(settings);
		other.settings.forEach((key, values) -> mergedSettings.merge(key, values, FactTally::mergeValues));
		return new FactTally(configs + other.configs, unparseable + other.unparseable, nonNeovim + other.nonNeovim,
				mergedSettings, sum(plugins, other.plugins), sum(colorschemes, other.colorschemes),
				sum(keymaps, other.keymaps), sum(leaderKeys, other.leaderKeys));
	}

	/**
	 * Number of configs analyzed, including unparseable ones.
	 */
	public int configs() {
		return configs;
	}

	public int unparseable() {
		return unparseable;
	}

	public int nonNeovim() {
		return nonNeovim;
	}

	Map<String, Map<String, ValueCount>> settings() {
		return Collections.unmodifiableMap(settings);
	}

	Map<String, Integer> plugins() {
		return Collections.unmodifiableMap(plugins);
	}

	Map<String, Integer> colorschemes() {
		return Collections.unmodifiableMap(colorschemes);
	}

	Map<String, Integer> keymaps() {
		return Collections.unmodifiableMap(keymaps);
	}

	Map<String, Integer> leaderKeys() {
		return Collections.unmodifiableMap(leaderKeys);
	}

	private static Map<String, ValueCount> mergeValues(Map<String, ValueCount> left, Map<String, ValueCount> right) {
		Map<String, ValueCount> merged = new HashMap<>(left);
		right.forEach((value, count) -> merged.merge(value, count, ValueCount::plus));
		return merged;
	}

	private static Map<String, Integer> sum(Map<String, Integer> left, Map<String, Integer> right) {
		if (right.isEmpty()) {
			return left;
		}
		Map<String, Integer> merged = new HashMap<>(left);
		right.forEach((key, count) -> merged.merge(key, count, Integer::sum));
		return merged;
	}

	private static Map<String, Integer> ones(Set<String> keys) {
		Map<String, Integer> counts = new HashMap<>();
		keys.forEach(key -> counts.put(key, 1));
		return counts;
	}

	/**
	 * How many configs chose one value for a setting, and the lowest ordinal among them.
	 *
	 * @param count number of configs
	 * @param firstSeen ordinal of the earliest config in analysis order
	 */
	record ValueCount(int count, int firstSeen) {

		ValueCount plus(ValueCount other) {
			return new ValueCount(count + other.count, Math.min(firstSeen, other.firstSeen));
		}

	}

}
