package org.springaicommunity.eigen.neovim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Folds per-config extraction results into {@link AggregatedStatistics}.
 *
 * <p>
 * Counts are numbers of distinct configs. Rows are ranked by count, descending, with
 * ties broken by key so that the same input always yields the same tables.
 */
public class Aggregator {

	private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

	private static final String SETTING_PREFIX = "vim.";

	private final Thresholds thresholds;

	public Aggregator(Thresholds thresholds) {
		this.thresholds = thresholds;
	}

	public Thresholds getThresholds() {
		return thresholds;
	}

	/**
	 * Aggregate results given in analysis order: earlier configs win ties between equally
	 * common setting values.
	 */
	public AggregatedStatistics aggregate(List<ExtractionResult> results) {
		FactTally tally = FactTally.empty();
		for (int i = 0; i < results.size(); i++) {
			tally = tally.merge(FactTally.ofConfig(results.get(i), i));
		}
		return aggregate(tally);
	}

	public AggregatedStatistics aggregate(FactTally tally) {
		int total = tally.configs();
		List<RankedSetting> ranked = tally.settings()
			.entrySet()
			.stream()
			.map(entry -> rankSetting(entry.getKey(), entry.getValue(), total))
			.sorted(Comparator.comparing(RankedSetting::entry, AggregateEntry.RANKING))
			.toList();
		List<AggregateEntry> plugins = rank(tally.plugins(), total);
		AggregatedStatistics statistics = new AggregatedStatistics(total,
				settingsReaching(ranked, thresholds.report()), settingsReaching(ranked, thresholds.consensus()),
				reaching(rank(tally.colorschemes(), total), thresholds.report()),
				reaching(plugins, thresholds.report()), reaching(plugins, thresholds.pluginSpec()),
				reaching(rank(tally.keymaps(), total), thresholds.report()), rank(tally.leaderKeys(), total),
				tally.unparseable(), tally.nonNeovim(), 0, thresholds);
		logger.debug("Aggregated {} configs: {} settings, {} plugins, {} colorschemes, {} keymaps", total,
				statistics.settings().size(), statistics.plugins().size(), statistics.colorschemes().size(),
				statistics.keymaps().size());
		return statistics;
	}

	private static List<AggregateEntry> rank(Map<String, Integer> counts, int total) {
		return counts.entrySet()
			.stream()
			.map(entry -> AggregateEntry.of(entry.getKey(), entry.getValue(), total))
			.sorted(AggregateEntry.RANKING)
			.toList();
	}

	private static List<AggregateEntry> reaching(List<AggregateEntry> ranked, double threshold) {
		return ranked.stream().filter(entry -> entry.reaches(threshold)).toList();
	}

	private static List<RankedSetting> settingsReaching(List<RankedSetting> ranked, double threshold) {
		return ranked.stream().filter(setting -> setting.entry().reaches(threshold)).toList();
	}

	private static RankedSetting rankSetting(String key, Map<String, FactTally.ValueCount> values, int total) {
		int count = values.values().stream().mapToInt(FactTally.ValueCount::count).sum();
		Map.Entry<String, FactTally.ValueCount> consensus = values.entrySet()
			.stream()
			.min(Comparator.<Map.Entry<String, FactTally.ValueCount>>comparingInt(value -> -value.getValue().count())
				.thenComparingInt(value -> value.getValue().firstSeen())
				.thenComparing(Map.Entry::getKey))
			.orElseThrow();
		int separator = key.indexOf('.', SETTING_PREFIX.length());
		String namespace = key.substring(SETTING_PREFIX.length(), separator);
		String name = key.substring(separator + 1);
		return new RankedSetting(AggregateEntry.of(key, count, total), namespace, name, consensus.getKey(),
				consensus.getValue().count());
	}

}
