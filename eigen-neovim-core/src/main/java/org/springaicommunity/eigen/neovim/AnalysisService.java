package org.springaicommunity.eigen.neovim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Runs extraction and aggregation over every config in the cache.
 *
 * <p>
 * Configs are analyzed in cache order (stars descending, then identity), which decides
 * ties between equally common setting values. Extraction runs on a parallel stream; the
 * per-config tallies are merged with {@link FactTally#merge(FactTally)}, so the result
 * does not depend on scheduling.
 */
public class AnalysisService {

	private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);

	private final ConfigCache cache;

	private final ConfigExtractor extractor;

	private final NeovimConfigDetector detector;

	public AnalysisService(ConfigCache cache, ConfigExtractor extractor, NeovimConfigDetector detector) {
		this.cache = cache;
		this.extractor = extractor;
		this.detector = detector;
	}

	public AnalysisResult analyze(AnalysisRequest request) {
		CacheContents contents = cache.load();
		List<CachedConfig> cached = contents.configs();
		if (!contents.unreadable().isEmpty()) {
			logger.warn("Skipped {} unreadable cached configs", contents.unreadable().size());
		}
		List<CachedConfig> configs = request.since() == null ? cached
				: cached.stream().filter(request.since()).toList();
		int filtered = cached.size() - configs.size();
		if (request.since() != null) {
			logger.info("Filtered to {} configs pushed since {} ({} older, excluded)", configs.size(),
					request.since().getCutoff(), filtered);
		}

		FactTally tally = IntStream.range(0, configs.size())
			.parallel()
			.mapToObj(i -> tally(configs.get(i), i, request.skipNonNeovim()))
			.reduce(FactTally.empty(), FactTally::merge);

		AggregatedStatistics statistics = new Aggregator(request.thresholds()).aggregate(tally)
			.withUnreadable(contents.unreadable().size());
		logger.info("Analyzed {} configs ({} not Neovim, skipped; {} unparseable)", statistics.totalConfigs(),
				statistics.nonNeovimSkipped(), statistics.unparseable());
		return new AnalysisResult(statistics, cached.size(), filtered);
	}

	private FactTally tally(CachedConfig config, int ordinal, boolean skipNonNeovim) {
		if (skipNonNeovim && !detector.isNeovimConfig(config.content())) {
			logger.debug("Skipping {}: not a Neovim config", config.identity());
			return FactTally.skippedNonNeovim();
		}
		return FactTally.ofConfig(extractor.extract(config), ordinal);
	}

}
