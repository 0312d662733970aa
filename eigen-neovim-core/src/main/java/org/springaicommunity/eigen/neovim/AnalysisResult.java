package org.springaicommunity.eigen.neovim;

/**
 * Outcome of an analysis.
 *
 * @param statistics the aggregated statistics
 * @param cachedConfigs configs found in the cache
 * @param filteredBySince configs left out because they were pushed before the cutoff
 */
public record AnalysisResult(AggregatedStatistics statistics, int cachedConfigs, int filteredBySince) {
}
