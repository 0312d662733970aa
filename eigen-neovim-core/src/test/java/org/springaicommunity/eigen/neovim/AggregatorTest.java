package org.springaicommunity.eigen.neovim;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springaicommunity.eigen.neovim.StructuralFact.ColorschemeRef;
import org.springaicommunity.eigen.neovim.StructuralFact.Keymap;
import org.springaicommunity.eigen.neovim.StructuralFact.PluginRef;
import org.springaicommunity.eigen.neovim.StructuralFact.Setting;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link Aggregator} and {@link FactTally}.
 */
@DisplayName("Aggregator Tests")
class AggregatorTest {

	private final Aggregator aggregator = new Aggregator(Thresholds.of(0, 40, 5));

	private static ExtractionResult config(StructuralFact... facts) {
		return ExtractionResult.parsed(List.of(facts));
	}

	private static Setting opt(String name, String value) {
		return new Setting("opt", name, value, "test");
	}

	@Nested
	@DisplayName("Counting")
	class CountingTest {

		@Test
		@DisplayName("A key repeated within one config should count once")
		void shouldCountDistinctConfigs() {
			AggregatedStatistics statistics = aggregator.aggregate(List.of(
					config(opt("number", "true"), opt("number", "false"), new Keymap("n", "x", "y", "test"),
							new Keymap("n", "x", "z", "test")),
					config(opt("number", "true"))));

			assertThat(statistics.totalConfigs()).isEqualTo(2);
			assertThat(statistics.settings()).hasSize(1);
			assertThat(statistics.settings().get(0).entry().count()).isEqualTo(2);
			assertThat(statistics.settings().get(0).entry().percentage()).isEqualByComparingTo("100");
			assertThat(statistics.keymaps()).containsExactly(AggregateEntry.of("n x", 1, 2));
		}

		@Test
		@DisplayName("The last assignment in a config should be its value")
		void shouldUseLastValue() {
			AggregatedStatistics statistics = aggregator
				.aggregate(List.of(config(opt("wrap", "true"), opt("wrap", "false"))));

			assertThat(statistics.settings().get(0).consensusValue()).isEqualTo("false");
		}

		@Test
		@DisplayName("Unparseable configs should count towards the total")
		void shouldCountUnparseable() {
			AggregatedStatistics statistics = aggregator.aggregate(
					List.of(config(new PluginRef("folke/lazy.nvim", PluginSpecKind.STRING, "test")),
							ExtractionResult.unparseable("unexpected symbol")));

			assertThat(statistics.totalConfigs()).isEqualTo(2);
			assertThat(statistics.unparseable()).isEqualTo(1);
			assertThat(statistics.plugins()).containsExactly(AggregateEntry.of("folke/lazy.nvim", 1, 2));
			assertThat(statistics.plugins().get(0).percentage()).isEqualTo(new BigDecimal("50.00"));
		}

		@Test
		@DisplayName("Percentages should round half up to two decimals")
		void shouldRoundPercentages() {
			assertThat(AggregateEntry.of("k", 1, 3).percentage()).isEqualTo(new BigDecimal("33.33"));
			assertThat(AggregateEntry.of("k", 2, 3).percentage()).isEqualTo(new BigDecimal("66.67"));
			assertThat(AggregateEntry.of("k", 0, 0).percentage()).isEqualTo(new BigDecimal("0.00"));
		}

		@Test
		@DisplayName("A count above the total should be rejected")
		void shouldRejectCountAboveTotal() {
			assertThatThrownBy(() -> AggregateEntry.of("k", 3, 2)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Ranking")
	class RankingTest {

		@Test
		@DisplayName("Rows should be ranked by count, ties by key")
		void shouldRankByCountThenKey() {
			AggregatedStatistics statistics = aggregator.aggregate(List.of(
					config(new ColorschemeRef("nord", "a"), new ColorschemeRef("gruvbox", "a")),
					config(new ColorschemeRef("tokyonight", "b")), config(new ColorschemeRef("tokyonight", "c"))));

			assertThat(statistics.colorschemes()).extracting(AggregateEntry::key)
				.containsExactly("tokyonight", "gruvbox", "nord");
		}

		@Test
		@DisplayName("Equally common values should resolve to the earliest config's value")
		void shouldBreakValueTiesByAnalysisOrder() {
			ExtractionResult first = config(opt("signcolumn", "\"yes\""));
			ExtractionResult second = config(opt("signcolumn", "\"auto\""));

			assertThat(aggregator.aggregate(List.of(first, second)).settings().get(0).consensusValue())
				.isEqualTo("\"yes\"");
			assertThat(aggregator.aggregate(List.of(second, first)).settings().get(0).consensusValue())
				.isEqualTo("\"auto\"");
		}

		@Test
		@DisplayName("The most common value should win regardless of order")
		void shouldPreferMostCommonValue() {
			RankedSetting setting = aggregator
				.aggregate(List.of(config(opt("tabstop", "8")), config(opt("tabstop", "4")),
						config(opt("tabstop", "4"))))
				.settings()
				.get(0);

			assertThat(setting.consensusValue()).isEqualTo("4");
			assertThat(setting.consensusCount()).isEqualTo(2);
			assertThat(setting.namespace()).isEqualTo("opt");
			assertThat(setting.name()).isEqualTo("tabstop");
		}

		@Test
		@DisplayName("The same input should always give the same statistics")
		void shouldBeDeterministic() {
			List<ExtractionResult> results = List.of(config(opt("a", "1"), opt("b", "1")),
					config(opt("b", "2"), opt("c", "1")), config(opt("a", "2"), opt("c", "1")));

			assertThat(aggregator.aggregate(results)).isEqualTo(aggregator.aggregate(results));
		}

	}

	@Nested
	@DisplayName("Thresholds")
	class ThresholdFilteringTest {

		@Test
		@DisplayName("Entries below the report threshold should be left out")
		void shouldApplyReportThreshold() {
			Aggregator strict = new Aggregator(Thresholds.of(50, 50, 50));

			AggregatedStatistics statistics = strict.aggregate(List.of(config(opt("number", "true"), opt("wrap", "false")),
					config(opt("number", "true")), config(opt("number", "true"))));

			assertThat(statistics.settings()).extracting(RankedSetting::key).containsExactly("vim.opt.number");
		}

		@Test
		@DisplayName("Consensus and plugin-spec views should use their own thresholds")
		void shouldApplyViewThresholds() {
			Aggregator lenient = new Aggregator(Thresholds.of(0, 50, 100));

			AggregatedStatistics statistics = lenient.aggregate(List.of(
					config(opt("number", "true"), new PluginRef("a/b", PluginSpecKind.STRING, "1")),
					config(opt("number", "true"), opt("wrap", "false"),
							new PluginRef("a/b", PluginSpecKind.TABLE, "2"), new PluginRef("c/d", PluginSpecKind.STRING, "2")),
					config()));

			assertThat(statistics.settings()).hasSize(2);
			assertThat(statistics.consensusSettings()).extracting(RankedSetting::key).containsExactly("vim.opt.number");
			assertThat(statistics.plugins()).hasSize(2);
			assertThat(statistics.pluginSpecEntries()).isEmpty();
		}

		@Test
		@DisplayName("Views with a lower threshold than the report should still see entries the report leaves out")
		void viewThresholdsShouldNotDependOnReportThreshold() {
			Aggregator strictReport = new Aggregator(Thresholds.of(50, 30, 5));
			List<ExtractionResult> results = new ArrayList<>();
			for (int i = 0; i < 10; i++) {
				List<StructuralFact> facts = new ArrayList<>();
				facts.add(opt("wrap", "false"));
				if (i < 4) {
					facts.add(opt("number", "true"));
				}
				if (i < 2) {
					facts.add(new PluginRef("folke/lazy.nvim", PluginSpecKind.STRING, "c" + i));
				}
				results.add(ExtractionResult.parsed(facts));
			}

			AggregatedStatistics statistics = strictReport.aggregate(results);

			assertThat(statistics.settings()).extracting(RankedSetting::key).containsExactly("vim.opt.wrap");
			assertThat(statistics.consensusSettings()).extracting(RankedSetting::key)
				.containsExactly("vim.opt.wrap", "vim.opt.number");
			assertThat(statistics.plugins()).isEmpty();
			assertThat(statistics.pluginSpecEntries()).extracting(AggregateEntry::key)
				.containsExactly("folke/lazy.nvim");
		}

		@Test
		@DisplayName("The most common leader key should be reported")
		void shouldReportLeaderKey() {
			Setting space = new Setting("g", "mapleader", "\" \"", "a");
			Setting comma = new Setting("g", "mapleader", "\",\"", "b");

			AggregatedStatistics statistics = aggregator
				.aggregate(List.of(config(comma), config(space), config(space)));

			assertThat(statistics.leaderKey()).contains("\" \"");
			assertThat(aggregator.aggregate(List.of(config())).leaderKey()).isEmpty();
		}

	}

	@Nested
	@DisplayName("FactTally")
	class FactTallyTest {

		private final FactTally a = FactTally.ofConfig(config(opt("number", "true")), 0);

		private final FactTally b = FactTally.ofConfig(config(opt("number", "false"), opt("wrap", "false")), 1);

		private final FactTally c = FactTally.ofConfig(ExtractionResult.unparseable("bad"), 2);

		@Test
		@DisplayName("Merging should not depend on grouping or order")
		void shouldMergeInAnyGrouping() {
			AggregatedStatistics left = aggregator.aggregate(a.merge(b).merge(c));
			AggregatedStatistics right = aggregator.aggregate(a.merge(b.merge(c)));
			AggregatedStatistics reversed = aggregator.aggregate(c.merge(b).merge(a));

			assertThat(left).isEqualTo(right).isEqualTo(reversed);
			assertThat(left.settings().get(0).consensusValue()).isEqualTo("true");
		}

		@Test
		@DisplayName("The empty tally should be the identity")
		void shouldHaveIdentity() {
			assertThat(FactTally.empty().merge(a)).isSameAs(a);
			assertThat(a.merge(FactTally.empty())).isSameAs(a);
		}

		@Test
		@DisplayName("Non-Neovim files should be counted apart from the total")
		void shouldCountNonNeovimSeparately() {
			FactTally tally = a.merge(FactTally.skippedNonNeovim()).merge(c);

			assertThat(tally.configs()).isEqualTo(2);
			assertThat(tally.nonNeovim()).isEqualTo(1);
			assertThat(tally.unparseable()).isEqualTo(1);
		}

	}

}
