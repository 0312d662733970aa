package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SinceFilter}.
 */
@DisplayName("SinceFilter Tests")
class SinceFilterTest {

	private final Clock clock = Clock.fixed(Instant.parse("2025-01-31T12:00:00Z"), ZoneOffset.UTC);

	private static CachedConfig pushedAt(@Nullable Instant pushedAt) {
		RepositoryRef repo = new RepositoryRef("alice/nvim", 10, "main", "filename:init.lua",
				"https://github.com/alice/nvim", pushedAt);
		return CachedConfig.of(repo, "init.lua", "vim.opt.number = true", Instant.parse("2025-01-31T00:00:00Z"));
	}

	@ParameterizedTest
	@CsvSource({ "30d, 2025-01-01T12:00:00Z", "2w, 2025-01-17T12:00:00Z", "6m, 2024-08-04T12:00:00Z",
			"1Y, 2024-02-01T12:00:00Z", "2024-06-15, 2024-06-15T00:00:00Z" })
	@DisplayName("Should parse relative periods and dates")
	void shouldParseCutoff(String value, String cutoff) {
		assertThat(SinceFilter.parse(value, clock).getCutoff()).isEqualTo(Instant.parse(cutoff));
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "yesterday", "10x", "2024-13-01", "-1d" })
	@DisplayName("Should reject anything else")
	void shouldRejectInvalidValues(String value) {
		assertThatThrownBy(() -> SinceFilter.parse(value, clock)).isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("Invalid since value");
	}

	@Test
	@DisplayName("Should keep configs pushed on or after the cutoff")
	void shouldFilterByPushTime() {
		SinceFilter filter = SinceFilter.from(Instant.parse("2024-06-01T00:00:00Z"));

		assertThat(filter.test(pushedAt(Instant.parse("2024-06-01T00:00:00Z")))).isTrue();
		assertThat(filter.test(pushedAt(Instant.parse("2024-12-24T08:00:00Z")))).isTrue();
		assertThat(filter.test(pushedAt(Instant.parse("2024-05-31T23:59:59Z")))).isFalse();
	}

	@Test
	@DisplayName("Configs without a push time should be excluded")
	void shouldExcludeUnknownPushTime() {
		assertThat(SinceFilter.from(Instant.EPOCH).test(pushedAt(null))).isFalse();
	}

}
