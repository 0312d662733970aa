package org.springaicommunity.eigen.neovim;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps only configs whose repository was pushed to on or after a cutoff.
 *
 * <p>
 * The cutoff is either relative to now ({@code 1y}, {@code 6m}, {@code 2w},
 * {@code 30d}, counting a year as 365 days and a month as 30) or an absolute date
 * ({@code 2024-01-01}, UTC midnight). Configs without a push time are excluded.
 */
public final class SinceFilter implements Predicate<CachedConfig> {

	private static final Pattern RELATIVE = Pattern.compile("(\\d+)([ymwd])");

	private final Instant cutoff;

	private SinceFilter(Instant cutoff) {
		this.cutoff = cutoff;
	}

	public static SinceFilter from(Instant cutoff) {
		return new SinceFilter(cutoff);
	}

	/**
	 * @throws IllegalArgumentException if the value is neither a relative period nor a
	 * date
	 */
	public static SinceFilter parse(String value, Clock clock) {
		String since = value.strip().toLowerCase(Locale.ROOT);
		Matcher matcher = RELATIVE.matcher(since);
		if (matcher.matches()) {
			long amount = Long.parseLong(matcher.group(1));
			long days = switch (matcher.group(2)) {
				case "y" -> amount * 365;
				case "m" -> amount * 30;
				case "w" -> amount * 7;
				default -> amount;
			};
			return new SinceFilter(clock.instant().minus(Duration.ofDays(days)));
		}
		try {
			return new SinceFilter(LocalDate.parse(since).atStartOfDay(ZoneOffset.UTC).toInstant());
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException(
					"Invalid since value '" + value + "': must be a period like 1y, 6m, 2w, 30d or a date YYYY-MM-DD",
					e);
		}
	}

	public Instant getCutoff() {
		return cutoff;
	}

	@Override
	public boolean test(CachedConfig config) {
		Instant pushedAt = config.repository().pushedAt();
		return pushedAt != null && !pushedAt.isBefore(cutoff);
	}

}
