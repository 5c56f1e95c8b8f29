package org.springaicommunity.feed.collector;

import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date encodings found in RSS and Atom feeds into UTC instants.
 *
 * <p>
 * Layouts are tried in order:
 * <ol>
 * <li>RFC 1123 / RFC 2822 ({@code Wed, 01 Jan 2025 12:00:00 GMT}), the RSS format,
 * including the obsolete zone names ({@code UT}, {@code EST}, {@code PDT}, ...) and
 * single-letter military zones, which count as UTC</li>
 * <li>ISO-8601 with offset ({@code 2025-01-01T12:00:00Z}), the Atom format</li>
 * <li>a fixed list of alternate layouts, each tried first with an offset and then as a
 * local time taken to be UTC</li>
 * </ol>
 */
public final class FeedDates {

	private static final List<DateTimeFormatter> ALTERNATE_LAYOUTS = List.of(
			DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.ENGLISH),
			new DateTimeFormatterBuilder().appendPattern("yyyy-MM-dd'T'HH:mm:ss")
				.appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
				.appendLiteral('Z')
				.toFormatter(Locale.ENGLISH),
			DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.ENGLISH),
			DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH),
			DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm:ss Z", Locale.ENGLISH));

	private static final Pattern NAMED_ZONE = Pattern.compile("^(.*\\d{2}:\\d{2}(?::\\d{2})?)\\s+([A-Za-z]{1,3})$");

	private static final Map<String, String> OBSOLETE_ZONES = Map.ofEntries(Map.entry("UT", "+0000"),
			Map.entry("GMT", "+0000"), Map.entry("EST", "-0500"), Map.entry("EDT", "-0400"),
			Map.entry("CST", "-0600"), Map.entry("CDT", "-0500"), Map.entry("MST", "-0700"),
			Map.entry("MDT", "-0600"), Map.entry("PST", "-0800"), Map.entry("PDT", "-0700"));

	private FeedDates() {
	}

	/**
	 * Parse a feed date.
	 * @param text date text as it appears in the feed
	 * @return the instant in UTC
	 * @throws FeedCollectorException of kind DATE_PARSE if no layout matches
	 */
	public static Instant parse(@Nullable String text) {
		return parseLenient(text)
			.orElseThrow(() -> new FeedCollectorException(FeedCollectorException.ErrorKind.DATE_PARSE,
					"Unable to parse date: " + text));
	}

	/**
	 * Parse a feed date, treating unrecognized input as absent.
	 * @param text date text, may be null
	 * @return the instant, or empty if the text is blank or matches no layout
	 */
	public static Optional<Instant> parseLenient(@Nullable String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		String value = text.trim();

		Optional<Instant> parsed = parseZoned(value, DateTimeFormatter.RFC_1123_DATE_TIME);
		if (parsed.isEmpty()) {
			parsed = parseNamedZone(value);
		}
		if (parsed.isEmpty()) {
			parsed = parseOffset(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
		}
		for (int i = 0; parsed.isEmpty() && i < ALTERNATE_LAYOUTS.size(); i++) {
			DateTimeFormatter layout = ALTERNATE_LAYOUTS.get(i);
			parsed = parseOffset(value, layout);
			if (parsed.isEmpty()) {
				parsed = parseLocalAsUtc(value, layout);
			}
		}
		return parsed;
	}

	private static Optional<Instant> parseNamedZone(String value) {
		Matcher matcher = NAMED_ZONE.matcher(value);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		String zone = matcher.group(2).toUpperCase(Locale.ROOT);
		String offset = OBSOLETE_ZONES.get(zone);
		if (offset == null && zone.length() == 1 && !"J".equals(zone)) {
			offset = "+0000";
		}
		if (offset == null) {
			return Optional.empty();
		}
		return parseZoned(matcher.group(1) + " " + offset, DateTimeFormatter.RFC_1123_DATE_TIME);
	}

	private static Optional<Instant> parseZoned(String value, DateTimeFormatter layout) {
		try {
			return Optional.of(ZonedDateTime.parse(value, layout).toInstant());
		}
		catch (DateTimeException e) {
			return Optional.empty();
		}
	}

	private static Optional<Instant> parseOffset(String value, DateTimeFormatter layout) {
		try {
			return Optional.of(OffsetDateTime.parse(value, layout).toInstant());
		}
		catch (DateTimeException e) {
			return Optional.empty();
		}
	}

	private static Optional<Instant> parseLocalAsUtc(String value, DateTimeFormatter layout) {
		try {
			return Optional.of(LocalDateTime.parse(value, layout).toInstant(ZoneOffset.UTC));
		}
		catch (DateTimeException e) {
			return Optional.empty();
		}
	}

}
