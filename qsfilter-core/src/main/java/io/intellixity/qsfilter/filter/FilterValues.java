package io.intellixity.qsfilter.filter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.UUID;

/**
 * Parsing of raw query operands into filter domain values, and their canonical text form.
 * <p>
 * Parsers accept single-digit month, day and time components ({@code 1993-2-28},
 * {@code 10:30:5}); formatters always emit the zero-padded form.
 */
public final class FilterValues {
  private FilterValues() {}

  private static final DateTimeFormatter DATE_PARSER = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-M-d")
      .toFormatter(Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT);

  private static final DateTimeFormatter DATE_TIME_PARSER = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-M-d'T'H:m:s")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .toFormatter(Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT);

  private static final DateTimeFormatter DATE_TIME_TZ_PARSER = new DateTimeFormatterBuilder()
      .append(DATE_TIME_PARSER)
      .appendOffset("+HH:MM", "Z")
      .toFormatter(Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT);

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT);

  private static final DateTimeFormatter DATE_TIME_FORMAT = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd HH:mm:ss")
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .toFormatter(Locale.ROOT);

  private static final DateTimeFormatter DATE_TIME_TZ_FORMAT = new DateTimeFormatterBuilder()
      .append(DATE_TIME_FORMAT)
      .appendLiteral(' ')
      .appendOffset("+HH:MM", "+00:00")
      .toFormatter(Locale.ROOT);

  private static final String URN_PREFIX = "urn:uuid:";

  public static LocalDate parseDate(String raw) {
    return LocalDate.parse(raw, DATE_PARSER);
  }

  public static LocalDateTime parseDateTime(String raw) {
    return LocalDateTime.parse(raw, DATE_TIME_PARSER);
  }

  public static OffsetDateTime parseDateTimeTz(String raw) {
    return OffsetDateTime.parse(raw, DATE_TIME_TZ_PARSER);
  }

  public static long parseNumber(String raw) {
    return Long.parseLong(raw);
  }

  /**
   * Accepts the hyphenated form in any case, optionally prefixed with {@code urn:uuid:} or
   * wrapped in braces, and the 32-digit simple form.
   */
  public static UUID parseUuid(String raw) {
    String s = raw;
    if (s.regionMatches(true, 0, URN_PREFIX, 0, URN_PREFIX.length())) {
      s = s.substring(URN_PREFIX.length());
    } else if (s.length() == 38 && s.charAt(0) == '{' && s.charAt(37) == '}') {
      s = s.substring(1, 37);
    }
    if (s.length() == 32 && s.indexOf('-') < 0) {
      s = s.substring(0, 8) + "-" + s.substring(8, 12) + "-" + s.substring(12, 16) + "-"
          + s.substring(16, 20) + "-" + s.substring(20);
    }
    if (s.length() != 36
        || s.charAt(8) != '-' || s.charAt(13) != '-' || s.charAt(18) != '-' || s.charAt(23) != '-') {
      throw new IllegalArgumentException("Invalid UUID: " + raw);
    }
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c != '-' && Character.digit(c, 16) < 0) throw new IllegalArgumentException("Invalid UUID: " + raw);
    }
    return UUID.fromString(s);
  }

  public static String format(LocalDate value) {
    return DATE_FORMAT.format(value);
  }

  /** {@code YYYY-MM-DD HH:MM:SS}, followed by the fraction of a second only when non-zero. */
  public static String format(LocalDateTime value) {
    return DATE_TIME_FORMAT.format(value);
  }

  /** {@code YYYY-MM-DD HH:MM:SS ±HH:MM}. */
  public static String format(OffsetDateTime value) {
    return DATE_TIME_TZ_FORMAT.format(value);
  }

  /** Canonical lowercase hyphenated form. */
  public static String format(UUID value) {
    return value.toString();
  }
}
