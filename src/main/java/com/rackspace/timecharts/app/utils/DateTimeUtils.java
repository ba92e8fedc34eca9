package com.rackspace.timecharts.app.utils;

import com.rackspace.timecharts.app.errors.TimeframeParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAccessor;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.Optional;

public class DateTimeUtils {

  private static final DateTimeFormatter WIRE_SECONDS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");
  private static final DateTimeFormatter WIRE_MILLIS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS");
  private static final DateTimeFormatter WIRE_OFFSET = DateTimeFormatter.ofPattern("XXX");

  /**
   * Attaches a zone to a local date-time. A local time that occurs twice because clocks fall
   * back resolves to the zone's standard offset. A local time skipped because clocks spring
   * forward is shifted later by the length of the gap.
   */
  public static ZonedDateTime localize(LocalDateTime local, ZoneId zone) {
    final ZoneRules rules = zone.getRules();
    final List<ZoneOffset> offsets = rules.getValidOffsets(local);
    if (offsets.size() > 1) {
      final ZonedDateTime earlier = ZonedDateTime.ofLocal(local, zone, offsets.get(0));
      final ZoneOffset standard = rules.getStandardOffset(earlier.toInstant());
      return offsets.contains(standard) ? ZonedDateTime.ofLocal(local, zone, standard) : earlier;
    }
    return ZonedDateTime.ofLocal(local, zone, null);
  }

  /**
   * Converts any supported temporal into a zoned date-time. Values that already carry a zone or
   * offset keep it; dates and local date-times are localized into <code>zone</code>.
   */
  public static ZonedDateTime coerceToZoned(Temporal temporal, ZoneId zone) {
    if (temporal instanceof ZonedDateTime) {
      return (ZonedDateTime) temporal;
    } else if (temporal instanceof OffsetDateTime) {
      return ((OffsetDateTime) temporal).toZonedDateTime();
    } else if (temporal instanceof Instant) {
      return ((Instant) temporal).atZone(zone);
    } else if (temporal instanceof LocalDateTime) {
      return localize((LocalDateTime) temporal, zone);
    } else if (temporal instanceof LocalDate) {
      return localize(((LocalDate) temporal).atStartOfDay(), zone);
    }
    throw new IllegalArgumentException("Unsupported temporal type: " + temporal.getClass());
  }

  /**
   * Parses a literal date or date-time using the first of <code>formats</code> that accepts it.
   */
  public static ZonedDateTime parseDate(String text, List<String> formats, ZoneId zone) {
    for (String format : formats) {
      final Optional<ZonedDateTime> parsed = tryParse(text, format, zone);
      if (parsed.isPresent()) {
        return parsed.get();
      }
    }
    throw new TimeframeParseException("Unresolvable date: " + text);
  }

  private static Optional<ZonedDateTime> tryParse(String text, String format, ZoneId zone) {
    try {
      final TemporalAccessor parsed = strictFormatter(format)
          .parseBest(text, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
      return Optional.of(coerceToZoned((Temporal) parsed, zone));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  /**
   * Rejects impossible dates, such as February 30th, rather than clamping them. Strict
   * resolution needs a proleptic year, so the year-of-era letter <code>y</code> outside quoted
   * literals is read as <code>u</code>.
   */
  static DateTimeFormatter strictFormatter(String format) {
    final StringBuilder pattern = new StringBuilder(format.length());
    boolean quoted = false;
    for (char c : format.toCharArray()) {
      if (c == '\'') {
        quoted = !quoted;
      }
      pattern.append(!quoted && c == 'y' ? 'u' : c);
    }
    return DateTimeFormatter.ofPattern(pattern.toString())
        .withResolverStyle(ResolverStyle.STRICT);
  }

  /**
   * Formats a date-time for the wire: ISO-8601, fractional seconds trimmed to milliseconds and
   * only written when non-zero, a zero offset written as <code>Z</code>.
   */
  public static String formatTimestamp(ZonedDateTime timestamp) {
    final ZonedDateTime truncated = timestamp.truncatedTo(ChronoUnit.MILLIS);
    final DateTimeFormatter local = truncated.getNano() == 0 ? WIRE_SECONDS : WIRE_MILLIS;
    return local.format(truncated) + WIRE_OFFSET.format(truncated);
  }

  /**
   * Formats a duration as a plain count of seconds, such as <code>3600.0</code>.
   */
  public static String formatDuration(Duration duration) {
    return String.valueOf(duration.toMillis() / 1000.0);
  }
}
