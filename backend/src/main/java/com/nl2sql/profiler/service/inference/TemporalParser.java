package com.nl2sql.profiler.service.inference;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.cobber.fta.dates.DateTimeParser;
import com.cobber.fta.dates.DateTimeParser.DateResolutionMode;

import lombok.extern.slf4j.Slf4j;

/**
 * Lenient per-value date parsing. ISO layouts are tried first; anything else has its layout
 * detected by FTA and is then parsed with {@code java.time}. Values carrying an offset are
 * normalized to UTC. Plain numbers are never treated as dates.
 *
 * <p>Instances cache compiled formatters and are meant to be confined to one column task.
 */
@Slf4j
public class TemporalParser {

  private static final List<DateTimeFormatter> ISO_FORMATS =
      List.of(
          DateTimeFormatter.ISO_OFFSET_DATE_TIME,
          DateTimeFormatter.ISO_LOCAL_DATE_TIME,
          DateTimeFormatter.ISO_LOCAL_DATE,
          DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
          DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

  private final DateTimeParser formatDetector;
  private final Locale locale;
  private final Map<String, Optional<DateTimeFormatter>> formatters = new HashMap<>();

  public TemporalParser(Locale locale) {
    this.locale = locale;
    this.formatDetector =
        new DateTimeParser().withDateResolutionMode(DateResolutionMode.Auto).withLocale(locale);
  }

  public Optional<LocalDateTime> tryParse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    if (ValueParsers.isNumeric(value)) {
      return Optional.empty();
    }
    for (DateTimeFormatter format : ISO_FORMATS) {
      Optional<LocalDateTime> parsed = parseWith(format, value);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return detectFormat(value).flatMap(format -> parseWith(format, value));
  }

  private Optional<DateTimeFormatter> detectFormat(String value) {
    String layout;
    try {
      layout = formatDetector.determineFormatString(value);
    } catch (RuntimeException e) {
      log.trace("No date layout for '{}': {}", value, e.getMessage());
      return Optional.empty();
    }
    // '?' marks an unresolved day/month position
    if (layout == null || layout.indexOf('?') >= 0) {
      return Optional.empty();
    }
    return formatters.computeIfAbsent(layout, this::compile);
  }

  private Optional<DateTimeFormatter> compile(String layout) {
    try {
      return Optional.of(DateTimeFormatter.ofPattern(layout, locale));
    } catch (IllegalArgumentException e) {
      log.debug("Layout '{}' is not usable with java.time: {}", layout, e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<LocalDateTime> parseWith(DateTimeFormatter format, String value) {
    try {
      TemporalAccessor parsed =
          format.parseBest(
              value,
              ZonedDateTime::from,
              OffsetDateTime::from,
              LocalDateTime::from,
              LocalDate::from);
      if (parsed instanceof ZonedDateTime) {
        return Optional.of(
            ((ZonedDateTime) parsed).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
      }
      if (parsed instanceof OffsetDateTime) {
        return Optional.of(
            ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
      }
      if (parsed instanceof LocalDateTime) {
        return Optional.of((LocalDateTime) parsed);
      }
      return Optional.of(((LocalDate) parsed).atStartOfDay());
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }
}
