package com.nl2sql.profiler.service.inference;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/** Explicit parse attempts used by the type heuristics. None of them throw on bad input. */
public final class ValueParsers {

  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private static final Map<String, Boolean> BOOLEAN_WORDS =
      Map.of(
          "true", true, "false", false,
          "1", true, "0", false,
          "yes", true, "no", false,
          "y", true, "n", false);

  private ValueParsers() {}

  public static Optional<Long> tryParseLong(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String value = raw.trim();
    if (!INTEGER.matcher(value).matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(value));
    } catch (NumberFormatException overflow) {
      return Optional.empty();
    }
  }

  public static Optional<Double> tryParseDouble(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String value = raw.trim();
    if (!DECIMAL.matcher(value).matches()) {
      return Optional.empty();
    }
    double parsed = Double.parseDouble(value);
    return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
  }

  public static boolean isNumeric(String raw) {
    return raw != null && DECIMAL.matcher(raw.trim()).matches();
  }

  /** Maps one of the recognised boolean spellings to its value. */
  public static Optional<Boolean> tryParseBoolean(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BOOLEAN_WORDS.get(raw.trim().toLowerCase(Locale.ROOT)));
  }
}
