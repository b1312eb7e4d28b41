package com.nl2sql.profiler.service.quality;

import java.util.regex.Pattern;

/** Recognised text sub-formats, in the order they are tested. Anchored at the start. */
public enum SpecialPattern {
  EMAIL("^[\\w.-]+@[\\w.-]+\\.\\w+$"),
  PHONE("^\\+?[\\d\\-()\\s]+$"),
  URL("^https?://"),
  JSON("^[{\\[].*[}\\]]$"),
  DATE("^\\d{4}-\\d{2}-\\d{2}"),
  CURRENCY("^[$£€¥]\\d+"),
  GEOLOCATION("^-?\\d+\\.\\d+,\\s*-?\\d+\\.\\d+$");

  private final Pattern pattern;

  SpecialPattern(String regex) {
    this.pattern = Pattern.compile(regex);
  }

  public boolean matches(String value) {
    return value != null && pattern.matcher(value).lookingAt();
  }
}
