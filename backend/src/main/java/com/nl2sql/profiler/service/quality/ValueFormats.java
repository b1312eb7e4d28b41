package com.nl2sql.profiler.service.quality;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** String forms of typed cell values as they appear in profiles and generated prose. */
public final class ValueFormats {

  private ValueFormats() {}

  public static String display(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Double) {
      return number((Double) value);
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
    return value.toString();
  }

  /** Plain decimal notation without a trailing {@code .0} for whole numbers. */
  public static String number(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return String.valueOf(value);
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return String.valueOf((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
