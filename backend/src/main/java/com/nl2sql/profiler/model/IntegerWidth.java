package com.nl2sql.profiler.model;

/**
 * Storage width hint for integer columns. Unsigned tiers are preferred when the observed minimum is
 * non-negative.
 */
public enum IntegerWidth {
  UINT8(0, 255, "SMALLINT"),
  UINT16(0, 65_535, "INTEGER"),
  UINT32(0, 4_294_967_295L, "BIGINT"),
  INT8(Byte.MIN_VALUE, Byte.MAX_VALUE, "SMALLINT"),
  INT16(Short.MIN_VALUE, Short.MAX_VALUE, "SMALLINT"),
  INT32(Integer.MIN_VALUE, Integer.MAX_VALUE, "INTEGER"),
  INT64(Long.MIN_VALUE, Long.MAX_VALUE, "BIGINT");

  private final long min;
  private final long max;
  private final String sqlType;

  IntegerWidth(long min, long max, String sqlType) {
    this.min = min;
    this.max = max;
    this.sqlType = sqlType;
  }

  /** Smallest signed SQL integer type holding every value of this width. */
  public String getSqlType() {
    return sqlType;
  }

  public boolean covers(long observedMin, long observedMax) {
    return observedMin >= min && observedMax <= max;
  }

  public static IntegerWidth narrowest(long observedMin, long observedMax) {
    IntegerWidth[] candidates =
        observedMin >= 0
            ? new IntegerWidth[] {UINT8, UINT16, UINT32, INT64}
            : new IntegerWidth[] {INT8, INT16, INT32, INT64};
    for (IntegerWidth candidate : candidates) {
      if (candidate.covers(observedMin, observedMax)) {
        return candidate;
      }
    }
    return INT64;
  }
}
