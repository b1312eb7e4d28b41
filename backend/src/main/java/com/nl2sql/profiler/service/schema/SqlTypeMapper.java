package com.nl2sql.profiler.service.schema;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.exception.SchemaSynthesisException;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.IntegerWidth;
import com.nl2sql.profiler.model.SemanticType;

/**
 * Maps a semantic type to a column type of the relational target. Integer columns follow the
 * storage width decided by the type optimizer; text columns are sized from the longest value.
 */
@Component
public class SqlTypeMapper {

  private static final int[][] VARCHAR_LADDER = {{5, 20}, {20, 50}, {100, 200}, {500, 1000}};
  private static final int VARCHAR_MAX = 5000;

  public String sqlType(Column column) {
    SemanticType type = column.getSemanticType();
    if (type == null) {
      throw new SchemaSynthesisException(
          "Column '" + column.getName() + "' has no semantic type");
    }
    switch (type) {
      case INTEGER:
        return integerType(column);
      case FLOAT:
        return "DOUBLE PRECISION";
      case BOOLEAN:
        return "BOOLEAN";
      case DATE:
        return "TIMESTAMP";
      case TEXT:
        return "VARCHAR(" + varcharLength(maxLength(column)) + ")";
      default:
        throw new SchemaSynthesisException("Unmapped semantic type " + type);
    }
  }

  static int varcharLength(int maxLength) {
    for (int[] rung : VARCHAR_LADDER) {
      if (maxLength <= rung[0]) {
        return rung[1];
      }
    }
    return VARCHAR_MAX;
  }

  private static String integerType(Column column) {
    IntegerWidth width = column.getIntegerWidth();
    return width == null ? IntegerWidth.INT64.getSqlType() : width.getSqlType();
  }

  private static int maxLength(Column column) {
    int max = 0;
    for (Object value : column.getValues()) {
      if (value != null) {
        max = Math.max(max, value.toString().length());
      }
    }
    return max;
  }
}
