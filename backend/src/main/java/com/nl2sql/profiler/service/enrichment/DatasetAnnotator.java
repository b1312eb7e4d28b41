package com.nl2sql.profiler.service.enrichment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.dto.profile.ColumnProfile;
import com.nl2sql.profiler.dto.profile.ColumnProfile.NumericStats;
import com.nl2sql.profiler.model.SemanticType;

/** Table-level hints for the query generator: example statements, per-column hints, a summary. */
@Component
public class DatasetAnnotator {

  public List<String> exampleQueries(String tableName, List<ColumnProfile> columns) {
    List<String> examples = new ArrayList<>();
    examples.add(String.format("SELECT COUNT(*) FROM %s", tableName));

    Optional<ColumnProfile> categorical =
        columns.stream()
            .filter(c -> c.isCategorical() && c.getSemanticType() == SemanticType.TEXT)
            .filter(c -> c.getTopValues() != null && !c.getTopValues().isEmpty())
            .findFirst();
    Optional<ColumnProfile> numeric =
        columns.stream()
            .filter(c -> c.getSemanticType().isNumeric() && !c.isCategorical())
            .findFirst();
    Optional<ColumnProfile> bool =
        columns.stream().filter(c -> c.getSemanticType() == SemanticType.BOOLEAN).findFirst();

    categorical.ifPresent(
        col -> {
          String topValue = quote(col.getTopValues().get(0).getValue());
          examples.add(
              String.format(
                  "SELECT * FROM %s WHERE %s = '%s'", tableName, col.getName(), topValue));
          examples.add(
              String.format(
                  "SELECT %s, COUNT(*) FROM %s GROUP BY %s",
                  col.getName(), tableName, col.getName()));
        });

    numeric.ifPresent(
        col -> {
          examples.add(String.format("SELECT AVG(%s) FROM %s", col.getName(), tableName));
          examples.add(
              String.format(
                  "SELECT MAX(%s), MIN(%s) FROM %s", col.getName(), col.getName(), tableName));
          NumericStats stats = col.getNumericStats();
          if (stats != null && stats.getMin() != null && stats.getMax() != null) {
            double midpoint = (stats.getMin() + stats.getMax()) / 2;
            examples.add(
                String.format(
                    Locale.ROOT,
                    "SELECT * FROM %s WHERE %s > %.1f",
                    tableName,
                    col.getName(),
                    midpoint));
          }
        });

    bool.ifPresent(
        col -> {
          examples.add(
              String.format(
                  "SELECT COUNT(*) FROM %s WHERE %s = TRUE", tableName, col.getName()));
          examples.add(
              String.format(
                  "SELECT COUNT(*) FROM %s WHERE %s = FALSE", tableName, col.getName()));
        });

    if (categorical.isPresent() && numeric.isPresent()) {
      ColumnProfile cat = categorical.get();
      examples.add(
          String.format(
              "SELECT AVG(%s) FROM %s WHERE %s = '%s'",
              numeric.get().getName(),
              tableName,
              cat.getName(),
              quote(cat.getTopValues().get(0).getValue())));
    }
    return List.copyOf(examples);
  }

  public Map<String, String> queryHints(List<ColumnProfile> columns) {
    Map<String, String> hints = new LinkedHashMap<>();
    for (ColumnProfile col : columns) {
      NumericStats stats = col.getNumericStats();
      if (col.getSemanticType() == SemanticType.BOOLEAN) {
        hints.put(col.getName(), "Use TRUE/FALSE for boolean queries");
      } else if (col.isCategorical()
          && col.getValueMappings() != null
          && !col.getValueMappings().isEmpty()) {
        hints.put(col.getName(), "Has value mappings - check value_mappings field");
      } else if (col.getSemanticType() == SemanticType.DATE) {
        hints.put(col.getName(), "Timestamp column - compare with DATE 'yyyy-MM-dd' literals");
      } else if (stats != null && stats.getMin() != null && stats.getMax() != null) {
        hints.put(
            col.getName(),
            String.format(
                Locale.ROOT, "Numeric range: %.1f to %.1f", stats.getMin(), stats.getMax()));
      }
    }
    return Collections.unmodifiableMap(hints);
  }

  public String schemaSummary(List<ColumnProfile> columns) {
    StringBuilder summary = new StringBuilder();
    summary.append("Table has ").append(columns.size()).append(" columns:\n");
    for (ColumnProfile col : columns) {
      summary.append(
          String.format(
              "- %s (%s): %s", col.getName(), col.getSqlType(), col.getDescription()));
      if (col.isCategorical() && col.getEnumValues() != null) {
        List<String> shown = col.getEnumValues().stream().limit(10).toList();
        summary.append(" [Categories: ").append(String.join(", ", shown)).append(']');
      }
      summary.append('\n');
    }
    return summary.toString();
  }

  private static String quote(String value) {
    return value == null ? "" : value.replace("'", "''");
  }
}
