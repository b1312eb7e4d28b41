package com.nl2sql.profiler.service.enrichment;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.dto.profile.ColumnProfile;
import com.nl2sql.profiler.dto.profile.DatasetProfile;

/** Renders a profile as the plain-text dataset context given to the query generator. */
@Component
public class DatasetContextFormatter {

  private static final int TOP_VALUES_SHOWN = 3;

  public String format(DatasetProfile profile) {
    if (profile == null) {
      return "No dataset available";
    }
    StringBuilder context = new StringBuilder();
    context.append("Table: ").append(profile.getTableName()).append('\n');
    context
        .append(String.format(Locale.ROOT, "Total Rows: %,d", profile.getRowCount()))
        .append('\n');
    context.append("\nColumns:");
    for (ColumnProfile column : profile.getColumns()) {
      context.append('\n').append(columnLine(column));
    }
    if (profile.getQueryHints() != null && !profile.getQueryHints().isEmpty()) {
      context.append("\n\nHints:");
      profile
          .getQueryHints()
          .forEach((name, hint) -> context.append("\n  - ").append(name).append(": ").append(hint));
    }
    return context.toString();
  }

  private static String columnLine(ColumnProfile column) {
    StringBuilder line = new StringBuilder();
    line.append("  - ").append(column.getName());
    line.append(" (").append(column.getSqlType()).append(')');
    if (column.getSampleValues() != null && !column.getSampleValues().isEmpty()) {
      line.append(" - Examples: ").append(String.join(", ", column.getSampleValues()));
    }
    if (column.getTopValues() != null && !column.getTopValues().isEmpty()) {
      String top =
          column.getTopValues().stream()
              .limit(TOP_VALUES_SHOWN)
              .map(v -> v.getValue() + " (" + v.getCount() + ")")
              .collect(Collectors.joining(", "));
      line.append(" - Top values: ").append(top);
    }
    List<String> synonyms =
        column.getSynonymMappings() == null
            ? null
            : column.getSynonymMappings().get(column.getName());
    if (synonyms != null && !synonyms.isEmpty()) {
      line.append(" - Also called: ").append(String.join(", ", synonyms));
    }
    Map<String, String> mappings = column.getValueMappings();
    if (mappings != null && !mappings.isEmpty()) {
      String rendered =
          mappings.entrySet().stream()
              .map(e -> e.getKey() + "=" + e.getValue())
              .collect(Collectors.joining(", "));
      line.append(" - Value mappings: ").append(rendered);
    }
    return line.toString();
  }
}
