package com.nl2sql.profiler.service.loading;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.exception.DatasetLoadException;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.ColumnarTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a header row and raw records into a {@link ColumnarTable}. Null tokens become null, short
 * records are padded, records wider than the header are skipped and header names are made unique.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableAssembler {

  private final ProfilerProperties properties;

  public ColumnarTable assemble(String[] header, List<String[]> records, String fileName) {
    if (header == null || header.length == 0 || isBlankRecord(header)) {
      throw new DatasetLoadException("File has no header row: " + fileName);
    }

    List<String> names = uniqueHeaderNames(header);
    int width = names.size();
    Set<String> nullTokens = new HashSet<>(properties.getLoader().getNullTokens());

    List<List<Object>> columnValues = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      columnValues.add(new ArrayList<>(records.size()));
    }

    int skipped = 0;
    for (String[] record : records) {
      if (isBlankRecord(record)) {
        continue;
      }
      if (record.length > width) {
        log.debug("Skipping row with incorrect column count: {} vs {}", record.length, width);
        skipped++;
        continue;
      }
      for (int i = 0; i < width; i++) {
        String cell = i < record.length ? record[i] : null;
        columnValues.get(i).add(normalize(cell, nullTokens));
      }
    }

    if (columnValues.get(0).isEmpty()) {
      throw new DatasetLoadException("File contains no data rows: " + fileName);
    }
    if (skipped > 0) {
      log.warn("Skipped {} malformed rows while loading {}", skipped, fileName);
    }

    List<Column> columns = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      columns.add(new Column(names.get(i), columnValues.get(i)));
    }
    return new ColumnarTable(columns);
  }

  /** Blank headers become {@code Unnamed: <index>}; repeats get {@code .1}, {@code .2}, ... */
  static List<String> uniqueHeaderNames(String[] header) {
    List<String> names = new ArrayList<>(header.length);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < header.length; i++) {
      String name = header[i] == null ? "" : header[i].trim();
      if (name.isEmpty()) {
        name = "Unnamed: " + i;
      }
      String candidate = name;
      int suffix = 1;
      while (!seen.add(candidate)) {
        candidate = name + "." + suffix++;
      }
      names.add(candidate);
    }
    return names;
  }

  private static String normalize(String cell, Set<String> nullTokens) {
    if (cell == null) {
      return null;
    }
    return nullTokens.contains(cell.trim()) ? null : cell;
  }

  private static boolean isBlankRecord(String[] record) {
    for (String cell : record) {
      if (cell != null && !cell.isBlank()) {
        return false;
      }
    }
    return true;
  }
}
