package com.nl2sql.profiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory dataset organized as named columns of equal length. Produced by the loader, typed in
 * place by the type optimizer and frozen before analysis; every later stage only reads it.
 */
public class ColumnarTable {

  private final List<Column> columns;
  private final int rowCount;

  public ColumnarTable(List<Column> columns) {
    if (columns == null || columns.isEmpty()) {
      throw new IllegalArgumentException("A table needs at least one column");
    }
    Set<String> names = new HashSet<>();
    int expectedRows = columns.get(0).size();
    for (Column column : columns) {
      if (!names.add(column.getName())) {
        throw new IllegalArgumentException("Duplicate column name: " + column.getName());
      }
      if (column.size() != expectedRows) {
        throw new IllegalArgumentException(
            String.format(
                "Column '%s' has %d rows, expected %d",
                column.getName(), column.size(), expectedRows));
      }
    }
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.rowCount = expectedRows;
  }

  public List<Column> getColumns() {
    return columns;
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public List<String> getColumnNames() {
    return columns.stream().map(Column::getName).toList();
  }

  public Optional<Column> findColumn(String name) {
    return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
  }

  /** Returns the values of one row in column order. */
  public List<Object> row(int index) {
    if (index < 0 || index >= rowCount) {
      throw new IndexOutOfBoundsException("Row " + index + " of " + rowCount);
    }
    List<Object> row = new ArrayList<>(columns.size());
    for (Column column : columns) {
      row.add(column.getValues().get(index));
    }
    return row;
  }

  /** Makes every column read-only. Called once type optimization has joined. */
  public void freeze() {
    columns.forEach(Column::freeze);
  }

  public boolean isOptimized() {
    return columns.stream().allMatch(Column::isOptimized);
  }
}
