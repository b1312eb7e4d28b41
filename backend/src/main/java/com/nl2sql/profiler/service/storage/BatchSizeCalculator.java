package com.nl2sql.profiler.service.storage;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.ColumnarTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rows per persistence chunk: {@code min(max, max(min, available * fraction / rowBytes))}. Only
 * bounds peak memory while streaming rows out; it never changes the profile.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchSizeCalculator {

  private static final int OBJECT_OVERHEAD = 16;
  private static final int STRING_OVERHEAD = 40;

  private final ProfilerProperties properties;
  private final MemoryProbe memoryProbe;

  public int batchSize(ColumnarTable table) {
    return batchSize(memoryProbe.availableBytes(), estimateRowBytes(table));
  }

  public int batchSize(long availableBytes, double rowBytes) {
    ProfilerProperties.Batch batch = properties.getBatch();
    double perRow = Math.max(1.0, rowBytes);
    double fitting = Math.max(0, availableBytes) * batch.getMemoryFraction() / perRow;
    int size = (int) Math.min(batch.getMaxRows(), Math.max(batch.getMinRows(), fitting));
    log.debug(
        "Batch size {} for {} available bytes at {} bytes per row", size, availableBytes, perRow);
    return size;
  }

  /** Approximate heap bytes of one row of the optimized table. */
  public double estimateRowBytes(ColumnarTable table) {
    if (table.getRowCount() == 0) {
      return 1.0;
    }
    double total = 0;
    for (Column column : table.getColumns()) {
      total += estimateColumnBytes(column);
    }
    return Math.max(1.0, total / table.getRowCount());
  }

  private static double estimateColumnBytes(Column column) {
    double bytes = 0;
    for (Object value : column.getValues()) {
      if (value == null) {
        bytes += 8;
      } else if (value instanceof String) {
        bytes += STRING_OVERHEAD + 2.0 * ((String) value).length();
      } else if (value instanceof Boolean) {
        bytes += 8;
      } else {
        bytes += OBJECT_OVERHEAD + 8;
      }
    }
    return bytes;
  }
}
