package com.nl2sql.profiler.service.loading;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.nl2sql.profiler.config.CoreConfig;
import com.nl2sql.profiler.config.ProfilerProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses large delimited text in parallel. The text is cut into partitions at record boundaries
 * that lie outside quoted fields, each partition is parsed on the worker pool and the results are
 * concatenated in order. Any failure propagates so the caller can retry with a single pass.
 */
@Slf4j
@Component
public class PartitionedCsvParser {

  private final ProfilerProperties properties;
  private final Executor executor;

  public PartitionedCsvParser(
      ProfilerProperties properties, @Qualifier(CoreConfig.COLUMN_EXECUTOR) Executor executor) {
    this.properties = properties;
    this.executor = executor;
  }

  public List<String[]> parse(String text, char delimiter) {
    List<String> partitions = split(text, partitionCount());
    log.debug("Parsing {} characters in {} partitions", text.length(), partitions.size());

    List<CompletableFuture<List<String[]>>> futures = new ArrayList<>(partitions.size());
    for (int i = 0; i < partitions.size(); i++) {
      String partition = partitions.get(i);
      String label = "partition " + i;
      futures.add(
          CompletableFuture.supplyAsync(
              () -> DelimitedTextLoader.parse(partition, delimiter, label), executor));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    List<String[]> records = new ArrayList<>();
    for (CompletableFuture<List<String[]>> future : futures) {
      records.addAll(future.join());
    }
    return records;
  }

  /**
   * Splits text into roughly equal parts. Each cut is moved forward to the next newline that is
   * not inside a quoted field, so no record spans two parts.
   */
  static List<String> split(String text, int partitionCount) {
    List<String> parts = new ArrayList<>();
    if (partitionCount <= 1 || text.isEmpty()) {
      parts.add(text);
      return parts;
    }
    int target = Math.max(1, text.length() / partitionCount);
    int start = 0;
    int nextCut = target;
    boolean inQuotes = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"') {
        inQuotes = !inQuotes;
      } else if (c == '\n' && !inQuotes && i >= nextCut) {
        parts.add(text.substring(start, i + 1));
        start = i + 1;
        nextCut = start + target;
      }
    }
    if (start < text.length()) {
      parts.add(text.substring(start));
    }
    return parts;
  }

  private int partitionCount() {
    int configured = properties.getLoader().getPartitions();
    return configured > 0 ? configured : Runtime.getRuntime().availableProcessors();
  }
}
