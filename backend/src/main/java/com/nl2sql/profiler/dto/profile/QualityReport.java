package com.nl2sql.profiler.dto.profile;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Dataset-wide quality report, keyed by the column names found in the source file. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QualityReport {

  @JsonProperty("row_count")
  long rowCount;

  @JsonProperty("estimated_size_bytes")
  long estimatedSizeBytes;

  @JsonProperty("column_stats")
  Map<String, ColumnQuality> columnStats;

  /** Pairwise Pearson coefficients between numeric columns; null with fewer than two. */
  @JsonProperty("correlations")
  Map<String, Map<String, Double>> correlations;

  @JsonProperty("failed_columns")
  List<String> failedColumns;

  @JsonProperty("warnings")
  Map<String, List<String>> warnings;
}
