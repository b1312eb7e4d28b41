package com.nl2sql.profiler.dto.profile;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Result of one profiling run. Read-only context for the natural-language query side. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DatasetProfile {

  @JsonProperty("table_name")
  String tableName;

  @JsonProperty("source_file_name")
  String sourceFileName;

  @JsonProperty("row_count")
  long rowCount;

  @JsonProperty("column_count")
  int columnCount;

  @JsonProperty("columns")
  List<ColumnProfile> columns;

  @JsonProperty("quality_report")
  QualityReport qualityReport;

  @JsonProperty("schema")
  SchemaDocument schema;

  @JsonProperty("example_queries")
  List<String> exampleQueries;

  @JsonProperty("query_hints")
  Map<String, String> queryHints;

  @JsonProperty("schema_summary")
  String schemaSummary;

  @JsonProperty("batch_size")
  int batchSize;

  @JsonProperty("profiled_at")
  LocalDateTime profiledAt;
}
