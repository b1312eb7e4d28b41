package com.nl2sql.profiler.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nl2sql.profiler.dto.profile.ColumnProfile.NumericStats;
import com.nl2sql.profiler.dto.profile.ColumnProfile.ValueCount;
import com.nl2sql.profiler.model.SemanticType;
import com.nl2sql.profiler.service.quality.SpecialPattern;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Statistics block computed for one column by the quality analyzer. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnQuality {

  @JsonProperty("column_name")
  String columnName;

  @JsonProperty("semantic_type")
  SemanticType semanticType;

  @JsonProperty("row_count")
  long rowCount;

  @JsonProperty("null_count")
  long nullCount;

  @JsonProperty("unique_count")
  long uniqueCount;

  @JsonProperty("numeric_stats")
  NumericStats numericStats;

  @JsonProperty("sample_values")
  List<String> sampleValues;

  @JsonProperty("top_values")
  List<ValueCount> topValues;

  @JsonProperty("enum_values")
  List<String> enumValues;

  @JsonProperty("special_pattern")
  SpecialPattern specialPattern;

  @JsonProperty("error")
  String error;

  public boolean isFailed() {
    return error != null;
  }
}
