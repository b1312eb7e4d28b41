package com.nl2sql.profiler.dto.profile;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nl2sql.profiler.model.IntegerWidth;
import com.nl2sql.profiler.model.SemanticType;
import com.nl2sql.profiler.service.quality.SpecialPattern;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Profile of a single column: its decided type, statistics, SQL mapping and natural-language
 * annotations. Immutable; annotations are added by building a modified copy.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnProfile {

  @JsonProperty("name")
  String name;

  @JsonProperty("original_name")
  String originalName;

  @JsonProperty("semantic_type")
  SemanticType semanticType;

  @JsonProperty("sql_type")
  String sqlType;

  @JsonProperty("storage_width")
  IntegerWidth storageWidth;

  @JsonProperty("nullable")
  boolean nullable;

  @JsonProperty("categorical")
  boolean categorical;

  @JsonProperty("unique_count")
  long uniqueCount;

  @JsonProperty("null_count")
  long nullCount;

  @JsonProperty("numeric_stats")
  NumericStats numericStats;

  @JsonProperty("sample_values")
  List<String> sampleValues;

  @JsonProperty("top_values")
  List<ValueCount> topValues;

  @JsonProperty("enum_values")
  List<String> enumValues;

  @JsonProperty("value_mappings")
  Map<String, String> valueMappings;

  @JsonProperty("synonym_mappings")
  Map<String, List<String>> synonymMappings;

  @JsonProperty("example_queries")
  List<String> exampleQueries;

  @JsonProperty("description")
  String description;

  @JsonProperty("special_pattern")
  SpecialPattern specialPattern;

  @JsonProperty("analysis_error")
  String analysisError;

  @Value
  @Builder
  @Jacksonized
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class NumericStats {

    @JsonProperty("min")
    Double min;

    @JsonProperty("max")
    Double max;

    @JsonProperty("mean")
    Double mean;

    @JsonProperty("median")
    Double median;

    @JsonProperty("std_dev")
    Double stdDev;

    @JsonProperty("outlier_count")
    int outlierCount;
  }

  @Value
  @Builder
  @Jacksonized
  public static class ValueCount {

    @JsonProperty("value")
    String value;

    @JsonProperty("count")
    long count;
  }
}
