package com.nl2sql.profiler.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** CREATE TABLE statement for a dataset together with the identifiers it assigned. */
@Value
@Builder
@Jacksonized
public class SchemaDocument {

  @JsonProperty("table_name")
  String tableName;

  @JsonProperty("columns")
  List<SchemaColumn> columns;

  @JsonProperty("text")
  String text;

  @JsonIgnore
  public List<String> getColumnNames() {
    return columns.stream().map(SchemaColumn::getName).toList();
  }

  @Value
  @Builder
  @Jacksonized
  public static class SchemaColumn {

    @JsonProperty("source_name")
    String sourceName;

    @JsonProperty("name")
    String name;

    @JsonProperty("sql_type")
    String sqlType;

    @JsonProperty("nullable")
    boolean nullable;
  }
}
