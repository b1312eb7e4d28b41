package com.nl2sql.profiler.service.schema;

import static com.nl2sql.profiler.service.schema.IdentifierSanitizer.quote;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.dto.profile.SchemaDocument;
import com.nl2sql.profiler.dto.profile.SchemaDocument.SchemaColumn;
import com.nl2sql.profiler.exception.SchemaSynthesisException;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.ColumnarTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the CREATE TABLE statement for an optimized table. The output depends only on the file
 * name and the table's column order, names, types, bounds and null presence, so repeated runs give
 * byte-identical text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaSynthesizer {

  public static final String ROW_ID_COLUMN = "_row_id";
  public static final String CREATED_AT_COLUMN = "_created_at";

  private static final String INDENT = "    ";

  private final ProfilerProperties properties;
  private final IdentifierSanitizer identifierSanitizer;
  private final SqlTypeMapper sqlTypeMapper;

  public SchemaDocument synthesize(String fileName, ColumnarTable table) {
    if (table.getColumnCount() == 0) {
      throw new SchemaSynthesisException("Cannot create a table without columns");
    }
    String tableName =
        identifierSanitizer.sanitizeTable(fileName, properties.getSchema().getMaxTableNameLength());

    List<Column> columns = table.getColumns();
    List<String> sanitized = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      sanitized.add(identifierSanitizer.sanitizeColumn(columns.get(i).getName(), i + 1));
    }
    List<String> names = identifierSanitizer.deduplicate(sanitized);

    List<SchemaColumn> schemaColumns = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      Column column = columns.get(i);
      if (!column.isOptimized()) {
        throw new SchemaSynthesisException(
            "Column '" + column.getName() + "' was not type-optimized");
      }
      schemaColumns.add(
          SchemaColumn.builder()
              .sourceName(column.getName())
              .name(names.get(i))
              .sqlType(sqlTypeMapper.sqlType(column))
              .nullable(column.nullCount() > 0)
              .build());
    }

    String text = render(tableName, schemaColumns);
    log.info("Synthesized schema for table {} with {} columns", tableName, schemaColumns.size());
    return SchemaDocument.builder()
        .tableName(tableName)
        .columns(List.copyOf(schemaColumns))
        .text(text)
        .build();
  }

  private static String render(String tableName, List<SchemaColumn> columns) {
    StringBuilder sql = new StringBuilder();
    sql.append("CREATE TABLE ").append(quote(tableName)).append(" (\n");
    sql.append(INDENT)
        .append(quote(ROW_ID_COLUMN))
        .append(" BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n");
    for (SchemaColumn column : columns) {
      sql.append(INDENT).append(quote(column.getName())).append(' ').append(column.getSqlType());
      if (!column.isNullable()) {
        sql.append(" NOT NULL");
      }
      sql.append(",\n");
    }
    sql.append(INDENT)
        .append(quote(CREATED_AT_COLUMN))
        .append(" TIMESTAMP DEFAULT CURRENT_TIMESTAMP\n");
    sql.append(");");
    return sql.toString();
  }
}
