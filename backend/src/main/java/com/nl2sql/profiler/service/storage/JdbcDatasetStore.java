package com.nl2sql.profiler.service.storage;

import static com.nl2sql.profiler.service.schema.IdentifierSanitizer.quote;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.dto.profile.ColumnProfile;
import com.nl2sql.profiler.dto.profile.SchemaDocument;
import com.nl2sql.profiler.exception.DatasetStoreException;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.ColumnarTable;
import com.nl2sql.profiler.model.SemanticType;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * JDBC implementation of {@link IDatasetStore}, H2 in-memory by default. Rows are loaded into a
 * staging table in batches and swapped in only after the last batch commits, so a failed load
 * leaves the previous dataset untouched. Profiles are stored as JSON documents, one row per column.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcDatasetStore implements IDatasetStore {

  static final String PROFILE_TABLE = "column_profiles";
  private static final String STAGING_SUFFIX = "__staging";

  private final ProfilerProperties properties;
  private final ObjectMapper objectMapper;

  @PostConstruct
  public void init() {
    try (Connection conn = connect();
        Statement statement = conn.createStatement()) {
      statement.execute(
          "CREATE TABLE IF NOT EXISTS "
              + PROFILE_TABLE
              + " (table_name VARCHAR(128) NOT NULL, position INT NOT NULL,"
              + " column_name VARCHAR(128) NOT NULL, profile_json CLOB NOT NULL,"
              + " PRIMARY KEY (table_name, position))");
    } catch (SQLException e) {
      throw new DatasetStoreException("Could not initialize profile table", e);
    }
  }

  @Override
  public void replaceTable(SchemaDocument schema, ColumnarTable table, int batchSize) {
    String tableName = schema.getTableName();
    String staging = tableName + STAGING_SUFFIX;
    List<SchemaDocument.SchemaColumn> schemaColumns = schema.getColumns();
    if (schemaColumns.size() != table.getColumnCount()) {
      throw new DatasetStoreException(
          "Schema of " + tableName + " does not match the table's columns", null);
    }

    try (Connection conn = connect()) {
      try (Statement statement = conn.createStatement()) {
        statement.execute("DROP TABLE IF EXISTS " + quote(staging));
        statement.execute(stagingDdl(schema, staging));
      }

      int rows = insertRows(conn, staging, schemaColumns, table, batchSize);

      conn.setAutoCommit(false);
      try (Statement statement = conn.createStatement()) {
        statement.execute("DROP TABLE IF EXISTS " + quote(tableName));
        statement.execute("ALTER TABLE " + quote(staging) + " RENAME TO " + quote(tableName));
        conn.commit();
      }
      log.info("Stored {} rows in table {} (batch size {})", rows, tableName, batchSize);
    } catch (SQLException e) {
      dropQuietly(staging);
      throw new DatasetStoreException("Failed to store rows of " + tableName, e);
    }
  }

  @Override
  public void replaceProfiles(String tableName, List<ColumnProfile> profiles) {
    try (Connection conn = connect()) {
      conn.setAutoCommit(false);
      try (PreparedStatement delete =
              conn.prepareStatement("DELETE FROM " + PROFILE_TABLE + " WHERE table_name = ?");
          PreparedStatement insert =
              conn.prepareStatement(
                  "INSERT INTO "
                      + PROFILE_TABLE
                      + " (table_name, position, column_name, profile_json) VALUES (?, ?, ?, ?)")) {
        delete.setString(1, tableName);
        delete.executeUpdate();
        for (int i = 0; i < profiles.size(); i++) {
          ColumnProfile profile = profiles.get(i);
          insert.setString(1, tableName);
          insert.setInt(2, i);
          insert.setString(3, profile.getName());
          insert.setString(4, objectMapper.writeValueAsString(profile));
          insert.addBatch();
        }
        insert.executeBatch();
        conn.commit();
      } catch (SQLException | JsonProcessingException e) {
        conn.rollback();
        throw e;
      }
      log.info("Stored {} column profiles for table {}", profiles.size(), tableName);
    } catch (SQLException | JsonProcessingException e) {
      throw new DatasetStoreException("Failed to store profiles of " + tableName, e);
    }
  }

  @Override
  public List<ColumnProfile> findProfiles(String tableName) {
    List<ColumnProfile> profiles = new ArrayList<>();
    try (Connection conn = connect();
        PreparedStatement query =
            conn.prepareStatement(
                "SELECT profile_json FROM "
                    + PROFILE_TABLE
                    + " WHERE table_name = ? ORDER BY position")) {
      query.setString(1, tableName);
      try (ResultSet rs = query.executeQuery()) {
        while (rs.next()) {
          profiles.add(objectMapper.readValue(rs.getString(1), ColumnProfile.class));
        }
      }
    } catch (SQLException | JsonProcessingException e) {
      throw new DatasetStoreException("Failed to read profiles of " + tableName, e);
    }
    return profiles;
  }

  @Override
  public void dropDataset(String tableName) {
    try (Connection conn = connect()) {
      conn.setAutoCommit(false);
      try (Statement statement = conn.createStatement();
          PreparedStatement delete =
              conn.prepareStatement("DELETE FROM " + PROFILE_TABLE + " WHERE table_name = ?")) {
        delete.setString(1, tableName);
        delete.executeUpdate();
        conn.commit();
        statement.execute("DROP TABLE IF EXISTS " + quote(tableName));
        statement.execute("DROP TABLE IF EXISTS " + quote(tableName + STAGING_SUFFIX));
      }
      log.info("Dropped dataset {}", tableName);
    } catch (SQLException e) {
      throw new DatasetStoreException("Failed to drop dataset " + tableName, e);
    }
  }

  private int insertRows(
      Connection conn,
      String staging,
      List<SchemaDocument.SchemaColumn> schemaColumns,
      ColumnarTable table,
      int batchSize)
      throws SQLException {
    String sql = insertSql(staging, schemaColumns);
    List<Column> columns = table.getColumns();
    conn.setAutoCommit(false);
    int pending = 0;
    try (PreparedStatement insert = conn.prepareStatement(sql)) {
      for (int row = 0; row < table.getRowCount(); row++) {
        for (int c = 0; c < columns.size(); c++) {
          Column column = columns.get(c);
          bind(insert, c + 1, column.getSemanticType(), column.getValues().get(row));
        }
        insert.addBatch();
        if (++pending >= batchSize) {
          insert.executeBatch();
          conn.commit();
          pending = 0;
        }
      }
      if (pending > 0) {
        insert.executeBatch();
      }
      conn.commit();
    } catch (SQLException e) {
      conn.rollback();
      throw e;
    } finally {
      conn.setAutoCommit(true);
    }
    return table.getRowCount();
  }

  static String insertSql(String tableName, List<SchemaDocument.SchemaColumn> columns) {
    StringBuilder names = new StringBuilder();
    StringBuilder placeholders = new StringBuilder();
    for (SchemaDocument.SchemaColumn column : columns) {
      if (names.length() > 0) {
        names.append(", ");
        placeholders.append(", ");
      }
      names.append(quote(column.getName()));
      placeholders.append('?');
    }
    return "INSERT INTO " + quote(tableName) + " (" + names + ") VALUES (" + placeholders + ")";
  }

  private static String stagingDdl(SchemaDocument schema, String staging) {
    String header = "CREATE TABLE " + quote(schema.getTableName()) + " (";
    if (!schema.getText().startsWith(header)) {
      throw new IllegalArgumentException("Unexpected schema text for " + schema.getTableName());
    }
    String stagingHeader = "CREATE TABLE " + quote(staging) + " (";
    String ddl =
        schema
            .getText()
            .replaceFirst(Pattern.quote(header), Matcher.quoteReplacement(stagingHeader));
    return ddl.endsWith(";") ? ddl.substring(0, ddl.length() - 1) : ddl;
  }

  private static void bind(PreparedStatement statement, int index, SemanticType type, Object value)
      throws SQLException {
    switch (type) {
      case INTEGER:
        if (value == null) {
          statement.setNull(index, Types.BIGINT);
        } else {
          statement.setLong(index, (Long) value);
        }
        break;
      case FLOAT:
        if (value == null) {
          statement.setNull(index, Types.DOUBLE);
        } else {
          statement.setDouble(index, (Double) value);
        }
        break;
      case BOOLEAN:
        if (value == null) {
          statement.setNull(index, Types.BOOLEAN);
        } else {
          statement.setBoolean(index, (Boolean) value);
        }
        break;
      case DATE:
        if (value == null) {
          statement.setNull(index, Types.TIMESTAMP);
        } else {
          statement.setTimestamp(index, Timestamp.valueOf((LocalDateTime) value));
        }
        break;
      default:
        if (value == null) {
          statement.setNull(index, Types.VARCHAR);
        } else {
          statement.setString(index, value.toString());
        }
    }
  }

  private void dropQuietly(String tableName) {
    try (Connection conn = connect();
        Statement statement = conn.createStatement()) {
      statement.execute("DROP TABLE IF EXISTS " + quote(tableName));
    } catch (SQLException e) {
      log.warn("Could not drop staging table {}: {}", tableName, e.getMessage());
    }
  }

  Connection connect() throws SQLException {
    ProfilerProperties.Storage storage = properties.getStorage();
    return DriverManager.getConnection(
        storage.getUrl(), storage.getUsername(), storage.getPassword());
  }
}
