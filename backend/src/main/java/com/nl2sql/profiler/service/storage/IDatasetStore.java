package com.nl2sql.profiler.service.storage;

import java.util.List;

import com.nl2sql.profiler.dto.profile.ColumnProfile;
import com.nl2sql.profiler.dto.profile.SchemaDocument;
import com.nl2sql.profiler.model.ColumnarTable;

/**
 * Persistence collaborator for profiled datasets. Both handoffs have create-or-replace semantics:
 * whatever was stored under the same table name before is fully superseded.
 */
public interface IDatasetStore {

  /**
   * Creates the table described by the schema and bulk-loads the rows.
   *
   * @param schema the synthesized schema, including the table name
   * @param table the optimized table whose columns line up with the schema columns
   * @param batchSize rows per insert batch
   */
  void replaceTable(SchemaDocument schema, ColumnarTable table, int batchSize);

  /**
   * Stores the column profiles of a table, replacing any earlier ones.
   *
   * @param tableName the synthesized table name
   * @param profiles the profiles in column order
   */
  void replaceProfiles(String tableName, List<ColumnProfile> profiles);

  /**
   * Loads the stored column profiles of a table.
   *
   * @param tableName the synthesized table name
   * @return the profiles in column order, empty if none are stored
   */
  List<ColumnProfile> findProfiles(String tableName);

  /**
   * Removes the table and its profiles. Missing data is not an error.
   *
   * @param tableName the synthesized table name
   */
  void dropDataset(String tableName);
}
