package me.christianrobert.synthdb.schema.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A table of the schema description: ordered columns plus foreign-key edges.
 * Immutable once constructed.
 */
public class TableMetadata {
  private final String schema; // may be null for file-based descriptions
  private final String tableName;
  private final List<ColumnMetadata> columns;
  private final List<ForeignKeyMetadata> foreignKeys;

  public TableMetadata(String schema, String tableName,
                       List<ColumnMetadata> columns, List<ForeignKeyMetadata> foreignKeys) {
    this.schema = schema;
    this.tableName = tableName;
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.foreignKeys = Collections.unmodifiableList(new ArrayList<>(foreignKeys));
  }

  public TableMetadata(String tableName, List<ColumnMetadata> columns, List<ForeignKeyMetadata> foreignKeys) {
    this(null, tableName, columns, foreignKeys);
  }

  // Getters
  public String getSchema() { return schema; }
  public String getTableName() { return tableName; }
  public List<ColumnMetadata> getColumns() { return columns; }
  public List<ForeignKeyMetadata> getForeignKeys() { return foreignKeys; }

  public String getQualifiedName() {
    return schema == null || schema.isEmpty() ? tableName : schema + "." + tableName;
  }

  public Optional<ColumnMetadata> findColumn(String columnName) {
    return columns.stream()
        .filter(c -> c.getColumnName().equalsIgnoreCase(columnName))
        .findFirst();
  }

  /**
   * Returns the foreign key owned by the given column, if the column participates in one.
   */
  public Optional<ForeignKeyMetadata> findForeignKey(String columnName) {
    return foreignKeys.stream()
        .filter(fk -> fk.getColumnName().equalsIgnoreCase(columnName))
        .findFirst();
  }

  @Override
  public String toString() {
    return "TableMetadata{schema='" + schema + "', tableName='" + tableName + "', columns=" + columns.size()
        + ", foreignKeys=" + foreignKeys.size() + "}";
  }
}
