package me.christianrobert.synthdb.schema.model;

/**
 * A single-column foreign-key edge: owning column → referenced table.column.
 * The referenced table is expected to be part of the schema, but unresolved
 * and self-referencing edges are tolerated by the generator.
 *
 * Columns of a composite foreign key are separate edges sharing one constraint name.
 */
public class ForeignKeyMetadata {
  private final String columnName;
  private final String referencedTable;
  private final String referencedColumn;
  private final String constraintName; // null when the key stands alone

  public ForeignKeyMetadata(String columnName, String referencedTable, String referencedColumn) {
    this(columnName, referencedTable, referencedColumn, null);
  }

  public ForeignKeyMetadata(String columnName, String referencedTable, String referencedColumn,
                            String constraintName) {
    this.columnName = columnName;
    this.referencedTable = referencedTable;
    this.referencedColumn = referencedColumn;
    this.constraintName = constraintName;
  }

  public String getColumnName() { return columnName; }
  public String getReferencedTable() { return referencedTable; }
  public String getReferencedColumn() { return referencedColumn; }
  public String getConstraintName() { return constraintName; }

  public boolean isSelfReference(String owningTable) {
    return owningTable != null && referencedTable != null && owningTable.equalsIgnoreCase(referencedTable);
  }

  @Override
  public String toString() {
    return "ForeignKeyMetadata{column='" + columnName + "', references='" + referencedTable + "." + referencedColumn
        + "'" + (constraintName != null ? ", constraint='" + constraintName + "'" : "") + "}";
  }
}
