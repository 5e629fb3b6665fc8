package me.christianrobert.synthdb.synthesis.model;

import me.christianrobert.synthdb.schema.model.TableMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows generated for one table. Column names and row values are in declaration order.
 */
public class GeneratedTable {

    private final TableMetadata table;
    private final List<String> columnNames;
    private final List<List<SqlValue>> rows;

    public GeneratedTable(TableMetadata table, List<String> columnNames, List<List<SqlValue>> rows) {
        this.table = table;
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        List<List<SqlValue>> copy = new ArrayList<>(rows.size());
        for (List<SqlValue> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public TableMetadata getTable() {
        return table;
    }

    public String getTableName() {
        return table.getTableName();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public List<List<SqlValue>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * Values of one column across all rows, in row order.
     */
    public List<SqlValue> columnValues(String columnName) {
        int index = -1;
        for (int i = 0; i < columnNames.size(); i++) {
            if (columnNames.get(i).equalsIgnoreCase(columnName)) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new IllegalArgumentException("Table " + getTableName() + " has no column " + columnName);
        }
        final int column = index;
        return rows.stream().map(row -> row.get(column)).toList();
    }
}
