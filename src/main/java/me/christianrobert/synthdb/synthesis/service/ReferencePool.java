package me.christianrobert.synthdb.synthesis.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Rows generated so far, per table, holding the values of every column some foreign key
 * points at. Foreign keys are drawn from here.
 *
 * Each table has a key column (its primary key); lookups without a column, or for a column
 * that was never recorded, read the key column. Tables and columns are keyed
 * case-insensitively. Rows are only ever appended; each table's pool is filled by that
 * table's own generation and read by every table generated after it.
 * Not thread-safe: a generation run is single-threaded.
 */
public class ReferencePool {

    private static final String UNNAMED_KEY = "";

    private final Map<String, TableRows> rowsByTable = new HashMap<>();

    /**
     * Records one generated row.
     *
     * @param table     the table the row belongs to
     * @param keyColumn the table's key column, may be null when it has none
     * @param values    recorded column values by column name; values may be null
     */
    public void addRow(String table, String keyColumn, Map<String, String> values) {
        Map<String, String> row = new HashMap<>();
        values.forEach((column, value) -> row.put(normalize(column), value));
        TableRows rows = rowsByTable.computeIfAbsent(normalize(table), k -> new TableRows());
        if (rows.keyColumn == null && keyColumn != null) {
            rows.keyColumn = normalize(keyColumn);
        }
        rows.rows.add(row);
        row.forEach((column, value) -> {
            List<String> columnValues = rows.valuesByColumn.computeIfAbsent(column, k -> new ArrayList<>());
            if (value != null) {
                columnValues.add(value);
            }
        });
    }

    /** Records a row holding only a key value; null values are ignored. */
    public void add(String table, String keyValue) {
        if (keyValue == null) {
            return;
        }
        addRow(table, UNNAMED_KEY, Map.of(UNNAMED_KEY, keyValue));
    }

    /** Non-null values of the table's key column, in generation order. */
    public List<String> values(String table) {
        return values(table, null);
    }

    /** Non-null values of one column, in generation order. */
    public List<String> values(String table, String column) {
        TableRows rows = rowsByTable.get(normalize(table));
        if (rows == null) {
            return Collections.emptyList();
        }
        List<String> values = rows.valuesByColumn.get(rows.resolve(column));
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    /** Number of rows recorded for the table. */
    public int size(String table) {
        TableRows rows = rowsByTable.get(normalize(table));
        return rows == null ? 0 : rows.rows.size();
    }

    public boolean isEmpty(String table) {
        return size(table) == 0;
    }

    /**
     * Picks one value uniformly from the table's key column.
     *
     * @return the value, empty when the table is unknown or has no values yet
     */
    public Optional<String> sample(String table, Random random) {
        return sample(table, null, random);
    }

    /**
     * Picks one value uniformly from a column of the table.
     *
     * @return the value, empty when the table is unknown or the column has no values yet
     */
    public Optional<String> sample(String table, String column, Random random) {
        List<String> values = values(table, column);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(random.nextInt(values.size())));
    }

    /**
     * Picks one row and returns its values for all given columns, so the columns of a composite
     * foreign key point at the same referenced row. Only rows with a value in every column qualify.
     *
     * @return values keyed by the requested column names, empty when no row qualifies
     */
    public Optional<Map<String, String>> sampleRow(String table, List<String> columns, Random random) {
        TableRows rows = rowsByTable.get(normalize(table));
        if (rows == null) {
            return Optional.empty();
        }
        List<Map<String, String>> candidates = new ArrayList<>();
        for (Map<String, String> row : rows.rows) {
            if (columns.stream().allMatch(column -> row.get(rows.resolve(column)) != null)) {
                candidates.add(row);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> picked = candidates.get(random.nextInt(candidates.size()));
        Map<String, String> result = new HashMap<>();
        for (String column : columns) {
            result.put(column, picked.get(rows.resolve(column)));
        }
        return Optional.of(result);
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase();
    }

    private static final class TableRows {
        private String keyColumn;
        private final List<Map<String, String>> rows = new ArrayList<>();
        private final Map<String, List<String>> valuesByColumn = new HashMap<>();

        private String resolve(String column) {
            String normalized = normalize(column);
            if (!normalized.isEmpty() && valuesByColumn.containsKey(normalized)) {
                return normalized;
            }
            return keyColumn == null ? UNNAMED_KEY : keyColumn;
        }
    }
}
