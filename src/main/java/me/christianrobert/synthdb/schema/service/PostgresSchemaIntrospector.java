package me.christianrobert.synthdb.schema.service;

import me.christianrobert.synthdb.core.tools.SchemaExcluder;
import me.christianrobert.synthdb.core.tools.SqlIdentifiers;
import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads table, column, key and sample-value metadata from a live PostgreSQL database
 * through information_schema.
 */
public class PostgresSchemaIntrospector {

    private static final Logger log = LoggerFactory.getLogger(PostgresSchemaIntrospector.class);

    public static final int DEFAULT_SAMPLE_LIMIT = 20;

    // Columns whose real values would leak identities or keys into the dump
    private static final List<String> SAMPLE_EXCLUDED_NAME_PARTS = List.of("id", "email", "name");

    public static List<TableMetadata> extractAllTables(Connection connection, List<String> schemas,
                                                       int sampleLimit) throws SQLException {
        List<TableMetadata> result = new ArrayList<>();

        for (String schema : schemas) {
            if (SchemaExcluder.isToBeExcluded(schema)) {
                log.debug("Skipping PostgreSQL system schema: {}", schema);
                continue;
            }

            List<String> tables = fetchTableNames(connection, schema);
            for (String table : tables) {
                result.add(fetchTableMetadata(connection, schema, table, sampleLimit));
            }
            log.info("Extracted {} tables from PostgreSQL schema {}", tables.size(), schema);
        }
        return result;
    }

    private static List<String> fetchTableNames(Connection connection, String schema) throws SQLException {
        List<String> result = new ArrayList<>();
        String sql = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = ?
              AND table_type = 'BASE TABLE'
            ORDER BY table_name
            """;

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, schema);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString("table_name"));
                }
            }
        }
        return result;
    }

    private static TableMetadata fetchTableMetadata(Connection connection, String schema, String table,
                                                    int sampleLimit) throws SQLException {
        Set<String> primaryKeyColumns = fetchPrimaryKeyColumns(connection, schema, table);
        List<ColumnMetadata> columns = new ArrayList<>();

        String columnSql = """
            SELECT column_name, data_type, udt_name, character_maximum_length,
                   numeric_precision, numeric_scale, is_nullable
            FROM information_schema.columns
            WHERE table_schema = ? AND table_name = ?
            ORDER BY ordinal_position
            """;

        try (PreparedStatement ps = connection.prepareStatement(columnSql)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String columnName = rs.getString("column_name");
                    String dataType = declaredType(rs.getString("data_type"), rs.getString("udt_name"));

                    Integer charLength = rs.getInt("character_maximum_length");
                    if (rs.wasNull()) charLength = null;

                    Integer precision = null;
                    Integer scale = null;
                    if (isExactNumeric(dataType)) {
                        precision = rs.getInt("numeric_precision");
                        if (rs.wasNull()) precision = null;
                        scale = rs.getInt("numeric_scale");
                        if (rs.wasNull()) scale = null;
                    }

                    boolean nullable = "YES".equalsIgnoreCase(rs.getString("is_nullable"));
                    columns.add(new ColumnMetadata(columnName, dataType, charLength, precision, scale,
                            nullable, primaryKeyColumns.contains(columnName), null));
                }
            }
        }

        List<ColumnMetadata> sampled = new ArrayList<>(columns.size());
        for (ColumnMetadata column : columns) {
            if (sampleLimit > 0 && isSampleCandidate(column)) {
                sampled.add(column.withSampleValues(fetchSampleValues(connection, schema, table,
                        column.getColumnName(), sampleLimit)));
            } else {
                sampled.add(column);
            }
        }

        List<ForeignKeyMetadata> foreignKeys = fetchForeignKeys(connection, schema, table);
        log.debug("Table {}.{}: {} columns, {} foreign keys", schema, table, sampled.size(), foreignKeys.size());
        return new TableMetadata(schema, table, sampled, foreignKeys);
    }

    private static Set<String> fetchPrimaryKeyColumns(Connection connection, String schema, String table)
            throws SQLException {
        Set<String> result = new HashSet<>();
        String sql = """
            SELECT kcu.column_name
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_schema = kcu.constraint_schema
             AND tc.constraint_name = kcu.constraint_name
             AND tc.table_name = kcu.table_name
            WHERE tc.table_schema = ?
              AND tc.table_name = ?
              AND tc.constraint_type = 'PRIMARY KEY'
            """;

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString("column_name"));
                }
            }
        }
        return result;
    }

    private static List<ForeignKeyMetadata> fetchForeignKeys(Connection connection, String schema, String table)
            throws SQLException {
        List<ForeignKeyMetadata> result = new ArrayList<>();
        // Referenced columns are matched by position; the constraint name ties a composite key together
        String sql = """
            SELECT tc.constraint_name,
                   kcu.column_name,
                   rkcu.table_name AS referenced_table,
                   rkcu.column_name AS referenced_column
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_schema = kcu.constraint_schema
             AND tc.constraint_name = kcu.constraint_name
             AND tc.table_name = kcu.table_name
            JOIN information_schema.referential_constraints rc
              ON tc.constraint_schema = rc.constraint_schema
             AND tc.constraint_name = rc.constraint_name
            JOIN information_schema.key_column_usage rkcu
              ON rc.unique_constraint_schema = rkcu.constraint_schema
             AND rc.unique_constraint_name = rkcu.constraint_name
             AND rkcu.ordinal_position = kcu.position_in_unique_constraint
            WHERE tc.table_schema = ?
              AND tc.table_name = ?
              AND tc.constraint_type = 'FOREIGN KEY'
            ORDER BY tc.constraint_name, kcu.ordinal_position
            """;

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new ForeignKeyMetadata(
                            rs.getString("column_name"),
                            rs.getString("referenced_table"),
                            rs.getString("referenced_column"),
                            rs.getString("constraint_name")));
                }
            }
        }
        return result;
    }

    /**
     * Distinct non-null values of a text-like column. A column that cannot be read
     * (permissions, exotic types) simply gets no samples.
     */
    private static List<String> fetchSampleValues(Connection connection, String schema, String table,
                                                  String column, int limit) {
        List<String> values = new ArrayList<>();
        String sql = sampleQuery(schema, table, column, limit);
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            while (rs.next()) {
                String value = rs.getString(1);
                if (value != null) {
                    values.add(value);
                }
            }
        } catch (SQLException e) {
            log.debug("Could not sample {}.{}.{}: {}", schema, table, column, e.getMessage());
            return List.of();
        }
        return values;
    }

    static String sampleQuery(String schema, String table, String column, int limit) {
        String quotedColumn = SqlIdentifiers.quoteIdentifier(column);
        return "SELECT DISTINCT " + quotedColumn + "::text FROM "
                + SqlIdentifiers.quoteQualifiedName(schema, table)
                + " WHERE " + quotedColumn + " IS NOT NULL LIMIT " + limit;
    }

    /**
     * Text, character and enum columns are sampled unless their name suggests identifiers,
     * e-mail addresses or names.
     */
    static boolean isSampleCandidate(ColumnMetadata column) {
        String type = column.getDataType() == null ? "" : column.getDataType().toLowerCase(Locale.ROOT);
        boolean textLike = type.equals("text") || type.contains("char") || type.startsWith("enum:");
        if (!textLike || column.isPrimaryKey()) {
            return false;
        }
        String name = column.getColumnName().toLowerCase(Locale.ROOT);
        return SAMPLE_EXCLUDED_NAME_PARTS.stream().noneMatch(name::contains);
    }

    /**
     * information_schema reports enums as USER-DEFINED and arrays as ARRAY; the udt name
     * carries the useful part.
     */
    static String declaredType(String dataType, String udtName) {
        if ("USER-DEFINED".equals(dataType) && udtName != null) {
            return "enum:" + udtName;
        }
        if ("ARRAY".equals(dataType) && udtName != null) {
            return udtName.startsWith("_") ? udtName.substring(1) + "[]" : udtName;
        }
        return dataType;
    }

    private static boolean isExactNumeric(String dataType) {
        return dataType != null && (dataType.equalsIgnoreCase("numeric") || dataType.equalsIgnoreCase("decimal"));
    }
}
