package me.christianrobert.synthdb.schema.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes schema descriptions as JSON:
 *
 * <pre>
 * {"tables": [
 *   {"schema": "public", "name": "employees",
 *    "columns": [{"name": "id", "type": "integer", "nullable": false, "primaryKey": true},
 *                {"name": "salary", "type": "numeric", "precision": 10, "scale": 2},
 *                {"name": "status", "type": "text", "samples": ["active", "on_leave"]}],
 *    "foreignKeys": [{"column": "company_id", "referencedTable": "companies", "referencedColumn": "id"}]}
 * ]}
 * </pre>
 *
 * Columns of a composite foreign key carry the same optional "constraint" name.
 *
 * The snake_case field names of older exports ("table_name", "data_type", "is_nullable",
 * "distinct_values", "foreign_keys", "ref_table", "ref_column") are accepted as well, and a
 * bare top-level array of tables is treated like {"tables": [...]}.
 */
public class SchemaDescriptionLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaDescriptionLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public List<TableMetadata> load(Path path) throws SchemaLoadException {
        if (!Files.isRegularFile(path)) {
            throw new SchemaLoadException("Schema description file not found: " + path);
        }
        try {
            List<TableMetadata> tables = parse(objectMapper.readTree(path.toFile()));
            log.info("Loaded schema description with {} tables from {}", tables.size(), path);
            return tables;
        } catch (JsonProcessingException e) {
            throw new SchemaLoadException("Malformed schema description " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SchemaLoadException("Cannot read schema description " + path + ": " + e.getMessage(), e);
        }
    }

    public List<TableMetadata> parse(String json) throws SchemaLoadException {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new SchemaLoadException("Malformed schema description: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Maps an already parsed JSON document (for example a REST request body).
     */
    public List<TableMetadata> parse(JsonNode root) throws SchemaLoadException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new SchemaLoadException("Schema description is empty");
        }
        JsonNode tablesNode = root.isArray() ? root : root.get("tables");
        if (tablesNode == null || !tablesNode.isArray()) {
            throw new SchemaLoadException("Schema description must contain a \"tables\" array");
        }

        List<TableMetadata> tables = new ArrayList<>();
        int index = 0;
        for (JsonNode tableNode : tablesNode) {
            tables.add(parseTable(tableNode, index++));
        }
        return tables;
    }

    private TableMetadata parseTable(JsonNode node, int index) throws SchemaLoadException {
        String name = text(node, "name", "table_name");
        if (name == null || name.isBlank()) {
            throw new SchemaLoadException("Table #" + (index + 1) + " has no name");
        }
        String schema = text(node, "schema", "table_schema");

        List<ColumnMetadata> columns = new ArrayList<>();
        JsonNode columnsNode = node.get("columns");
        if (columnsNode != null && !columnsNode.isArray()) {
            throw new SchemaLoadException("Table " + name + ": \"columns\" must be an array");
        }
        if (columnsNode != null) {
            for (JsonNode columnNode : columnsNode) {
                columns.add(parseColumn(name, columnNode));
            }
        }

        List<ForeignKeyMetadata> foreignKeys = new ArrayList<>();
        JsonNode fksNode = first(node, "foreignKeys", "foreign_keys");
        if (fksNode != null && !fksNode.isArray()) {
            throw new SchemaLoadException("Table " + name + ": \"foreignKeys\" must be an array");
        }
        if (fksNode != null) {
            for (JsonNode fkNode : fksNode) {
                String column = text(fkNode, "column", "column_name");
                String referencedTable = text(fkNode, "referencedTable", "ref_table");
                String referencedColumn = text(fkNode, "referencedColumn", "ref_column");
                String constraint = text(fkNode, "constraint", "constraint_name");
                if (column == null || referencedTable == null) {
                    throw new SchemaLoadException("Table " + name + ": foreign key needs \"column\" and \"referencedTable\"");
                }
                foreignKeys.add(new ForeignKeyMetadata(column, referencedTable, referencedColumn, constraint));
            }
        }

        return new TableMetadata(schema, name, columns, foreignKeys);
    }

    private ColumnMetadata parseColumn(String tableName, JsonNode node) throws SchemaLoadException {
        String name = text(node, "name", "column_name");
        if (name == null || name.isBlank()) {
            throw new SchemaLoadException("Table " + tableName + " has a column without name");
        }
        String type = text(node, "type", "data_type");

        boolean nullable = flag(first(node, "nullable", "is_nullable"), true);

        boolean primaryKey = flag(first(node, "primaryKey", "primary_key"), false);

        List<String> samples = new ArrayList<>();
        JsonNode samplesNode = first(node, "samples", "distinct_values");
        if (samplesNode != null && samplesNode.isArray()) {
            for (JsonNode sample : samplesNode) {
                if (!sample.isNull()) {
                    samples.add(sample.asText());
                }
            }
        }

        return new ColumnMetadata(name, type,
                integer(node, "length", "character_maximum_length"),
                integer(node, "precision", "numeric_precision"),
                integer(node, "scale", "numeric_scale"),
                nullable, primaryKey, samples);
    }

    /**
     * Serializes tables into the format {@link #load(Path)} reads.
     */
    public String toJson(List<TableMetadata> tables) {
        try {
            return objectMapper.writeValueAsString(toJsonNode(tables));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema description", e);
        }
    }

    public ObjectNode toJsonNode(List<TableMetadata> tables) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode tablesNode = root.putArray("tables");
        for (TableMetadata table : tables) {
            ObjectNode tableNode = tablesNode.addObject();
            if (table.getSchema() != null) {
                tableNode.put("schema", table.getSchema());
            }
            tableNode.put("name", table.getTableName());
            ArrayNode columnsNode = tableNode.putArray("columns");
            for (ColumnMetadata column : table.getColumns()) {
                ObjectNode columnNode = columnsNode.addObject();
                columnNode.put("name", column.getColumnName());
                columnNode.put("type", column.getDataType());
                columnNode.put("nullable", column.isNullable());
                columnNode.put("primaryKey", column.isPrimaryKey());
                columnNode.put("length", column.getCharacterLength());
                columnNode.put("precision", column.getNumericPrecision());
                columnNode.put("scale", column.getNumericScale());
                ArrayNode samplesNode = columnNode.putArray("samples");
                column.getSampleValues().forEach(samplesNode::add);
            }
            ArrayNode fksNode = tableNode.putArray("foreignKeys");
            for (ForeignKeyMetadata fk : table.getForeignKeys()) {
                ObjectNode fkNode = fksNode.addObject();
                fkNode.put("column", fk.getColumnName());
                fkNode.put("referencedTable", fk.getReferencedTable());
                fkNode.put("referencedColumn", fk.getReferencedColumn());
                if (fk.getConstraintName() != null) {
                    fkNode.put("constraint", fk.getConstraintName());
                }
            }
        }
        return root;
    }

    public void save(List<TableMetadata> tables, Path path) throws IOException {
        Files.writeString(path, toJson(tables));
        log.info("Saved schema description with {} tables to {}", tables.size(), path);
    }

    private static JsonNode first(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String... fieldNames) {
        JsonNode value = first(node, fieldNames);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Booleans, or the catalog's "YES"/"NO" strings.
     */
    private static boolean flag(JsonNode value, boolean defaultValue) {
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isTextual()) {
            String text = value.asText().trim().toLowerCase();
            if (text.equals("yes") || text.equals("true")) {
                return true;
            }
            if (text.equals("no") || text.equals("false")) {
                return false;
            }
            return defaultValue;
        }
        return value.asBoolean(defaultValue);
    }

    private static Integer integer(JsonNode node, String... fieldNames) {
        JsonNode value = first(node, fieldNames);
        // Malformed modifiers are dropped; the synthesizer falls back to default precision
        return value != null && value.canConvertToInt() ? value.asInt() : null;
    }
}
