package me.christianrobert.synthdb.schema.service;

import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.DataTypeTag;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaDescriptionLoaderTest {

    private final SchemaDescriptionLoader loader = new SchemaDescriptionLoader();

    static Path fixture() throws URISyntaxException {
        return Path.of(SchemaDescriptionLoaderTest.class.getResource("/schemas/company.json").toURI());
    }

    @Test
    void testLoadFixture() throws Exception {
        List<TableMetadata> tables = loader.load(fixture());

        assertEquals(2, tables.size());
        TableMetadata employees = tables.get(0);
        assertEquals("employees", employees.getTableName());
        assertNull(employees.getSchema());
        assertEquals(9, employees.getColumns().size());
        assertEquals(2, employees.getForeignKeys().size());

        ColumnMetadata id = employees.findColumn("id").orElseThrow();
        assertTrue(id.isPrimaryKey());
        assertFalse(id.isNullable());

        ColumnMetadata salary = employees.findColumn("salary").orElseThrow();
        assertEquals(DataTypeTag.DECIMAL, salary.getTypeTag());
        assertEquals(10, salary.getNumericPrecision());
        assertEquals(2, salary.getNumericScale());
        assertTrue(salary.isNullable());

        assertEquals(50, employees.findColumn("first_name").orElseThrow().getCharacterLength());
        assertEquals(List.of("active", "on_leave"), employees.findColumn("status").orElseThrow().getSampleValues());
    }

    @Test
    void testSnakeCaseExportIsAccepted() throws Exception {
        String json = """
                [{"table_schema": "crm", "table_name": "contacts",
                  "columns": [{"column_name": "id", "data_type": "bigint", "is_nullable": "NO", "primary_key": true},
                              {"column_name": "tier", "data_type": "text", "is_nullable": "YES",
                               "distinct_values": ["gold", null, "silver"]},
                              {"column_name": "account_id", "data_type": "bigint", "is_nullable": "NO"}],
                  "foreign_keys": [{"column_name": "account_id", "ref_table": "accounts", "ref_column": "id"}]}]
                """;

        TableMetadata contacts = loader.parse(json).get(0);

        assertEquals("crm", contacts.getSchema());
        assertFalse(contacts.getColumns().get(0).isNullable());
        assertTrue(contacts.getColumns().get(0).isPrimaryKey());
        assertTrue(contacts.getColumns().get(1).isNullable());
        assertEquals(List.of("gold", "silver"), contacts.getColumns().get(1).getSampleValues());
        assertEquals("accounts", contacts.findForeignKey("account_id").orElseThrow().getReferencedTable());
    }

    @Test
    void testMalformedModifiersAreDropped() throws Exception {
        String json = """
                {"tables": [{"name": "t", "columns": [{"name": "amount", "type": "numeric", "precision": "ten"}]}]}
                """;

        assertNull(loader.parse(json).get(0).getColumns().get(0).getNumericPrecision());
    }

    @Test
    void testSaveAndLoadKeepDescription(@TempDir Path tempDir) throws Exception {
        List<TableMetadata> tables = loader.load(fixture());
        Path saved = tempDir.resolve("saved.json");

        loader.save(tables, saved);
        List<TableMetadata> reloaded = loader.load(saved);

        assertEquals(loader.toJson(tables), loader.toJson(reloaded));
    }

    @Test
    void testCompositeKeyConstraintIsKept() throws Exception {
        String json = """
                {"tables": [{"name": "stock", "columns": [],
                  "foreignKeys": [
                    {"column": "warehouse_region", "referencedTable": "warehouses", "referencedColumn": "region",
                     "constraint": "fk_stock_warehouse"},
                    {"column": "warehouse_code", "referencedTable": "warehouses", "referencedColumn": "site_code",
                     "constraint": "fk_stock_warehouse"},
                    {"column": "product_id", "referencedTable": "products", "referencedColumn": "id"}]}]}
                """;

        List<TableMetadata> tables = loader.parse(json);
        List<ForeignKeyMetadata> fks = tables.get(0).getForeignKeys();

        assertEquals("fk_stock_warehouse", fks.get(0).getConstraintName());
        assertEquals("fk_stock_warehouse", fks.get(1).getConstraintName());
        assertNull(fks.get(2).getConstraintName());
        assertEquals(loader.toJson(tables), loader.toJson(loader.parse(loader.toJson(tables))));
        assertFalse(loader.toJsonNode(tables).get("tables").get(0).get("foreignKeys").get(2).has("constraint"));
    }

    @Test
    void testInvalidDocuments() {
        assertThrows(SchemaLoadException.class, () -> loader.parse("{not json"));
        assertThrows(SchemaLoadException.class, () -> loader.parse("{\"tables\": 3}"));
        assertThrows(SchemaLoadException.class, () -> loader.parse("{\"tables\": [{\"columns\": []}]}"));
        assertThrows(SchemaLoadException.class,
                () -> loader.parse("{\"tables\": [{\"name\": \"t\", \"columns\": [{\"type\": \"text\"}]}]}"));
        assertThrows(SchemaLoadException.class,
                () -> loader.parse("{\"tables\": [{\"name\": \"t\", \"foreignKeys\": [{\"column\": \"x\"}]}]}"));
    }

    @Test
    void testMissingFile(@TempDir Path tempDir) {
        SchemaLoadException e = assertThrows(SchemaLoadException.class,
                () -> loader.load(tempDir.resolve("missing.json")));

        assertTrue(e.getMessage().contains("not found"));
    }
}
