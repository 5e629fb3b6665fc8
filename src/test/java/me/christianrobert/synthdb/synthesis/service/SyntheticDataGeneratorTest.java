package me.christianrobert.synthdb.synthesis.service;

import me.christianrobert.synthdb.dump.service.SqlDumpWriter;
import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.semantic.service.SemanticClassifier;
import me.christianrobert.synthdb.synthesis.model.GeneratedTable;
import me.christianrobert.synthdb.synthesis.model.SqlValue;
import me.christianrobert.synthdb.synthesis.model.SynthesisOptions;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticDataGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private static final TableMetadata COMPANIES = new TableMetadata("companies", List.of(
            new ColumnMetadata("id", "integer", false).asPrimaryKey(),
            new ColumnMetadata("name", "text", false),
            new ColumnMetadata("website", "text", true)),
            List.of());

    private static final TableMetadata EMPLOYEES = new TableMetadata("employees", List.of(
            new ColumnMetadata("id", "integer", false).asPrimaryKey(),
            new ColumnMetadata("company_id", "integer", false),
            new ColumnMetadata("first_name", "text", false),
            new ColumnMetadata("last_name", "text", false),
            new ColumnMetadata("email", "text", true),
            new ColumnMetadata("manager_id", "integer", true)),
            List.of(new ForeignKeyMetadata("company_id", "companies", "id"),
                    new ForeignKeyMetadata("manager_id", "employees", "id")));

    private final SyntheticDataGenerator generator = new SyntheticDataGenerator(new SemanticClassifier(), CLOCK);

    private static GeneratedTable table(SynthesisResult result, String name) {
        return result.getGeneratedTables().stream()
                .filter(t -> t.getTableName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private static Set<String> raw(List<SqlValue> values) {
        return values.stream().map(SqlValue::getRaw).collect(Collectors.toSet());
    }

    private static TableMetadata cyclic(String name, String referenced, boolean nullable) {
        return new TableMetadata(name, List.of(
                new ColumnMetadata("id", "integer", false).asPrimaryKey(),
                new ColumnMetadata(referenced + "_ref", "integer", nullable)),
                List.of(new ForeignKeyMetadata(referenced + "_ref", referenced, "id")));
    }

    @Test
    void testReferencedTablesAreGeneratedFirst() {
        SynthesisResult result = generator.generate(List.of(EMPLOYEES, COMPANIES), new SynthesisOptions(10, 1L));

        assertEquals(List.of("companies", "employees"), result.getInsertionOrder());
        assertEquals(20, result.getTotalRows());
        assertEquals(10, result.getRowCounts().get("employees"));
        assertFalse(result.hasCycles());
    }

    @Test
    void testForeignKeysPointAtGeneratedRows() {
        SynthesisResult result = generator.generate(List.of(COMPANIES, EMPLOYEES), new SynthesisOptions(25, 2L));

        Set<String> companyIds = raw(table(result, "companies").columnValues("id"));
        for (SqlValue companyId : table(result, "employees").columnValues("company_id")) {
            assertTrue(companyIds.contains(companyId.getRaw()), companyId.toSql());
        }
        assertEquals(0, result.getUnresolvedReferenceCount());
    }

    @Test
    void testTwoCompaniesFeedEveryEmployeeReference() {
        TableMetadata companies = new TableMetadata("companies", List.of(
                new ColumnMetadata("id", "integer", false).asPrimaryKey(),
                new ColumnMetadata("name", "text", false)),
                List.of());
        TableMetadata employees = new TableMetadata("employees", List.of(
                new ColumnMetadata("id", "integer", false).asPrimaryKey(),
                new ColumnMetadata("company_id", "integer", false),
                new ColumnMetadata("email", "text", false)),
                List.of(new ForeignKeyMetadata("company_id", "companies", "id")));
        ReferencePool pool = new ReferencePool();
        ValueSynthesizer synthesizer = new ValueSynthesizer(new Random(11), CLOCK, pool);
        SynthesisResult result = new SynthesisResult(11L);

        generator.generateTable(companies, 2, synthesizer, pool, Set.of(), Set.of(), result);
        assertEquals(List.of("1", "2"), pool.values("companies"));

        GeneratedTable generated = generator.generateTable(employees, 2, synthesizer, pool, Set.of(), Set.of(), result);
        for (SqlValue companyId : generated.columnValues("company_id")) {
            assertTrue(Set.of("1", "2").contains(companyId.getRaw()), companyId.toSql());
        }
        List<SqlValue> emails = generated.columnValues("email");
        for (int row = 0; row < emails.size(); row++) {
            String email = emails.get(row).getRaw();
            assertTrue(email.matches("user" + (row + 1) + "@(gmail|outlook|yahoo|hotmail)\\.com"), email);
        }
        assertEquals(0, result.getUnresolvedReferenceCount());
    }

    @Test
    void testReferenceToUniqueColumnUsesThatColumnsValues() {
        TableMetadata countries = new TableMetadata("countries", List.of(
                new ColumnMetadata("id", "integer", false).asPrimaryKey(),
                new ColumnMetadata("iso_code", "text", false)),
                List.of());
        TableMetadata cities = new TableMetadata("cities", List.of(
                new ColumnMetadata("id", "integer", false).asPrimaryKey(),
                new ColumnMetadata("name", "text", false),
                new ColumnMetadata("country_iso", "text", false)),
                List.of(new ForeignKeyMetadata("country_iso", "countries", "iso_code")));

        SynthesisResult result = generator.generate(List.of(cities, countries), new SynthesisOptions(12, 21L));

        Set<String> isoCodes = raw(table(result, "countries").columnValues("iso_code"));
        Set<String> countryIds = raw(table(result, "countries").columnValues("id"));
        assertTrue(isoCodes.stream().noneMatch(countryIds::contains));
        for (SqlValue countryIso : table(result, "cities").columnValues("country_iso")) {
            assertTrue(isoCodes.contains(countryIso.getRaw()), countryIso.toSql());
        }
        assertEquals(0, result.getUnresolvedReferenceCount());
    }

    @Test
    void testCompositeReferencePointsAtOneRow() {
        TableMetadata warehouses = new TableMetadata("warehouses", List.of(
                new ColumnMetadata("id", "integer", false).asPrimaryKey(),
                new ColumnMetadata("region", "text", false),
                new ColumnMetadata("site_code", "text", false)),
                List.of());
        TableMetadata stock = new TableMetadata("stock", List.of(
                new ColumnMetadata("id", "integer", false).asPrimaryKey(),
                new ColumnMetadata("warehouse_region", "text", false),
                new ColumnMetadata("warehouse_code", "text", false)),
                List.of(new ForeignKeyMetadata("warehouse_region", "warehouses", "region", "fk_stock_warehouse"),
                        new ForeignKeyMetadata("warehouse_code", "warehouses", "site_code", "fk_stock_warehouse")));

        SynthesisResult result = generator.generate(List.of(stock, warehouses), new SynthesisOptions(20, 22L));

        GeneratedTable generatedWarehouses = table(result, "warehouses");
        Set<String> pairs = new HashSet<>();
        for (int row = 0; row < generatedWarehouses.getRowCount(); row++) {
            pairs.add(generatedWarehouses.columnValues("region").get(row).getRaw() + "|"
                    + generatedWarehouses.columnValues("site_code").get(row).getRaw());
        }
        GeneratedTable generatedStock = table(result, "stock");
        for (int row = 0; row < generatedStock.getRowCount(); row++) {
            String pair = generatedStock.columnValues("warehouse_region").get(row).getRaw() + "|"
                    + generatedStock.columnValues("warehouse_code").get(row).getRaw();
            assertTrue(pairs.contains(pair), pair);
        }
    }

    @Test
    void testCompositeKeysNeedASharedConstraintName() {
        TableMetadata stock = new TableMetadata("stock", List.of(),
                List.of(new ForeignKeyMetadata("warehouse_region", "warehouses", "region", "fk_a"),
                        new ForeignKeyMetadata("warehouse_code", "warehouses", "site_code", "fk_a"),
                        new ForeignKeyMetadata("supplier_id", "suppliers", "id", "fk_b"),
                        new ForeignKeyMetadata("product_id", "products", "id")));

        Map<String, List<ForeignKeyMetadata>> composite = SyntheticDataGenerator.compositeForeignKeys(stock);

        assertEquals(Set.of("fk_a"), composite.keySet());
        assertEquals(2, composite.get("fk_a").size());
    }

    @Test
    void testSelfReferenceOnlyPointsAtEarlierRows() {
        SynthesisResult result = generator.generate(List.of(COMPANIES, EMPLOYEES), new SynthesisOptions(15, 3L));
        GeneratedTable employees = table(result, "employees");

        List<SqlValue> ids = employees.columnValues("id");
        List<SqlValue> managers = employees.columnValues("manager_id");

        assertTrue(managers.get(0).isNull());
        for (int row = 1; row < managers.size(); row++) {
            int manager = Integer.parseInt(managers.get(row).getRaw());
            assertTrue(manager < Integer.parseInt(ids.get(row).getRaw()));
        }
    }

    @Test
    void testRowValuesStayConsistentWithinRow() {
        SynthesisResult result = generator.generate(List.of(COMPANIES, EMPLOYEES), new SynthesisOptions(20, 4L));
        GeneratedTable employees = table(result, "employees");

        List<SqlValue> firstNames = employees.columnValues("first_name");
        List<SqlValue> lastNames = employees.columnValues("last_name");
        List<SqlValue> emails = employees.columnValues("email");

        for (int row = 0; row < emails.size(); row++) {
            String localPart = slug(firstNames.get(row).getRaw()) + "." + slug(lastNames.get(row).getRaw());
            assertTrue(emails.get(row).getRaw().startsWith(localPart + "@"), emails.get(row).getRaw());
        }
    }

    @Test
    void testWebsiteDerivedFromCompanyName() {
        SynthesisResult result = generator.generate(List.of(COMPANIES), new SynthesisOptions(5, 5L));
        GeneratedTable companies = table(result, "companies");

        for (SqlValue website : companies.columnValues("website")) {
            assertTrue(website.getRaw().startsWith("https://www."), website.getRaw());
            assertTrue(website.getRaw().endsWith(".com"), website.getRaw());
        }
    }

    @Test
    void testNullableReferenceIntoPendingCycleIsNull() {
        SynthesisResult result = generator.generate(
                List.of(cyclic("a", "b", true), cyclic("b", "a", true)), new SynthesisOptions(5, 6L));

        assertTrue(result.hasCycles());
        assertEquals(List.of("a", "b"), result.getInsertionOrder());
        assertTrue(table(result, "a").columnValues("b_ref").stream().allMatch(SqlValue::isNull));
        assertTrue(table(result, "b").columnValues("a_ref").stream().noneMatch(SqlValue::isNull));
        assertEquals(0, result.getUnresolvedReferenceCount());
    }

    @Test
    void testRequiredReferenceIntoCycleIsSubstituted() {
        SynthesisResult result = generator.generate(
                List.of(cyclic("a", "b", false), cyclic("b", "a", false)), new SynthesisOptions(4, 7L));

        List<SqlValue> refs = table(result, "a").columnValues("b_ref");
        assertEquals(List.of("1", "2", "3", "4"), refs.stream().map(SqlValue::getRaw).toList());
        assertEquals(4, result.getUnresolvedReferenceCount());
        assertEquals("a", result.getUnresolvedReferences().get(0).getTable());
    }

    @Test
    void testReferenceToUnknownTableIsSubstituted() {
        TableMetadata orders = new TableMetadata("orders", List.of(
                new ColumnMetadata("id", "integer", false).asPrimaryKey(),
                new ColumnMetadata("customer_id", "integer", false)),
                List.of(new ForeignKeyMetadata("customer_id", "customers", "id")));

        SynthesisResult result = generator.generate(List.of(orders), new SynthesisOptions(3, 8L));

        assertEquals(3, result.getUnresolvedReferenceCount());
        assertTrue(table(result, "orders").columnValues("customer_id").stream().noneMatch(SqlValue::isNull));
    }

    @Test
    void testTableWithoutColumnsHasNoRows() {
        TableMetadata empty = new TableMetadata("nothing", List.of(), List.of());

        SynthesisResult result = generator.generate(List.of(empty), new SynthesisOptions(10, 9L));

        assertEquals(0, result.getTotalRows());
        assertEquals(List.of("nothing"), result.getInsertionOrder());
    }

    @Test
    void testListenerSeesEveryTable() {
        List<String> seen = new ArrayList<>();

        generator.generate(List.of(EMPLOYEES, COMPANIES), new SynthesisOptions(2, 10L), t -> seen.add(t.getTableName()));

        assertEquals(List.of("companies", "employees"), seen);
    }

    @Test
    void testSameSeedSameDump() {
        SqlDumpWriter writer = new SqlDumpWriter(CLOCK);

        String first = writer.render(generator.generate(List.of(COMPANIES, EMPLOYEES), new SynthesisOptions(30, 99L)));
        String second = writer.render(new SyntheticDataGenerator(new SemanticClassifier(), CLOCK)
                .generate(List.of(COMPANIES, EMPLOYEES), new SynthesisOptions(30, 99L)));

        assertEquals(first, second);
    }

    @Test
    void testRandomSeedIsReported() {
        SynthesisResult result = generator.generate(List.of(COMPANIES), new SynthesisOptions(1, null));
        SynthesisResult replay = generator.generate(List.of(COMPANIES), new SynthesisOptions(1, result.getSeed()));

        assertEquals(table(result, "companies").getRows(), table(replay, "companies").getRows());
    }

    private static String slug(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
