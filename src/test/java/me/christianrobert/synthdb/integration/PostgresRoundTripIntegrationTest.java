package me.christianrobert.synthdb.integration;

import me.christianrobert.synthdb.dump.service.SqlDumpWriter;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.schema.service.PostgresSchemaIntrospector;
import me.christianrobert.synthdb.semantic.service.SemanticClassifier;
import me.christianrobert.synthdb.synthesis.model.SynthesisOptions;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import me.christianrobert.synthdb.synthesis.service.SyntheticDataGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Introspects a live PostgreSQL schema, generates a dump for it and loads the dump back
 * into the same tables. Foreign keys, enum types and column types are enforced by the
 * database itself, so a successful load means the generated rows are valid.
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresRoundTripIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
        .withDatabaseName("testdb")
        .withUsername("test")
        .withPassword("test");

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private Connection connection;

    @BeforeEach
    void setup() throws SQLException {
        connection = DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE SCHEMA hr");
            stmt.execute("CREATE TYPE hr.mood AS ENUM ('calm', 'busy', 'grumpy')");
            stmt.execute("CREATE TABLE hr.companies (" +
                "id integer PRIMARY KEY, " +
                "name text NOT NULL, " +
                "website varchar(200), " +
                "founded_on date)");
            stmt.execute("CREATE TABLE hr.employees (" +
                "id integer PRIMARY KEY, " +
                "company_id integer NOT NULL REFERENCES hr.companies(id), " +
                "manager_id integer REFERENCES hr.employees(id), " +
                "first_name varchar(50) NOT NULL, " +
                "last_name varchar(50) NOT NULL, " +
                "email varchar(120), " +
                "salary numeric(8,2), " +
                "mood hr.mood NOT NULL, " +
                "hired_at timestamp, " +
                "is_active boolean, " +
                "external_ref uuid, " +
                "last_ip inet)");
            stmt.execute("INSERT INTO hr.companies VALUES (1, 'Acme', 'https://acme.example', '1999-01-01')");
            stmt.execute("INSERT INTO hr.employees (id, company_id, first_name, last_name, mood) " +
                "VALUES (1, 1, 'Jane', 'Doe', 'calm'), (2, 1, 'John', 'Roe', 'busy')");
        }
    }

    @AfterEach
    void cleanup() throws SQLException {
        if (connection != null && !connection.isClosed()) {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("DROP SCHEMA IF EXISTS hr CASCADE");
            }
            connection.close();
        }
    }

    @Test
    void generatedDumpLoadsIntoIntrospectedSchema() throws Exception {
        List<TableMetadata> tables = PostgresSchemaIntrospector.extractAllTables(
            connection, List.of("hr"), PostgresSchemaIntrospector.DEFAULT_SAMPLE_LIMIT);
        assertEquals(2, tables.size());

        TableMetadata employees = tables.stream()
            .filter(t -> t.getTableName().equals("employees"))
            .findFirst()
            .orElseThrow();
        assertEquals(2, employees.getForeignKeys().size());

        SynthesisResult result = new SyntheticDataGenerator(new SemanticClassifier(), FIXED_CLOCK)
            .generate(tables, new SynthesisOptions(25, 7L));
        assertEquals(List.of("companies", "employees"), result.getInsertionOrder());
        assertEquals(0, result.getUnresolvedReferenceCount());

        String dump = new SqlDumpWriter(FIXED_CLOCK).render(result);

        try (Statement stmt = connection.createStatement()) {
            stmt.execute("TRUNCATE hr.employees, hr.companies");
            stmt.execute(dump);
        }

        assertEquals(25, count("SELECT count(*) FROM hr.companies"));
        assertEquals(25, count("SELECT count(*) FROM hr.employees"));
        assertEquals(0, count("SELECT count(*) FROM hr.employees WHERE manager_id >= id"),
            "Managers must be inserted before the employees referencing them");
        assertEquals(0, count("SELECT count(*) FROM hr.employees WHERE mood NOT IN ('calm', 'busy')"),
            "Enum values come from the sampled rows");
    }

    @Test
    void sameSeedProducesSameDump() throws Exception {
        List<TableMetadata> tables = PostgresSchemaIntrospector.extractAllTables(
            connection, List.of("hr"), PostgresSchemaIntrospector.DEFAULT_SAMPLE_LIMIT);

        SyntheticDataGenerator generator = new SyntheticDataGenerator(new SemanticClassifier(), FIXED_CLOCK);
        SqlDumpWriter writer = new SqlDumpWriter(FIXED_CLOCK);

        String first = writer.render(generator.generate(tables, new SynthesisOptions(10, 99L)));
        String second = writer.render(generator.generate(tables, new SynthesisOptions(10, 99L)));

        assertEquals(first, second);
        assertTrue(first.contains("INSERT INTO hr.employees"));
    }

    private long count(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
