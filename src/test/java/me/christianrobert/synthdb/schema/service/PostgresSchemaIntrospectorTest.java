package me.christianrobert.synthdb.schema.service;

import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PostgresSchemaIntrospectorTest {

    @Test
    void testSampleQueryQuotesIdentifiers() {
        assertEquals("SELECT DISTINCT status::text FROM public.orders WHERE status IS NOT NULL LIMIT 20",
                PostgresSchemaIntrospector.sampleQuery("public", "orders", "status", 20));
        assertEquals("SELECT DISTINCT \"Level\"::text FROM crm.\"user\" WHERE \"Level\" IS NOT NULL LIMIT 5",
                PostgresSchemaIntrospector.sampleQuery("crm", "user", "Level", 5));
    }

    @Test
    void testSampleCandidates() {
        assertTrue(PostgresSchemaIntrospector.isSampleCandidate(new ColumnMetadata("status", "text", true)));
        assertTrue(PostgresSchemaIntrospector.isSampleCandidate(new ColumnMetadata("tier", "character varying", true)));
        assertTrue(PostgresSchemaIntrospector.isSampleCandidate(new ColumnMetadata("mood", "enum:mood", true)));

        assertFalse(PostgresSchemaIntrospector.isSampleCandidate(new ColumnMetadata("age", "integer", true)));
        assertFalse(PostgresSchemaIntrospector.isSampleCandidate(new ColumnMetadata("email", "text", true)));
        assertFalse(PostgresSchemaIntrospector.isSampleCandidate(new ColumnMetadata("last_name", "text", true)));
        assertFalse(PostgresSchemaIntrospector.isSampleCandidate(new ColumnMetadata("external_id", "text", true)));
        assertFalse(PostgresSchemaIntrospector.isSampleCandidate(new ColumnMetadata("code", "text", false).asPrimaryKey()));
    }

    @Test
    void testDeclaredType() {
        assertEquals("enum:mood", PostgresSchemaIntrospector.declaredType("USER-DEFINED", "mood"));
        assertEquals("text[]", PostgresSchemaIntrospector.declaredType("ARRAY", "_text"));
        assertEquals("integer", PostgresSchemaIntrospector.declaredType("integer", "int4"));
    }

    @Test
    void testSystemSchemasAreNotQueried() throws Exception {
        Connection connection = mock(Connection.class);

        assertTrue(PostgresSchemaIntrospector.extractAllTables(connection,
                List.of("pg_catalog", "information_schema"), 10).isEmpty());
        verifyNoInteractions(connection);
    }
}
