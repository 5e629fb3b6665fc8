package me.christianrobert.synthdb.core.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchemaExcluderTest {

    @Test
    void testSystemSchemasAreExcluded() {
        assertTrue(SchemaExcluder.isToBeExcluded("pg_catalog"));
        assertTrue(SchemaExcluder.isToBeExcluded("information_schema"));
        assertTrue(SchemaExcluder.isToBeExcluded("pg_toast"));
        assertTrue(SchemaExcluder.isToBeExcluded("pg_temp_3"));
        assertTrue(SchemaExcluder.isToBeExcluded("pg_toast_temp_3"));
    }

    @Test
    void testBlankSchemaIsExcluded() {
        assertTrue(SchemaExcluder.isToBeExcluded(null));
        assertTrue(SchemaExcluder.isToBeExcluded(" "));
    }

    @Test
    void testUserSchemasAreKept() {
        assertFalse(SchemaExcluder.isToBeExcluded("public"));
        assertFalse(SchemaExcluder.isToBeExcluded("sales"));
        assertFalse(SchemaExcluder.isToBeExcluded("pgbench"));
    }
}
