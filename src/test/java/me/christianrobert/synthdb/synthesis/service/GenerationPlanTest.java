package me.christianrobert.synthdb.synthesis.service;

import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.semantic.service.SemanticClassifier;
import me.christianrobert.synthdb.synthesis.service.GenerationPlan.PlannedColumn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationPlanTest {

    private static final TableMetadata EMPLOYEES = new TableMetadata("employees", List.of(
            new ColumnMetadata("email", "text", true),
            new ColumnMetadata("username", "text", true),
            new ColumnMetadata("id", "integer", false).asPrimaryKey(),
            new ColumnMetadata("last_name", "text", true),
            new ColumnMetadata("first_name", "text", true),
            new ColumnMetadata("company_id", "integer", false)),
            List.of(new ForeignKeyMetadata("company_id", "companies", "id")));

    @Test
    void testOutputOrderIsDeclarationOrder() {
        GenerationPlan plan = GenerationPlan.build(EMPLOYEES, new SemanticClassifier());

        assertEquals(List.of("email", "username", "id", "last_name", "first_name", "company_id"), plan.getColumnNames());
        assertEquals(6, plan.size());
    }

    @Test
    void testGenerationOrderFollowsPriority() {
        GenerationPlan plan = GenerationPlan.build(EMPLOYEES, new SemanticClassifier());

        List<String> order = plan.getGenerationOrder().stream()
                .map(c -> c.getColumn().getColumnName())
                .toList();

        // keys first, then names (ties in declaration order), then username, then email
        assertEquals(List.of("id", "company_id", "last_name", "first_name", "username", "email"), order);
    }

    @Test
    void testPrimaryKeyAndForeignKeyColumns() {
        GenerationPlan plan = GenerationPlan.build(EMPLOYEES, new SemanticClassifier());

        PlannedColumn primaryKey = plan.getPrimaryKeyColumn().orElseThrow();
        PlannedColumn companyId = plan.getOutputOrder().get(5);

        assertEquals("id", primaryKey.getColumn().getColumnName());
        assertEquals(2, primaryKey.getPosition());
        assertTrue(companyId.getType().isForeignKey());
        assertEquals("companies", companyId.getForeignKey().getReferencedTable());
    }

    @Test
    void testTableWithoutPrimaryKey() {
        TableMetadata log = new TableMetadata("audit_log",
                List.of(new ColumnMetadata("message", "text", true)), List.of());

        assertTrue(GenerationPlan.build(log, new SemanticClassifier()).getPrimaryKeyColumn().isEmpty());
    }
}
