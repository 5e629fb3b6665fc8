package me.christianrobert.synthdb.synthesis.service;

import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.semantic.model.SemanticType;
import me.christianrobert.synthdb.semantic.service.SemanticClassifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Per-table plan: every column classified once, plus two independent orders over them.
 *
 * - generation order: descending semantic priority, ties in declaration order
 *   (names before usernames before emails)
 * - output order: declaration order, used for the INSERT column list and tuples
 */
public class GenerationPlan {

    private final TableMetadata table;
    private final List<PlannedColumn> outputOrder;
    private final List<PlannedColumn> generationOrder;

    private GenerationPlan(TableMetadata table, List<PlannedColumn> outputOrder) {
        this.table = table;
        this.outputOrder = Collections.unmodifiableList(outputOrder);
        List<PlannedColumn> sorted = new ArrayList<>(outputOrder);
        // List.sort is stable, so equal priorities keep declaration order
        sorted.sort(Comparator.comparingInt((PlannedColumn c) -> c.getType().getPriority()).reversed());
        this.generationOrder = Collections.unmodifiableList(sorted);
    }

    public static GenerationPlan build(TableMetadata table, SemanticClassifier classifier) {
        List<PlannedColumn> columns = new ArrayList<>();
        int position = 0;
        for (ColumnMetadata column : table.getColumns()) {
            SemanticType type = classifier.classify(column, table);
            ForeignKeyMetadata fk = table.findForeignKey(column.getColumnName()).orElse(null);
            columns.add(new PlannedColumn(position++, column, type, fk));
        }
        return new GenerationPlan(table, columns);
    }

    public TableMetadata getTable() {
        return table;
    }

    public List<PlannedColumn> getOutputOrder() {
        return outputOrder;
    }

    public List<PlannedColumn> getGenerationOrder() {
        return generationOrder;
    }

    public List<String> getColumnNames() {
        return outputOrder.stream().map(c -> c.getColumn().getColumnName()).toList();
    }

    /**
     * The key column of the table's reference pool: the first primary-key column.
     */
    public Optional<PlannedColumn> getPrimaryKeyColumn() {
        return outputOrder.stream().filter(c -> c.getType().isPrimaryKey()).findFirst();
    }

    public int size() {
        return outputOrder.size();
    }

    public static class PlannedColumn {
        private final int position;
        private final ColumnMetadata column;
        private final SemanticType type;
        private final ForeignKeyMetadata foreignKey;

        PlannedColumn(int position, ColumnMetadata column, SemanticType type, ForeignKeyMetadata foreignKey) {
            this.position = position;
            this.column = column;
            this.type = type;
            this.foreignKey = foreignKey;
        }

        /** Zero-based declaration position. */
        public int getPosition() {
            return position;
        }

        public ColumnMetadata getColumn() {
            return column;
        }

        public SemanticType getType() {
            return type;
        }

        public ForeignKeyMetadata getForeignKey() {
            return foreignKey;
        }

        @Override
        public String toString() {
            return column.getColumnName() + ":" + type;
        }
    }
}
