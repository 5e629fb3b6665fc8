package me.christianrobert.synthdb.semantic.model;

import java.util.Objects;

/**
 * Classification result for one column: a semantic category plus, for foreign keys,
 * the referenced table and column.
 */
public class SemanticType {

    private final SemanticCategory category;
    private final String referencedTable;
    private final String referencedColumn;

    private SemanticType(SemanticCategory category, String referencedTable, String referencedColumn) {
        this.category = category;
        this.referencedTable = referencedTable;
        this.referencedColumn = referencedColumn;
    }

    public static SemanticType of(SemanticCategory category) {
        if (category == SemanticCategory.FOREIGN_KEY) {
            throw new IllegalArgumentException("Foreign keys need a referenced table, use foreignKey(...)");
        }
        return new SemanticType(category, null, null);
    }

    public static SemanticType foreignKey(String referencedTable, String referencedColumn) {
        return new SemanticType(SemanticCategory.FOREIGN_KEY, referencedTable, referencedColumn);
    }

    public SemanticCategory getCategory() {
        return category;
    }

    public String getReferencedTable() {
        return referencedTable;
    }

    public String getReferencedColumn() {
        return referencedColumn;
    }

    public int getPriority() {
        return category.getPriority();
    }

    public boolean isForeignKey() {
        return category == SemanticCategory.FOREIGN_KEY;
    }

    public boolean isPrimaryKey() {
        return category == SemanticCategory.PRIMARY_KEY;
    }

    public boolean isKey() {
        return isPrimaryKey() || isForeignKey();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticType that)) return false;
        return category == that.category
                && Objects.equals(referencedTable, that.referencedTable)
                && Objects.equals(referencedColumn, that.referencedColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, referencedTable, referencedColumn);
    }

    @Override
    public String toString() {
        return isForeignKey()
                ? "FOREIGN_KEY(" + referencedTable + "." + referencedColumn + ")"
                : category.name();
    }
}
