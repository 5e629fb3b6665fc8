package me.christianrobert.synthdb.dependency.model;

import me.christianrobert.synthdb.schema.model.TableMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of ordering tables by their foreign-key dependencies.
 * Holds the generation order and, when the graph contained cycles, the tables
 * that had to be appended in input order instead.
 */
public class DependencyResolution {

    private final List<TableMetadata> orderedTables;
    private final List<String> cyclicTables;

    public DependencyResolution(List<TableMetadata> orderedTables, List<String> cyclicTables) {
        this.orderedTables = Collections.unmodifiableList(new ArrayList<>(orderedTables));
        this.cyclicTables = Collections.unmodifiableList(new ArrayList<>(cyclicTables));
    }

    public List<TableMetadata> getOrderedTables() {
        return orderedTables;
    }

    /**
     * Tables that could not be placed topologically, in original input order.
     */
    public List<String> getCyclicTables() {
        return cyclicTables;
    }

    public boolean hasCycles() {
        return !cyclicTables.isEmpty();
    }

    public List<String> getOrderedTableNames() {
        return orderedTables.stream().map(TableMetadata::getTableName).toList();
    }

    @Override
    public String toString() {
        return String.format("DependencyResolution{order=%s, cyclic=%s}", getOrderedTableNames(), cyclicTables);
    }
}
