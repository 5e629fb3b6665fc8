package me.christianrobert.synthdb.synthesis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a generation run: the generated tables in insertion order plus the degradations
 * the run went through (dependency cycles, foreign keys that had to be substituted).
 */
public class SynthesisResult {

    private final long seed;
    private final List<GeneratedTable> generatedTables = new ArrayList<>();
    private final List<String> cyclicTables = new ArrayList<>();
    private final Map<String, UnresolvedReference> unresolvedReferences = new LinkedHashMap<>();
    private final LocalDateTime executionDateTime = LocalDateTime.now();
    private long generationMillis;
    private String outputPath;

    public SynthesisResult(long seed) {
        this.seed = seed;
    }

    public void addGeneratedTable(GeneratedTable table) {
        generatedTables.add(table);
    }

    public void addCyclicTables(List<String> tables) {
        cyclicTables.addAll(tables);
    }

    /**
     * Counts one foreign-key value that could not be drawn from the referenced table's pool.
     */
    public void addUnresolvedReference(String table, String column, String referencedTable) {
        String key = table + "." + column + " -> " + referencedTable;
        unresolvedReferences.computeIfAbsent(key, k -> new UnresolvedReference(table, column, referencedTable))
                .increment();
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Generated tables in insertion order. Not serialized; REST clients get the counts instead.
     */
    @JsonIgnore
    public List<GeneratedTable> getGeneratedTables() {
        return new ArrayList<>(generatedTables);
    }

    public Map<String, Integer> getRowCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GeneratedTable table : generatedTables) {
            counts.put(table.getTableName(), table.getRowCount());
        }
        return counts;
    }

    public List<String> getInsertionOrder() {
        return generatedTables.stream().map(GeneratedTable::getTableName).toList();
    }

    public long getTotalRows() {
        return generatedTables.stream().mapToLong(GeneratedTable::getRowCount).sum();
    }

    public List<String> getCyclicTables() {
        return new ArrayList<>(cyclicTables);
    }

    public boolean hasCycles() {
        return !cyclicTables.isEmpty();
    }

    public List<UnresolvedReference> getUnresolvedReferences() {
        return new ArrayList<>(unresolvedReferences.values());
    }

    public int getUnresolvedReferenceCount() {
        return unresolvedReferences.values().stream().mapToInt(UnresolvedReference::getCount).sum();
    }

    public LocalDateTime getExecutionDateTime() {
        return executionDateTime;
    }

    public long getGenerationMillis() {
        return generationMillis;
    }

    public void setGenerationMillis(long generationMillis) {
        this.generationMillis = generationMillis;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    /**
     * A foreign-key column whose values took the default-substitution path.
     */
    public static class UnresolvedReference {
        private final String table;
        private final String column;
        private final String referencedTable;
        private int count;

        public UnresolvedReference(String table, String column, String referencedTable) {
            this.table = table;
            this.column = column;
            this.referencedTable = referencedTable;
        }

        void increment() {
            count++;
        }

        public String getTable() {
            return table;
        }

        public String getColumn() {
            return column;
        }

        public String getReferencedTable() {
            return referencedTable;
        }

        public int getCount() {
            return count;
        }

        @Override
        public String toString() {
            return String.format("%s.%s -> %s (%d values substituted)", table, column, referencedTable, count);
        }
    }

    @Override
    public String toString() {
        return String.format("SynthesisResult{tables=%d, rows=%d, cyclic=%s, unresolvedReferences=%d, seed=%d}",
                generatedTables.size(), getTotalRows(), cyclicTables, getUnresolvedReferenceCount(), seed);
    }
}
