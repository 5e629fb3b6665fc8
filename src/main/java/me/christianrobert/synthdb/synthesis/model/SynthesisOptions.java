package me.christianrobert.synthdb.synthesis.model;

/**
 * Parameters of one generation run.
 */
public class SynthesisOptions {

    public static final int DEFAULT_ROWS_PER_TABLE = 100;

    private final int rowsPerTable;
    private final Long seed; // null means a random seed is drawn per run

    public SynthesisOptions(int rowsPerTable, Long seed) {
        if (rowsPerTable < 1) {
            throw new IllegalArgumentException("Rows per table must be at least 1, got " + rowsPerTable);
        }
        this.rowsPerTable = rowsPerTable;
        this.seed = seed;
    }

    public static SynthesisOptions defaults() {
        return new SynthesisOptions(DEFAULT_ROWS_PER_TABLE, null);
    }

    public int getRowsPerTable() {
        return rowsPerTable;
    }

    public Long getSeed() {
        return seed;
    }

    public boolean hasSeed() {
        return seed != null;
    }

    @Override
    public String toString() {
        return "SynthesisOptions{rowsPerTable=" + rowsPerTable + ", seed=" + seed + "}";
    }
}
