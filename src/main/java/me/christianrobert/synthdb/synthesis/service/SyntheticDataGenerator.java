package me.christianrobert.synthdb.synthesis.service;

import me.christianrobert.synthdb.dependency.model.DependencyResolution;
import me.christianrobert.synthdb.dependency.service.TableDependencyResolver;
import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.semantic.model.SemanticType;
import me.christianrobert.synthdb.semantic.service.SemanticClassifier;
import me.christianrobert.synthdb.synthesis.context.RowContext;
import me.christianrobert.synthdb.synthesis.model.GeneratedTable;
import me.christianrobert.synthdb.synthesis.model.SqlValue;
import me.christianrobert.synthdb.synthesis.model.SynthesisOptions;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import me.christianrobert.synthdb.synthesis.service.GenerationPlan.PlannedColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * Generates rows for a whole schema.
 *
 * Flow:
 * 1. Resolve the insertion order once
 * 2. Per table, in that order: classify every column once ({@link GenerationPlan})
 * 3. Per row: fresh {@link RowContext}, generate columns in priority order, project to
 *    declaration order
 * 4. After each row, append its primary key and every column a foreign key points at to
 *    the {@link ReferencePool}
 *
 * Foreign keys draw from the referenced column's pool; the columns of a composite key draw
 * one referenced row together. When the pool is empty:
 * - self reference: NULL if the column is nullable, otherwise the default substitute
 * - reference into a dependency cycle not generated yet: NULL if nullable
 * - anything else: the default substitute, counted as an unresolved reference
 */
public class SyntheticDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyntheticDataGenerator.class);

    private final SemanticClassifier classifier;
    private final Clock clock;

    public SyntheticDataGenerator() {
        this(new SemanticClassifier(), Clock.systemDefaultZone());
    }

    public SyntheticDataGenerator(SemanticClassifier classifier, Clock clock) {
        this.classifier = classifier;
        this.clock = clock;
    }

    public SynthesisResult generate(List<TableMetadata> tables, SynthesisOptions options) {
        return generate(tables, options, null);
    }

    /**
     * @param tables           the schema
     * @param options          rows per table and optional seed
     * @param tableListener    notified after each table, may be null
     */
    public SynthesisResult generate(List<TableMetadata> tables, SynthesisOptions options,
                                    Consumer<GeneratedTable> tableListener) {
        long startTime = System.currentTimeMillis();
        long seed = options.hasSeed() ? options.getSeed() : ThreadLocalRandom.current().nextLong();
        Random random = new Random(seed);

        ReferencePool referencePool = new ReferencePool();
        ValueSynthesizer synthesizer = new ValueSynthesizer(random, clock, referencePool);

        DependencyResolution resolution = TableDependencyResolver.resolve(tables);
        SynthesisResult result = new SynthesisResult(seed);
        result.addCyclicTables(resolution.getCyclicTables());

        Set<String> pendingCyclicTables = new HashSet<>();
        resolution.getCyclicTables().forEach(t -> pendingCyclicTables.add(t.toLowerCase()));

        log.info("Generating {} rows per table for {} tables (seed {})",
                options.getRowsPerTable(), resolution.getOrderedTables().size(), seed);

        Map<String, Set<String>> referencedColumns = referencedColumnsByTable(tables);

        for (TableMetadata table : resolution.getOrderedTables()) {
            GeneratedTable generated = generateTable(table, options.getRowsPerTable(), synthesizer, referencePool,
                    referencedColumns.getOrDefault(table.getTableName().toLowerCase(), Set.of()),
                    pendingCyclicTables, result);
            pendingCyclicTables.remove(table.getTableName().toLowerCase());
            result.addGeneratedTable(generated);
            if (tableListener != null) {
                tableListener.accept(generated);
            }
        }

        result.setGenerationMillis(System.currentTimeMillis() - startTime);
        if (result.getUnresolvedReferenceCount() > 0) {
            log.warn("{} foreign key values had no referenced row and were substituted: {}",
                    result.getUnresolvedReferenceCount(), result.getUnresolvedReferences());
        }
        log.info("Generated {} rows in {} tables in {} ms",
                result.getTotalRows(), result.getGeneratedTables().size(), result.getGenerationMillis());
        return result;
    }

    /**
     * Lowercased column names some foreign key points at, by lowercased referenced table.
     */
    static Map<String, Set<String>> referencedColumnsByTable(List<TableMetadata> tables) {
        Map<String, Set<String>> result = new HashMap<>();
        for (TableMetadata table : tables) {
            for (ForeignKeyMetadata fk : table.getForeignKeys()) {
                if (fk.getReferencedTable() != null && fk.getReferencedColumn() != null) {
                    result.computeIfAbsent(fk.getReferencedTable().toLowerCase(), k -> new HashSet<>())
                            .add(fk.getReferencedColumn().toLowerCase());
                }
            }
        }
        return result;
    }

    GeneratedTable generateTable(TableMetadata table, int rowCount, ValueSynthesizer synthesizer,
                                 ReferencePool referencePool, Set<String> referencedColumns,
                                 Set<String> pendingCyclicTables, SynthesisResult result) {
        GenerationPlan plan = GenerationPlan.build(table, classifier);
        log.debug("Generation plan for {}: {}", table.getTableName(), plan.getGenerationOrder());

        List<List<SqlValue>> rows = new ArrayList<>(rowCount);
        if (plan.size() == 0) {
            log.warn("Table {} has no columns, no rows generated", table.getTableName());
            return new GeneratedTable(table, plan.getColumnNames(), rows);
        }

        PlannedColumn primaryKey = plan.getPrimaryKeyColumn().orElse(null);
        List<PlannedColumn> recorded = plan.getOutputOrder().stream()
                .filter(c -> c == primaryKey || referencedColumns.contains(c.getColumn().getColumnName().toLowerCase()))
                .toList();
        if (primaryKey == null) {
            log.debug("Table {} has no primary key column, references to it will be substituted", table.getTableName());
        }
        Map<String, List<ForeignKeyMetadata>> compositeKeys = compositeForeignKeys(table);

        for (int rowIndex = 0; rowIndex < rowCount; rowIndex++) {
            RowContext context = new RowContext();
            SqlValue[] row = new SqlValue[plan.size()];
            Map<String, String> drawnReferences = drawCompositeReferences(compositeKeys, synthesizer);

            for (PlannedColumn planned : plan.getGenerationOrder()) {
                String drawn = drawnReferences.get(planned.getColumn().getColumnName().toLowerCase());
                SqlValue value = drawn != null
                        ? synthesizer.referenceValue(planned.getColumn(), drawn)
                        : generateValue(table, planned, context, rowIndex, synthesizer,
                                referencePool, pendingCyclicTables, result);
                row[planned.getPosition()] = value;
                context.record(planned.getColumn().getColumnName(), planned.getType().getCategory(), value.getRaw());
            }

            rows.add(Arrays.asList(row));

            // Recorded after the row is complete, so a self reference never points at its own row
            if (!recorded.isEmpty()) {
                Map<String, String> values = new HashMap<>();
                recorded.forEach(c -> values.put(c.getColumn().getColumnName(), row[c.getPosition()].getRaw()));
                referencePool.addRow(table.getTableName(),
                        primaryKey != null ? primaryKey.getColumn().getColumnName() : null, values);
            }
        }

        log.debug("Generated {} rows for table {}", rows.size(), table.getTableName());
        return new GeneratedTable(table, plan.getColumnNames(), rows);
    }

    /**
     * Foreign keys spanning several columns, grouped by constraint name.
     */
    static Map<String, List<ForeignKeyMetadata>> compositeForeignKeys(TableMetadata table) {
        Map<String, List<ForeignKeyMetadata>> byConstraint = new LinkedHashMap<>();
        for (ForeignKeyMetadata fk : table.getForeignKeys()) {
            if (fk.getConstraintName() != null) {
                byConstraint.computeIfAbsent(fk.getConstraintName(), k -> new ArrayList<>()).add(fk);
            }
        }
        byConstraint.values().removeIf(fks -> fks.size() < 2
                || fks.stream().anyMatch(fk -> fk.getReferencedColumn() == null));
        return byConstraint;
    }

    /**
     * One referenced row per composite key, so all its columns point at the same row.
     * Keys with no qualifying row are left out and fall back to per-column handling.
     */
    private static Map<String, String> drawCompositeReferences(Map<String, List<ForeignKeyMetadata>> compositeKeys,
                                                               ValueSynthesizer synthesizer) {
        if (compositeKeys.isEmpty()) {
            return Map.of();
        }
        Map<String, String> drawn = new HashMap<>();
        for (List<ForeignKeyMetadata> fks : compositeKeys.values()) {
            List<String> referencedColumns = fks.stream().map(ForeignKeyMetadata::getReferencedColumn).toList();
            synthesizer.drawReferencedRow(fks.get(0).getReferencedTable(), referencedColumns).ifPresent(values -> {
                for (ForeignKeyMetadata fk : fks) {
                    drawn.put(fk.getColumnName().toLowerCase(), values.get(fk.getReferencedColumn()));
                }
            });
        }
        return drawn;
    }

    private SqlValue generateValue(TableMetadata table, PlannedColumn planned, RowContext context, int rowIndex,
                                   ValueSynthesizer synthesizer, ReferencePool referencePool,
                                   Set<String> pendingCyclicTables, SynthesisResult result) {
        SemanticType type = planned.getType();
        ColumnMetadata column = planned.getColumn();

        if (type.isForeignKey()
                && referencePool.values(type.getReferencedTable(), type.getReferencedColumn()).isEmpty()) {
            String referenced = type.getReferencedTable();
            boolean selfReference = referenced != null && referenced.equalsIgnoreCase(table.getTableName());

            if (selfReference) {
                return column.isNullable() ? SqlValue.nullValue() : synthesizer.defaultSubstitute(column, rowIndex);
            }
            if (column.isNullable() && referenced != null && pendingCyclicTables.contains(referenced.toLowerCase())) {
                return SqlValue.nullValue();
            }

            log.debug("No rows available in {} for {}.{}, using default substitute",
                    referenced, table.getTableName(), column.getColumnName());
            result.addUnresolvedReference(table.getTableName(), column.getColumnName(), referenced);
            return synthesizer.defaultSubstitute(column, rowIndex);
        }

        return synthesizer.synthesize(type, column, context, rowIndex);
    }
}
