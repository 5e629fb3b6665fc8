package me.christianrobert.synthdb.dependency.service;

import me.christianrobert.synthdb.dependency.model.DependencyResolution;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Orders tables so that every table comes after all tables it references through foreign keys.
 *
 * Ordering rules:
 * 1. One edge per foreign key, oriented referenced table -> referencing table
 * 2. Self-referencing foreign keys add no edge (they never block a table)
 * 3. Foreign keys pointing outside the schema add no edge
 * 4. Tables left over by Kahn's algorithm (cycles) are appended in input order
 *
 * Step 4 keeps generation going, but rows of a cyclic table may reference a table
 * whose reference pool is still empty; those values take the default-substitution path.
 */
public class TableDependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(TableDependencyResolver.class);

    private TableDependencyResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Sorts tables by foreign-key dependency using Kahn's algorithm.
     *
     * @param tables all tables of the schema, in input order
     * @return the ordered tables plus the names of tables caught in cycles
     */
    public static DependencyResolution resolve(List<TableMetadata> tables) {
        // Keyed by lower-cased table name, preserving input order
        Map<String, TableMetadata> tablesByName = new LinkedHashMap<>();
        for (TableMetadata table : tables) {
            String key = normalize(table.getTableName());
            if (tablesByName.putIfAbsent(key, table) != null) {
                log.warn("Duplicate table name '{}' in schema description, keeping the first occurrence",
                        table.getTableName());
            }
        }

        // Graph: referenced table -> tables that reference it
        Map<String, Set<String>> successors = new HashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String table : tablesByName.keySet()) {
            successors.put(table, new LinkedHashSet<>());
            inDegree.put(table, 0);
        }

        for (Map.Entry<String, TableMetadata> entry : tablesByName.entrySet()) {
            String referencing = entry.getKey();
            for (ForeignKeyMetadata fk : entry.getValue().getForeignKeys()) {
                String referenced = normalize(fk.getReferencedTable());

                if (referencing.equals(referenced)) {
                    log.debug("FK {}.{} is self-referencing, ignored for ordering",
                            referencing, fk.getColumnName());
                    continue;
                }
                if (!tablesByName.containsKey(referenced)) {
                    log.debug("FK {}.{} references unknown table {}, ignored for ordering",
                            referencing, fk.getColumnName(), referenced);
                    continue;
                }

                // Several FKs between the same pair count as one edge
                if (successors.get(referenced).add(referencing)) {
                    inDegree.put(referencing, inDegree.get(referencing) + 1);
                    log.debug("FK dependency: {} -> {} (FK column: {})", referenced, referencing, fk.getColumnName());
                }
            }
        }

        // Start with tables that reference nothing (in-degree = 0)
        Queue<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        List<String> sortedTables = new ArrayList<>();
        while (!queue.isEmpty()) {
            String table = queue.poll();
            sortedTables.add(table);

            for (String successor : successors.get(table)) {
                int newInDegree = inDegree.get(successor) - 1;
                inDegree.put(successor, newInDegree);
                if (newInDegree == 0) {
                    queue.offer(successor);
                }
            }
        }

        // Check for circular dependencies
        List<String> cyclicTables = new ArrayList<>();
        if (sortedTables.size() < tablesByName.size()) {
            Set<String> placed = new HashSet<>(sortedTables);
            for (String table : tablesByName.keySet()) {
                if (!placed.contains(table)) {
                    cyclicTables.add(table);
                }
            }
            log.warn("Circular FK dependencies detected! {} tables out of {} could not be sorted topologically",
                    cyclicTables.size(), tablesByName.size());
            log.warn("Tables with circular dependencies (appended in input order): {}", cyclicTables);
            sortedTables.addAll(cyclicTables);
        }

        List<TableMetadata> orderedTables = new ArrayList<>();
        for (String table : sortedTables) {
            orderedTables.add(tablesByName.get(table));
        }

        List<String> cyclicTableNames = cyclicTables.stream()
                .map(t -> tablesByName.get(t).getTableName())
                .toList();

        log.info("Resolved insertion order for {} tables ({} in cycles)", orderedTables.size(), cyclicTableNames.size());
        return new DependencyResolution(orderedTables, cyclicTableNames);
    }

    private static String normalize(String tableName) {
        return tableName == null ? "" : tableName.trim().toLowerCase();
    }
}
