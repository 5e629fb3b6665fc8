package me.christianrobert.synthdb.semantic.service;

import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.DataTypeTag;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.semantic.model.SemanticCategory;
import me.christianrobert.synthdb.semantic.model.SemanticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns a {@link SemanticType} to a column. First match wins:
 *
 * 1. Foreign-key participation -> FOREIGN_KEY(referenced table)
 * 2. Primary key: explicit flag, "id", or "&lt;table&gt;_id" / "&lt;singular table&gt;_id"
 * 3. Pattern of the first sampled value (MAC, IPv4, email, closed vocabularies)
 * 4. Declared type shortcut: uuid -> UUID, boolean -> BOOLEAN_FLAG
 * 5. Ordered name rules ({@link NameRules#DEFAULT_RULES})
 * 6. Declared type fallback
 *
 * Steps 3 and 5 only assign categories that the declared type can hold, so an integer
 * "created_at" column is not turned into a timestamp string.
 *
 * The classifier is stateless; the same inputs always give the same result.
 */
public class SemanticClassifier {

    private static final Logger log = LoggerFactory.getLogger(SemanticClassifier.class);

    private final List<ClassificationRule> rules;

    public SemanticClassifier() {
        this(NameRules.DEFAULT_RULES);
    }

    public SemanticClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Classifies a column of the given table, looking up its foreign key and samples from the metadata.
     */
    public SemanticType classify(ColumnMetadata column, TableMetadata table) {
        Optional<ForeignKeyMetadata> fk = table.findForeignKey(column.getColumnName());
        return classify(column, table.getTableName(), fk.isPresent(),
                fk.map(ForeignKeyMetadata::getReferencedTable).orElse(null),
                fk.map(ForeignKeyMetadata::getReferencedColumn).orElse(null),
                column.getSampleValues());
    }

    public SemanticType classify(ColumnMetadata column, String tableName, boolean isForeignKey,
                                 String referencedTable, List<String> sampleValues) {
        return classify(column, tableName, isForeignKey, referencedTable, null, sampleValues);
    }

    private SemanticType classify(ColumnMetadata column, String tableName, boolean isForeignKey,
                                  String referencedTable, String referencedColumn, List<String> sampleValues) {
        String columnName = column.getColumnName();
        DataTypeTag typeTag = column.getTypeTag();

        // 1. Foreign key
        if (isForeignKey) {
            log.debug("Classified {}.{} as FOREIGN_KEY -> {}", tableName, columnName, referencedTable);
            return SemanticType.foreignKey(referencedTable, referencedColumn);
        }

        // 2. Primary key
        if (column.isPrimaryKey() || isPrimaryKeyByConvention(columnName, tableName)) {
            log.debug("Classified {}.{} as PRIMARY_KEY", tableName, columnName);
            return SemanticType.of(SemanticCategory.PRIMARY_KEY);
        }

        // 3. Sampled value pattern
        if (sampleValues != null && !sampleValues.isEmpty()) {
            Optional<SemanticCategory> inferred = SamplePatternInference.infer(sampleValues.get(0))
                    .filter(category -> category.isCompatibleWith(typeTag));
            if (inferred.isPresent()) {
                log.debug("Classified {}.{} as {} from sample value", tableName, columnName, inferred.get());
                return SemanticType.of(inferred.get());
            }
        }

        // 4. Declared type shortcut
        if (typeTag == DataTypeTag.UUID) {
            return SemanticType.of(SemanticCategory.UUID);
        }
        if (typeTag == DataTypeTag.BOOLEAN) {
            return SemanticType.of(SemanticCategory.BOOLEAN_FLAG);
        }

        // 5. Name rules
        ColumnName name = new ColumnName(columnName, tableName, typeTag);
        for (ClassificationRule rule : rules) {
            if (rule.matches(name) && rule.getCategory().isCompatibleWith(typeTag)) {
                log.debug("Classified {}.{} as {} (rule '{}')", tableName, columnName, rule.getCategory(), rule.getName());
                return SemanticType.of(rule.getCategory());
            }
        }

        // 6. Declared type fallback
        SemanticCategory fallback = fallbackFor(typeTag);
        log.debug("Classified {}.{} as {} (type fallback for {})", tableName, columnName, fallback, typeTag);
        return SemanticType.of(fallback);
    }

    static SemanticCategory fallbackFor(DataTypeTag typeTag) {
        return switch (typeTag) {
            case INTEGER -> SemanticCategory.GENERIC_INTEGER;
            case DECIMAL -> SemanticCategory.GENERIC_DECIMAL;
            case BOOLEAN -> SemanticCategory.BOOLEAN_FLAG;
            case TEXT -> SemanticCategory.GENERIC_TEXT;
            case DATE -> SemanticCategory.GENERIC_DATE;
            case TIMESTAMP -> SemanticCategory.GENERIC_TIMESTAMP;
            case UUID -> SemanticCategory.UUID;
            case JSON -> SemanticCategory.JSON_DOCUMENT;
            case ARRAY -> SemanticCategory.ARRAY_VALUE;
            case NETWORK_ADDRESS -> SemanticCategory.IPV4_ADDRESS;
            case HARDWARE_ADDRESS -> SemanticCategory.MAC_ADDRESS;
            case UNKNOWN -> SemanticCategory.UNRECOGNIZED;
        };
    }

    /**
     * A column is a primary key by convention when it is named "id" or "&lt;table&gt;_id",
     * where the table part may also be the singular of the table name.
     * "company_id" in table "employees" is not a primary key.
     */
    static boolean isPrimaryKeyByConvention(String columnName, String tableName) {
        if (columnName == null) {
            return false;
        }
        String column = columnName.trim().toLowerCase();
        if (column.equals("id")) {
            return true;
        }
        if (tableName == null || !column.endsWith("_id")) {
            return false;
        }
        String stem = column.substring(0, column.length() - 3);
        return tableStems(tableName.trim().toLowerCase()).contains(stem);
    }

    static Set<String> tableStems(String table) {
        Set<String> stems = new LinkedHashSet<>();
        stems.add(table);
        if (table.endsWith("ies") && table.length() > 3) {
            stems.add(table.substring(0, table.length() - 3) + "y");
        }
        if (table.endsWith("sses") || table.endsWith("xes") || table.endsWith("ches") || table.endsWith("shes")) {
            stems.add(table.substring(0, table.length() - 2));
        }
        if (table.endsWith("s") && !table.endsWith("ss")) {
            stems.add(table.substring(0, table.length() - 1));
        }
        return stems;
    }
}
