package me.christianrobert.synthdb.semantic.service;

import me.christianrobert.synthdb.schema.model.DataTypeTag;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tokenized view of a column name (and its owning table name) that name rules match against.
 *
 * Tokenization splits on underscores, hyphens, whitespace and camelCase boundaries:
 * - "first_name"  -> [first, name], compact "firstname"
 * - "firstName"   -> [first, name], compact "firstname"
 * - "IPAddress"   -> [ipaddress],   compact "ipaddress"
 *
 * Token matching avoids accidental substring hits ("shipping" contains "ip",
 * "usage" contains "age"); substring matching on the compact form catches
 * concatenated names ("emailaddress", "companyname").
 */
public class ColumnName {

    private final String raw;
    private final List<String> tokens;
    private final Set<String> tokenSet;
    private final String compact;
    private final String tableName;
    private final Set<String> tableTokens;
    private final DataTypeTag typeTag;

    public ColumnName(String columnName, String tableName, DataTypeTag typeTag) {
        this.raw = columnName == null ? "" : columnName;
        this.tokens = tokenize(raw);
        this.tokenSet = new LinkedHashSet<>(tokens);
        this.compact = String.join("", tokens);
        this.tableName = tableName == null ? "" : tableName.trim().toLowerCase();
        this.tableTokens = new LinkedHashSet<>(tokenize(this.tableName));
        this.typeTag = typeTag == null ? DataTypeTag.UNKNOWN : typeTag;
    }

    static List<String> tokenize(String name) {
        if (name == null || name.isBlank()) {
            return Collections.emptyList();
        }
        String split = name.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .toLowerCase();
        return Arrays.stream(split.split("[^a-z0-9]+"))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    public String getRaw() {
        return raw;
    }

    public List<String> getTokens() {
        return tokens;
    }

    /**
     * Lower-cased name with all separators removed.
     */
    public String getCompact() {
        return compact;
    }

    public String getTableName() {
        return tableName;
    }

    public DataTypeTag getTypeTag() {
        return typeTag;
    }

    public boolean is(String... names) {
        for (String name : names) {
            if (compact.equals(name)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasToken(String... candidates) {
        for (String candidate : candidates) {
            if (tokenSet.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(String... fragments) {
        for (String fragment : fragments) {
            if (compact.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    public boolean lastTokenIs(String... candidates) {
        if (tokens.isEmpty()) {
            return false;
        }
        String last = tokens.get(tokens.size() - 1);
        for (String candidate : candidates) {
            if (last.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    public boolean tableHasToken(String... candidates) {
        for (String candidate : candidates) {
            if (tableTokens.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the name carries a date/time marker ("created_at", "due_date", "start_time")
     * or the column is declared with a temporal type.
     */
    public boolean hasTemporalMarker() {
        return typeTag.isTemporal()
                || hasToken("at", "on", "date", "time", "timestamp", "datetime", "ts", "dt");
    }

    @Override
    public String toString() {
        return tableName + "." + raw + " " + tokens;
    }
}
