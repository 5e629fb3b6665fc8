package me.christianrobert.synthdb.synthesis.model;

import java.util.Objects;

/**
 * One generated column value, kept raw (unescaped) together with how it must be rendered
 * as a SQL literal.
 */
public final class SqlValue {

    public enum Kind {
        /** Rendered inside single quotes, embedded quotes doubled. */
        QUOTED,
        /** Rendered as is: numbers, booleans. */
        UNQUOTED,
        /** Rendered as NULL. */
        NULL
    }

    private static final SqlValue NULL_VALUE = new SqlValue(null, Kind.NULL);

    private final String raw;
    private final Kind kind;

    private SqlValue(String raw, Kind kind) {
        this.raw = raw;
        this.kind = kind;
    }

    public static SqlValue quoted(String raw) {
        return raw == null ? NULL_VALUE : new SqlValue(raw, Kind.QUOTED);
    }

    public static SqlValue unquoted(String raw) {
        return raw == null ? NULL_VALUE : new SqlValue(raw, Kind.UNQUOTED);
    }

    public static SqlValue nullValue() {
        return NULL_VALUE;
    }

    public String getRaw() {
        return raw;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Renders the value as a PostgreSQL literal.
     */
    public String toSql() {
        return switch (kind) {
            case NULL -> "NULL";
            case UNQUOTED -> raw;
            case QUOTED -> "'" + raw.replace("'", "''") + "'";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlValue that)) return false;
        return kind == that.kind && Objects.equals(raw, that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw, kind);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
