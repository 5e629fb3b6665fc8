package me.christianrobert.synthdb.schema.model;

/**
 * Abstract type tag derived from a column's declared (catalog) data type.
 * The synthesis engine only reasons about these tags, never about vendor type names.
 */
public enum DataTypeTag {
    INTEGER,
    DECIMAL,
    BOOLEAN,
    TEXT,
    DATE,
    TIMESTAMP,
    UUID,
    JSON,
    ARRAY,
    NETWORK_ADDRESS,
    HARDWARE_ADDRESS,
    UNKNOWN;

    /**
     * Maps a PostgreSQL-style declared type name to its tag.
     *
     * Examples:
     * - "integer", "int8", "bigserial" -> INTEGER
     * - "numeric(10,2)", "double precision" -> DECIMAL
     * - "character varying" -> TEXT
     * - "timestamp with time zone" -> TIMESTAMP
     * - "ARRAY", "_text", "text[]" -> ARRAY
     * - "inet" -> NETWORK_ADDRESS, "macaddr" -> HARDWARE_ADDRESS
     *
     * @param declaredType the declared type, may be null
     * @return the tag, UNKNOWN when the type is null or not recognized
     */
    public static DataTypeTag fromDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.trim().isEmpty()) {
            return UNKNOWN;
        }

        String type = declaredType.trim().toLowerCase();

        if (type.equals("array") || type.endsWith("[]") || type.startsWith("_")) {
            return ARRAY;
        }

        // Strip type modifiers: numeric(10,2) -> numeric
        int paren = type.indexOf('(');
        if (paren > 0) {
            type = type.substring(0, paren).trim();
        }

        switch (type) {
            case "smallint", "integer", "int", "bigint", "int2", "int4", "int8",
                 "smallserial", "serial", "bigserial", "serial2", "serial4", "serial8":
                return INTEGER;
            case "numeric", "decimal", "real", "double precision", "float", "float4", "float8", "money":
                return DECIMAL;
            case "boolean", "bool":
                return BOOLEAN;
            case "text", "character varying", "varchar", "character", "char", "bpchar", "citext", "name":
                return TEXT;
            case "date":
                return DATE;
            case "uuid":
                return UUID;
            case "json", "jsonb":
                return JSON;
            case "inet", "cidr":
                return NETWORK_ADDRESS;
            case "macaddr", "macaddr8":
                return HARDWARE_ADDRESS;
            default:
                break;
        }

        if (type.startsWith("timestamp")) {
            return TIMESTAMP;
        }
        return UNKNOWN;
    }

    /**
     * Largest value an integer column of the declared type can hold: 32767 for smallint,
     * Long.MAX_VALUE for bigint, 2147483647 for every other integer type.
     * Non-integer types report Long.MAX_VALUE.
     */
    public static long integerMaximum(String declaredType) {
        if (fromDeclaredType(declaredType) != INTEGER) {
            return Long.MAX_VALUE;
        }
        switch (declaredType.trim().toLowerCase()) {
            case "smallint", "int2", "smallserial", "serial2":
                return Short.MAX_VALUE;
            case "bigint", "int8", "bigserial", "serial8":
                return Long.MAX_VALUE;
            default:
                return Integer.MAX_VALUE;
        }
    }

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }

    /**
     * Whether literals of this type are written unquoted in SQL.
     */
    public boolean isUnquotedLiteral() {
        return this == INTEGER || this == DECIMAL || this == BOOLEAN;
    }
}
