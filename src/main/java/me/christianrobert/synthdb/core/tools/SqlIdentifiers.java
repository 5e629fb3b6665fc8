package me.christianrobert.synthdb.core.tools;

import java.util.Set;

/**
 * PostgreSQL identifier handling for generated SQL.
 *
 * Identifiers are written bare whenever PostgreSQL accepts them bare, so dumps stay readable
 * ({@code INSERT INTO employees (id, name, status)}), and double-quoted otherwise.
 */
public class SqlIdentifiers {

  /**
   * Keywords PostgreSQL reserves outright (category "reserved" in the SQL key words appendix).
   * Non-reserved keywords such as "name", "type" or "value" are valid bare column names.
   */
  private static final Set<String> RESERVED_WORDS = Set.of(
          "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric", "authorization",
          "binary", "both", "case", "cast", "check", "collate", "collation", "column", "concurrently",
          "constraint", "create", "cross", "current_catalog", "current_date", "current_role",
          "current_schema", "current_time", "current_timestamp", "current_user", "default", "deferrable",
          "desc", "distinct", "do", "else", "end", "except", "false", "fetch", "for", "foreign", "freeze",
          "from", "full", "grant", "group", "having", "ilike", "in", "initially", "inner", "intersect",
          "into", "is", "isnull", "join", "lateral", "leading", "left", "like", "limit", "localtime",
          "localtimestamp", "natural", "not", "notnull", "null", "offset", "on", "only", "or", "order",
          "outer", "overlaps", "placing", "primary", "references", "returning", "right", "select",
          "session_user", "similar", "some", "symmetric", "system_user", "table", "tablesample", "then",
          "to", "trailing", "true", "union", "unique", "user", "using", "variadic", "verbose", "when",
          "where", "window", "with"
  );

  private SqlIdentifiers() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  public static boolean isReservedWord(String identifier) {
    if (identifier == null || identifier.trim().isEmpty()) {
      return false;
    }
    return RESERVED_WORDS.contains(identifier.trim().toLowerCase());
  }

  /**
   * Quotes an identifier if PostgreSQL would not accept it bare.
   *
   * An identifier needs quoting if:
   * - It's a reserved word
   * - It starts with a digit
   * - It contains anything other than lower-case letters, digits, underscore and '$'
   *   (upper-case letters would otherwise be folded to lower case)
   *
   * Embedded double quotes are doubled.
   */
  public static String quoteIdentifier(String identifier) {
    if (identifier == null || identifier.trim().isEmpty()) {
      return identifier;
    }

    String trimmed = identifier.trim();
    if (needsQuoting(trimmed)) {
      return "\"" + trimmed.replace("\"", "\"\"") + "\"";
    }
    return trimmed;
  }

  /**
   * Quotes a possibly schema-qualified name part by part: {@code public.Orders -> public."Orders"}.
   */
  public static String quoteQualifiedName(String schema, String name) {
    if (schema == null || schema.isBlank()) {
      return quoteIdentifier(name);
    }
    return quoteIdentifier(schema) + "." + quoteIdentifier(name);
  }

  private static boolean needsQuoting(String identifier) {
    if (isReservedWord(identifier)) {
      return true;
    }

    char first = identifier.charAt(0);
    if (!(isLowerLetter(first) || first == '_')) {
      return true;
    }

    for (int i = 1; i < identifier.length(); i++) {
      char c = identifier.charAt(i);
      if (!(isLowerLetter(c) || Character.isDigit(c) || c == '_' || c == '$')) {
        return true;
      }
    }
    return false;
  }

  private static boolean isLowerLetter(char c) {
    return Character.isLetter(c) && !Character.isUpperCase(c);
  }
}
