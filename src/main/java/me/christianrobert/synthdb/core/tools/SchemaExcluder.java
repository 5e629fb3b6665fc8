package me.christianrobert.synthdb.core.tools;

/**
 * PostgreSQL catalog schemas that never hold user tables worth cloning.
 */
public class SchemaExcluder {
  public static boolean isToBeExcluded(String schema) {
    if (schema == null || schema.isBlank())
      return true;
    if (schema.matches("^(information_schema|pg_catalog|pg_toast)$"))
      return true;
    return schema.startsWith("pg_temp_") || schema.startsWith("pg_toast_temp_");
  }
}
