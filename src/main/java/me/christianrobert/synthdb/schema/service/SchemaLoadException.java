package me.christianrobert.synthdb.schema.service;

/**
 * Thrown when a schema description cannot be acquired, from a file or from a live database.
 * Fatal for a generation run: nothing is written.
 */
public class SchemaLoadException extends Exception {

    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
