package me.christianrobert.synthdb.dump.service;

import me.christianrobert.synthdb.core.tools.SqlIdentifiers;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.synthesis.model.GeneratedTable;
import me.christianrobert.synthdb.synthesis.model.SqlValue;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes generated rows as a transactional PostgreSQL script:
 *
 * <pre>
 * -- SynthDB Generated Dump
 * -- ...
 * BEGIN;
 * SET CONSTRAINTS ALL DEFERRED;
 *
 * -- Data for companies
 * INSERT INTO companies (id, name) VALUES
 * (1, 'Acme'),
 * (2, 'Initech');
 *
 * COMMIT;
 * </pre>
 *
 * One INSERT per table in insertion order, one tuple per row in declaration column order.
 * Tables outside the {@code public} schema are written schema-qualified.
 */
public class SqlDumpWriter {

    private static final Logger log = LoggerFactory.getLogger(SqlDumpWriter.class);

    private static final DateTimeFormatter HEADER_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public SqlDumpWriter() {
        this(Clock.systemDefaultZone());
    }

    public SqlDumpWriter(Clock clock) {
        this.clock = clock;
    }

    public void write(SynthesisResult result, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
        log.info("Wrote {} rows for {} tables to {}", result.getTotalRows(),
                result.getGeneratedTables().size(), outputPath.toAbsolutePath());
    }

    public void write(SynthesisResult result, Writer out) throws IOException {
        writeHeader(result, out);
        out.write("BEGIN;\n");
        out.write("SET CONSTRAINTS ALL DEFERRED;\n");

        for (GeneratedTable table : result.getGeneratedTables()) {
            out.write("\n");
            writeTable(table, out);
        }

        out.write("\n");
        out.write("COMMIT;\n");
        out.flush();
    }

    public String render(SynthesisResult result) {
        StringWriter writer = new StringWriter();
        try {
            write(result, writer);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    private void writeHeader(SynthesisResult result, Writer out) throws IOException {
        out.write("-- SynthDB Generated Dump\n");
        out.write("-- Generated: " + LocalDateTime.now(clock).format(HEADER_TIMESTAMP) + "\n");
        out.write("-- Seed: " + result.getSeed() + "\n");
        out.write("-- Tables: " + result.getGeneratedTables().size() + ", rows: " + result.getTotalRows() + "\n");
        if (result.hasCycles()) {
            out.write("-- Warning: circular foreign keys between " + String.join(", ", result.getCyclicTables()) + "\n");
        }
    }

    void writeTable(GeneratedTable table, Writer out) throws IOException {
        String tableName = tableReference(table.getTable());
        out.write("-- Data for " + table.getTableName() + "\n");

        if (table.getColumnNames().isEmpty()) {
            out.write("-- Table " + tableName + " has no columns, skipped\n");
            return;
        }
        if (table.getRowCount() == 0) {
            out.write("-- No rows generated for " + tableName + "\n");
            return;
        }

        String columnList = table.getColumnNames().stream()
                .map(SqlIdentifiers::quoteIdentifier)
                .collect(Collectors.joining(", "));
        out.write("INSERT INTO " + tableName + " (" + columnList + ") VALUES\n");

        List<List<SqlValue>> rows = table.getRows();
        for (int i = 0; i < rows.size(); i++) {
            String tuple = rows.get(i).stream().map(SqlValue::toSql).collect(Collectors.joining(", "));
            out.write("(" + tuple + ")" + (i < rows.size() - 1 ? "," : ";") + "\n");
        }
    }

    static String tableReference(TableMetadata table) {
        String schema = table.getSchema();
        if (schema == null || schema.isBlank() || schema.equalsIgnoreCase("public")) {
            return SqlIdentifiers.quoteIdentifier(table.getTableName());
        }
        return SqlIdentifiers.quoteQualifiedName(schema, table.getTableName());
    }
}
