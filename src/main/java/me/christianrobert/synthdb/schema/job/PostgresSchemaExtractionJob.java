package me.christianrobert.synthdb.schema.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.synthdb.config.service.ConfigService;
import me.christianrobert.synthdb.core.job.AbstractSchemaExtractionJob;
import me.christianrobert.synthdb.core.job.model.JobProgress;
import me.christianrobert.synthdb.database.service.PostgresConnectionService;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.schema.service.PostgresSchemaIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Introspects the configured source schemas (tables, columns, keys and sample values)
 * and makes them the current schema in state.
 */
@Dependent
public class PostgresSchemaExtractionJob extends AbstractSchemaExtractionJob<TableMetadata> {

    private static final Logger log = LoggerFactory.getLogger(PostgresSchemaExtractionJob.class);

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Override
    public String getDatabase() {
        return "POSTGRES";
    }

    @Override
    public String getOperationType() {
        return "SCHEMA_METADATA";
    }

    @Override
    public Class<TableMetadata> getResultType() {
        return TableMetadata.class;
    }

    @Override
    protected void storeResult(List<TableMetadata> results) {
        stateService.setTableMetadata(results, configService.getConfigValueAsString(ConfigService.SOURCE_URL));
    }

    @Override
    protected List<TableMetadata> run(Consumer<JobProgress> progressCallback) throws Exception {
        List<String> schemas = determineSchemasToProcess(progressCallback);

        Integer configuredLimit = configService.getConfigValueAsInteger(ConfigService.SOURCE_SAMPLE_LIMIT);
        int sampleLimit = configuredLimit != null ? configuredLimit : PostgresSchemaIntrospector.DEFAULT_SAMPLE_LIMIT;

        updateProgress(progressCallback, 5, "Connecting to PostgreSQL", "Establishing database connection");

        List<TableMetadata> tables = new ArrayList<>();
        try (Connection connection = postgresConnectionService.getConnection()) {
            updateProgress(progressCallback, 10, "Connected", "Successfully connected to PostgreSQL database");

            int processed = 0;
            for (String schema : schemas) {
                updateProgress(progressCallback,
                        10 + (processed * 80 / schemas.size()),
                        "Processing schema: " + schema,
                        String.format("Schema %d of %d", processed + 1, schemas.size()));

                tables.addAll(PostgresSchemaIntrospector.extractAllTables(connection, List.of(schema), sampleLimit));
                processed++;
            }
        }

        log.info("Extracted {} tables from {} schema(s)", tables.size(), schemas.size());
        return tables;
    }

    @Override
    protected String summarize(List<TableMetadata> results) {
        long foreignKeys = results.stream().mapToLong(t -> t.getForeignKeys().size()).sum();
        return String.format("Extraction completed: %d tables with %d foreign keys", results.size(), foreignKeys);
    }

    public void setPostgresConnectionService(PostgresConnectionService postgresConnectionService) {
        this.postgresConnectionService = postgresConnectionService;
    }
}
