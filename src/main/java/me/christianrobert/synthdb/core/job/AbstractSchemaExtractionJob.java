package me.christianrobert.synthdb.core.job;

import me.christianrobert.synthdb.config.service.ConfigService;
import me.christianrobert.synthdb.core.job.model.JobProgress;
import me.christianrobert.synthdb.core.tools.SchemaExcluder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Jobs that read metadata for the schemas listed in {@code source.schemas}.
 *
 * @param <T> element type of the extracted list
 */
public abstract class AbstractSchemaExtractionJob<T> extends AbstractJob<List<T>> {

    private static final Logger log = LoggerFactory.getLogger(AbstractSchemaExtractionJob.class);

    @Override
    protected String failureLabel() {
        return getOperationType() + " extraction";
    }

    /**
     * Configured schemas without PostgreSQL's own catalogs.
     *
     * @throws IllegalStateException if nothing usable is configured
     */
    protected List<String> determineSchemasToProcess(Consumer<JobProgress> progressCallback) {
        List<String> configured = configService.getConfigValueAsStringList(ConfigService.SOURCE_SCHEMAS);
        List<String> schemas = configured.stream()
                .filter(schema -> !SchemaExcluder.isToBeExcluded(schema))
                .collect(Collectors.toList());

        if (schemas.size() < configured.size()) {
            log.warn("Ignoring system schemas in configuration: {}", configured);
        }
        if (schemas.isEmpty()) {
            updateProgress(progressCallback, 100, "Configuration error",
                    "No schema configured in " + ConfigService.SOURCE_SCHEMAS);
            throw new IllegalStateException("No schema configured in " + ConfigService.SOURCE_SCHEMAS);
        }

        updateProgress(progressCallback, 0, "Using schema(s)", String.join(", ", schemas));
        return schemas;
    }

    @Override
    protected String summarize(List<T> results) {
        return String.format("Extraction completed: %d %s", results.size(),
                getOperationType().replace('_', ' ').toLowerCase());
    }
}
