package me.christianrobert.synthdb.synthesis.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.synthdb.config.service.ConfigService;
import me.christianrobert.synthdb.core.job.AbstractJob;
import me.christianrobert.synthdb.core.job.model.JobProgress;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.synthesis.model.SynthesisOptions;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import me.christianrobert.synthdb.synthesis.service.SyntheticDumpService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Generates synthetic rows for the schema in state and writes the SQL dump to
 * {@code synth.output-path}.
 */
@Dependent
public class SyntheticDumpJob extends AbstractJob<SynthesisResult> {

    private static final Logger log = LoggerFactory.getLogger(SyntheticDumpJob.class);

    @Inject
    SyntheticDumpService syntheticDumpService;

    @Override
    public String getDatabase() {
        return "POSTGRES";
    }

    @Override
    public String getOperationType() {
        return "SYNTHETIC_DUMP";
    }

    @Override
    public Class<SynthesisResult> getResultType() {
        return SynthesisResult.class;
    }

    @Override
    protected SynthesisResult run(Consumer<JobProgress> progressCallback) throws Exception {
        List<TableMetadata> tables = stateService.getTableMetadata();
        if (tables.isEmpty()) {
            updateProgress(progressCallback, 100, "No schema loaded",
                    "Extract a schema or post a schema description first");
            throw new IllegalStateException("No schema loaded; extract a schema or post a schema description first");
        }

        SynthesisOptions options = readOptions();
        Path outputPath = Path.of(configService.getConfigValueAsString(ConfigService.OUTPUT_PATH));

        updateProgress(progressCallback, 5, "Generating",
                String.format("%d rows per table for %d tables", options.getRowsPerTable(), tables.size()));

        AtomicInteger done = new AtomicInteger();
        SynthesisResult result = syntheticDumpService.generateDump(tables, options, outputPath, generated -> {
            int count = done.incrementAndGet();
            if (progressCallback != null) {
                progressCallback.accept(new JobProgress(5 + count * 80 / tables.size(),
                        "Generated " + generated.getTableName(),
                        String.format("Table %d of %d", count, tables.size()),
                        Map.of("table", generated.getTableName(), "rows", generated.getRowCount())));
            }
        });

        log.info("Synthetic dump written to {}", result.getOutputPath());
        return result;
    }

    SynthesisOptions readOptions() {
        Integer rows = configService.getConfigValueAsInteger(ConfigService.ROWS_PER_TABLE);
        Long seed = configService.getConfigValueAsLong(ConfigService.SEED);
        return new SynthesisOptions(rows != null ? rows : SynthesisOptions.DEFAULT_ROWS_PER_TABLE, seed);
    }

    @Override
    protected void storeResult(SynthesisResult result) {
        stateService.setSynthesisResult(result);
    }

    @Override
    protected String summarize(SynthesisResult result) {
        return String.format("Dump completed: %d rows in %d tables (seed %d, %d unresolved references)",
                result.getTotalRows(), result.getGeneratedTables().size(), result.getSeed(),
                result.getUnresolvedReferenceCount());
    }

    public void setSyntheticDumpService(SyntheticDumpService syntheticDumpService) {
        this.syntheticDumpService = syntheticDumpService;
    }
}
