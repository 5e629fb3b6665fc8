package me.christianrobert.synthdb.synthesis.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.synthdb.dump.service.SqlDumpWriter;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.synthesis.model.GeneratedTable;
import me.christianrobert.synthdb.synthesis.model.SynthesisOptions;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Generates data for a schema and writes it as a SQL dump in one step.
 * Nothing is written when generation fails.
 */
@ApplicationScoped
public class SyntheticDumpService {

    private final SyntheticDataGenerator generator;
    private final SqlDumpWriter dumpWriter;

    public SyntheticDumpService() {
        this(new SyntheticDataGenerator(), new SqlDumpWriter());
    }

    public SyntheticDumpService(SyntheticDataGenerator generator, SqlDumpWriter dumpWriter) {
        this.generator = generator;
        this.dumpWriter = dumpWriter;
    }

    public SynthesisResult generateDump(List<TableMetadata> tables, SynthesisOptions options, Path outputPath)
            throws IOException {
        return generateDump(tables, options, outputPath, null);
    }

    public SynthesisResult generateDump(List<TableMetadata> tables, SynthesisOptions options, Path outputPath,
                                        Consumer<GeneratedTable> tableListener) throws IOException {
        SynthesisResult result = generator.generate(tables, options, tableListener);
        dumpWriter.write(result, outputPath);
        result.setOutputPath(outputPath.toAbsolutePath().toString());
        return result;
    }
}
