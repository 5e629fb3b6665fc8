package me.christianrobert.synthdb.synthesis.job;

import me.christianrobert.synthdb.config.service.ConfigService;
import me.christianrobert.synthdb.core.job.model.JobProgress;
import me.christianrobert.synthdb.core.service.StateService;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.schema.service.SchemaDescriptionLoader;
import me.christianrobert.synthdb.synthesis.model.SynthesisOptions;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import me.christianrobert.synthdb.synthesis.service.SyntheticDumpService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SyntheticDumpJobTest {

    @TempDir
    Path tempDir;

    private ConfigService configService;
    private StateService stateService;
    private SyntheticDumpJob dumpJob;

    private Consumer<JobProgress> progressCallback;
    private List<JobProgress> progressUpdates;

    @BeforeEach
    void setUp() throws Exception {
        configService = new ConfigService();
        configService.setConfigValue(ConfigService.OUTPUT_PATH, tempDir.resolve("dump.sql").toString());
        configService.setConfigValue(ConfigService.ROWS_PER_TABLE, 4);
        configService.setConfigValue(ConfigService.SEED, "11");
        stateService = mock(StateService.class);

        dumpJob = new SyntheticDumpJob();
        injectDependency(dumpJob, "configService", configService);
        injectDependency(dumpJob, "stateService", stateService);
        injectDependency(dumpJob, "syntheticDumpService", new SyntheticDumpService());

        progressUpdates = new ArrayList<>();
        progressCallback = progress -> progressUpdates.add(progress);
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = null;
        Class<?> clazz = target.getClass();

        while (clazz != null && field == null) {
            try {
                field = clazz.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                clazz = clazz.getSuperclass();
            }
        }

        if (field != null) {
            field.setAccessible(true);
            field.set(target, dependency);
        } else {
            throw new NoSuchFieldException("Field " + fieldName + " not found in class hierarchy");
        }
    }

    private static List<TableMetadata> companySchema() throws Exception {
        Path fixture = Path.of(SyntheticDumpJobTest.class.getResource("/schemas/company.json").toURI());
        return new SchemaDescriptionLoader().load(fixture);
    }

    @Test
    void testJobIdentity() {
        assertEquals("POSTGRES", dumpJob.getDatabase());
        assertEquals("SYNTHETIC_DUMP", dumpJob.getOperationType());
        assertEquals(SynthesisResult.class, dumpJob.getResultType());
        assertEquals("POSTGRES_SYNTHETIC_DUMP", dumpJob.getJobTypeIdentifier());
        assertTrue(dumpJob.getJobId().startsWith("postgres-synthetic-dump-"));
    }

    @Test
    void testExecuteWritesDumpAndStoresResult() throws Exception {
        when(stateService.getTableMetadata()).thenReturn(companySchema());

        CompletableFuture<SynthesisResult> future = dumpJob.execute(progressCallback);
        SynthesisResult result = future.get();

        assertEquals(11L, result.getSeed());
        assertEquals(List.of("companies", "employees"), result.getInsertionOrder());
        assertEquals(8, result.getTotalRows());

        Path dump = tempDir.resolve("dump.sql");
        assertTrue(Files.exists(dump));
        assertEquals(dump.toAbsolutePath().toString(), result.getOutputPath());
        assertTrue(Files.readString(dump).contains("INSERT INTO companies (id, name, website, founded_on) VALUES"));

        verify(stateService).setSynthesisResult(result);

        assertEquals(100, progressUpdates.get(progressUpdates.size() - 1).getPercentage());
        assertTrue(progressUpdates.stream()
                .anyMatch(p -> p.getMetadata() != null && "employees".equals(p.getMetadata().get("table"))));
    }

    @Test
    void testExecuteWithoutSchemaFails() {
        when(stateService.getTableMetadata()).thenReturn(List.of());

        ExecutionException e = assertThrows(ExecutionException.class, () -> dumpJob.execute(progressCallback).get());

        assertTrue(e.getCause().getMessage().contains("No schema loaded"));
        verify(stateService, never()).setSynthesisResult(any());
        assertFalse(Files.exists(tempDir.resolve("dump.sql")));
    }

    @Test
    void testReadOptions() {
        SynthesisOptions options = dumpJob.readOptions();
        assertEquals(4, options.getRowsPerTable());
        assertEquals(11L, options.getSeed());

        configService.setConfigValue(ConfigService.SEED, "");
        configService.setConfigValue(ConfigService.ROWS_PER_TABLE, "25");
        options = dumpJob.readOptions();
        assertEquals(25, options.getRowsPerTable());
        assertFalse(options.hasSeed());
    }
}
