package me.christianrobert.synthdb.synthesis.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.synthdb.core.job.Job;
import me.christianrobert.synthdb.core.job.service.JobRegistry;
import me.christianrobert.synthdb.core.job.service.JobService;
import me.christianrobert.synthdb.core.service.StateService;
import me.christianrobert.synthdb.dependency.model.DependencyResolution;
import me.christianrobert.synthdb.dependency.service.TableDependencyResolver;
import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.semantic.model.SemanticType;
import me.christianrobert.synthdb.semantic.service.SemanticClassifier;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@ApplicationScoped
@Path("/api/synthesis")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SynthesisResource {

    private static final Logger log = LoggerFactory.getLogger(SynthesisResource.class);

    private final SemanticClassifier classifier = new SemanticClassifier();

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    @POST
    @Path("/dump")
    public Response startDump() {
        if (!stateService.hasTableMetadata()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error",
                            "message", "No schema loaded; extract a schema or post a schema description first"))
                    .build();
        }

        Job<?> job = jobRegistry.createJob("POSTGRES", "SYNTHETIC_DUMP").orElse(null);
        if (job == null) {
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("status", "error", "message", "No job available for synthetic dump"))
                    .build();
        }

        String jobId = jobService.submitJob(job);
        log.info("Synthetic dump job started with ID: {}", jobId);
        return Response.ok(Map.of(
                "status", "success",
                "jobId", jobId,
                "message", "Synthetic dump job started successfully"
        )).build();
    }

    /**
     * Insertion order of the loaded schema, with any tables left in a foreign key cycle.
     */
    @GET
    @Path("/order")
    public Response getInsertionOrder() {
        DependencyResolution resolution = TableDependencyResolver.resolve(stateService.getTableMetadata());
        return Response.ok(Map.of(
                "insertionOrder", resolution.getOrderedTableNames(),
                "cyclicTables", resolution.getCyclicTables()
        )).build();
    }

    /**
     * The semantic category each column of the loaded schema is generated as.
     */
    @GET
    @Path("/classification")
    public Response getClassification() {
        Map<String, Object> tables = new LinkedHashMap<>();
        for (TableMetadata table : stateService.getTableMetadata()) {
            Map<String, String> columns = new LinkedHashMap<>();
            for (ColumnMetadata column : table.getColumns()) {
                SemanticType type = classifier.classify(column, table);
                columns.put(column.getColumnName(), type.toString());
            }
            tables.put(table.getTableName(), columns);
        }
        return Response.ok(tables).build();
    }

    public static Map<String, Object> generateSynthesisSummary(SynthesisResult result) {
        Map<String, Object> summary = new HashMap<>();
        summary.put("seed", result.getSeed());
        summary.put("totalRows", result.getTotalRows());
        summary.put("rowCounts", result.getRowCounts());
        summary.put("insertionOrder", result.getInsertionOrder());
        summary.put("cyclicTables", result.getCyclicTables());
        summary.put("unresolvedReferenceCount", result.getUnresolvedReferenceCount());
        summary.put("generationMillis", result.getGenerationMillis());
        if (result.getOutputPath() != null) {
            summary.put("outputPath", result.getOutputPath());
        }
        return summary;
    }
}
