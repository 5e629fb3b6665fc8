package me.christianrobert.synthdb.schema.rest;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.synthdb.core.job.Job;
import me.christianrobert.synthdb.core.job.service.JobRegistry;
import me.christianrobert.synthdb.core.job.service.JobService;
import me.christianrobert.synthdb.core.service.StateService;
import me.christianrobert.synthdb.database.service.PostgresConnectionService;
import me.christianrobert.synthdb.dependency.model.DependencyResolution;
import me.christianrobert.synthdb.dependency.service.TableDependencyResolver;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.schema.service.SchemaDescriptionLoader;
import me.christianrobert.synthdb.schema.service.SchemaLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loading the schema to generate for: introspected from the source database, or posted
 * as a schema description.
 */
@ApplicationScoped
@Path("/api/schema")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SchemaResource {

    private static final Logger log = LoggerFactory.getLogger(SchemaResource.class);

    private final SchemaDescriptionLoader descriptionLoader = new SchemaDescriptionLoader();

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    @Inject
    PostgresConnectionService postgresConnectionService;

    /**
     * The loaded schema in the format POST /description accepts, plus its insertion order.
     */
    @GET
    public Response getSchema() {
        List<TableMetadata> tables = stateService.getTableMetadata();
        DependencyResolution resolution = TableDependencyResolver.resolve(tables);

        Map<String, Object> response = new HashMap<>();
        response.put("source", stateService.getSchemaSource() != null ? stateService.getSchemaSource() : "none");
        response.put("description", descriptionLoader.toJsonNode(tables));
        response.put("insertionOrder", resolution.getOrderedTableNames());
        response.put("cyclicTables", resolution.getCyclicTables());
        return Response.ok(response).build();
    }

    @GET
    @Path("/postgres/test-connection")
    public Response testConnection() {
        return Response.ok(postgresConnectionService.testConnection()).build();
    }

    @POST
    @Path("/postgres/extract")
    public Response extractPostgresSchema() {
        String friendlyName = "PostgreSQL schema extraction";
        log.info("Starting {} job via REST API", friendlyName);

        Job<?> job = jobRegistry.createJob("POSTGRES", "SCHEMA_METADATA").orElse(null);
        if (job == null) {
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("status", "error", "message", "No job available for " + friendlyName))
                    .build();
        }

        String jobId = jobService.submitJob(job);
        log.info("{} job started with ID: {}", friendlyName, jobId);
        return Response.ok(Map.of(
                "status", "success",
                "jobId", jobId,
                "message", friendlyName + " job started successfully"
        )).build();
    }

    @POST
    @Path("/description")
    public Response loadDescription(JsonNode description) {
        try {
            List<TableMetadata> tables = descriptionLoader.parse(description);
            stateService.setTableMetadata(tables, "description");

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Schema description loaded");
            response.put("summary", generateSchemaSummary(tables));
            return Response.ok(response).build();
        } catch (SchemaLoadException e) {
            log.warn("Rejected schema description: {}", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", e.getMessage()))
                    .build();
        }
    }

    public static Map<String, Object> generateSchemaSummary(List<TableMetadata> tables) {
        Map<String, Object> tableDetails = new HashMap<>();
        int columnCount = 0;
        int foreignKeyCount = 0;

        for (TableMetadata table : tables) {
            columnCount += table.getColumns().size();
            foreignKeyCount += table.getForeignKeys().size();
            tableDetails.put(table.getQualifiedName(), Map.of(
                    "columns", table.getColumns().size(),
                    "foreignKeys", table.getForeignKeys().size(),
                    "sampledColumns", table.getColumns().stream().filter(c -> c.hasSampleValues()).count()
            ));
        }

        Map<String, Object> summary = new HashMap<>();
        summary.put("tableCount", tables.size());
        summary.put("columnCount", columnCount);
        summary.put("foreignKeyCount", foreignKeyCount);
        summary.put("tables", tableDetails);
        return summary;
    }
}
