package me.christianrobert.synthdb.core.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.synthdb.core.job.service.JobService;
import me.christianrobert.synthdb.core.service.StateService;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Overview of the loaded schema and the last generation run.
 */
@Path("/api/state")
@Produces(MediaType.APPLICATION_JSON)
public class StateRestService {

    private static final Logger log = LoggerFactory.getLogger(StateRestService.class);

    @Inject
    StateService stateService;

    @Inject
    JobService jobService;

    @GET
    public Response getCurrentState() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("loaded", stateService.hasTableMetadata());
        schema.put("tableCount", stateService.getTableMetadata().size());
        schema.put("source", stateService.getSchemaSource() != null ? stateService.getSchemaSource() : "none");

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("schema", schema);
        state.put("jobs", jobService.getAllJobExecutions().size());

        SynthesisResult last = stateService.getSynthesisResult();
        if (last != null) {
            Map<String, Object> run = new LinkedHashMap<>();
            run.put("seed", last.getSeed());
            run.put("tables", last.getGeneratedTables().size());
            run.put("totalRows", last.getTotalRows());
            run.put("unresolvedReferences", last.getUnresolvedReferenceCount());
            run.put("outputPath", last.getOutputPath());
            run.put("executionDateTime", last.getExecutionDateTime().toString());
            state.put("lastGeneration", run);
        }
        return Response.ok(state).build();
    }

    @GET
    @Path("/reset")
    public Response resetState() {
        log.info("Clearing loaded schema, last generation result and job history");
        stateService.resetState();
        jobService.resetJobs();
        return Response.ok(Map.of("message", "State and job history reset")).build();
    }
}
