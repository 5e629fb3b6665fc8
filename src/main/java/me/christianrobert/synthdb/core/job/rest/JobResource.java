package me.christianrobert.synthdb.core.job.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.synthdb.core.job.model.JobExecution;
import me.christianrobert.synthdb.core.job.model.JobProgress;
import me.christianrobert.synthdb.core.job.model.JobStatus;
import me.christianrobert.synthdb.core.job.service.JobService;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.schema.rest.SchemaResource;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import me.christianrobert.synthdb.synthesis.rest.SynthesisResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Polling endpoints for jobs started by the schema and synthesis resources.
 */
@ApplicationScoped
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger log = LoggerFactory.getLogger(JobResource.class);

    @Inject
    JobService jobService;

    @GET
    @Path("/{jobId}/status")
    public Response getJobStatus(@PathParam("jobId") String jobId) {
        log.debug("Status requested for job {}", jobId);

        JobExecution<?> execution = jobService.getJobExecution(jobId);
        if (execution == null) {
            return notFound(jobId);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", jobId);
        body.put("jobType", execution.getJob().getJobType());
        body.put("status", execution.getStatus().name());
        body.put("isComplete", execution.isFinished());
        body.put("progress", describe(execution.getProgress()));
        body.put("elapsedMillis", execution.getElapsed().toMillis());

        if (execution.getStatus() == JobStatus.FAILED && execution.getError() != null) {
            body.put("error", execution.getError().getMessage());
        }
        if (execution.getStartTime() != null) {
            body.put("startTime", execution.getStartTime().toString());
        }
        if (execution.getEndTime() != null) {
            body.put("endTime", execution.getEndTime().toString());
        }
        return Response.ok(body).build();
    }

    @GET
    @Path("/{jobId}/result")
    public Response getJobResult(@PathParam("jobId") String jobId) {
        log.debug("Result requested for job {}", jobId);

        JobExecution<?> execution = jobService.getJobExecution(jobId);
        if (execution == null) {
            return notFound(jobId);
        }
        if (!execution.isFinished()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "Job is not yet complete: " + jobId))
                    .build();
        }
        if (execution.getStatus() != JobStatus.COMPLETED) {
            Exception error = execution.getError();
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of(
                            "status", execution.getStatus().name().toLowerCase(),
                            "jobId", jobId,
                            "message", error != null ? error.getMessage() : "Job failed without an error message"))
                    .build();
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("jobId", jobId);
        body.put("jobType", execution.getJob().getJobType());
        body.put("summary", summarize(execution.getResult()));
        return Response.ok(body).build();
    }

    private static Object summarize(Object result) {
        if (result instanceof SynthesisResult) {
            return SynthesisResource.generateSynthesisSummary((SynthesisResult) result);
        }
        if (result instanceof List<?> && ((List<?>) result).stream().allMatch(TableMetadata.class::isInstance)) {
            @SuppressWarnings("unchecked")
            List<TableMetadata> tables = (List<TableMetadata>) result;
            return SchemaResource.generateSchemaSummary(tables);
        }
        return result;
    }

    private static Map<String, Object> describe(JobProgress progress) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("percentage", progress.getPercentage());
        info.put("currentTask", progress.getCurrentTask());
        info.put("details", progress.getDetails());
        info.put("lastUpdated", progress.getLastUpdated().toString());
        if (progress.getMetadata() != null) {
            info.put("metadata", progress.getMetadata());
        }
        return info;
    }

    private static Response notFound(String jobId) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(Map.of("status", "error", "message", "Job not found: " + jobId))
                .build();
    }
}
