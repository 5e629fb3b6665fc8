package me.christianrobert.synthdb.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.synthdb.core.job.Job;
import me.christianrobert.synthdb.core.job.model.JobExecution;
import me.christianrobert.synthdb.core.job.model.JobProgress;
import me.christianrobert.synthdb.core.job.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs schema extraction and dump generation jobs on a shared pool and keeps their
 * executions for polling over REST.
 */
@ApplicationScoped
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Map<String, JobExecution<?>> executions = new ConcurrentHashMap<>();

    private ExecutorService executorService;

    @PostConstruct
    public void init() {
        executorService = Executors.newCachedThreadPool();
        log.debug("Job executor started");
    }

    @PreDestroy
    public void shutdown() {
        stopExecutor(executorService);
    }

    public <T> String submitJob(Job<T> job) {
        String jobId = job.getJobId();
        JobExecution<T> execution = new JobExecution<>(job);
        executions.put(jobId, execution);
        log.info("Submitting job {} ({})", jobId, job.getJobType());

        execution.setFuture(CompletableFuture.supplyAsync(() -> run(job, execution), executorService));
        return jobId;
    }

    private <T> T run(Job<T> job, JobExecution<T> execution) {
        execution.started();
        try {
            T result = job.execute(progress -> {
                execution.setProgress(progress);
                log.debug("Job {}: {}", job.getJobId(), progress);
            }).get();
            execution.completed(result);
            log.info("Job {} completed in {} ms", job.getJobId(), execution.getElapsed().toMillis());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.cancelled(e);
            throw new RuntimeException("Job interrupted: " + job.getJobId(), e);
        } catch (ExecutionException e) {
            Exception cause = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
            execution.failed(cause);
            log.error("Job {} failed", job.getJobId(), cause);
            throw new RuntimeException("Job execution failed: " + cause.getMessage(), cause);
        }
    }

    public JobExecution<?> getJobExecution(String jobId) {
        return executions.get(jobId);
    }

    public JobStatus getJobStatus(String jobId) {
        JobExecution<?> execution = executions.get(jobId);
        return execution != null ? execution.getStatus() : null;
    }

    public JobProgress getJobProgress(String jobId) {
        JobExecution<?> execution = executions.get(jobId);
        return execution != null ? execution.getProgress() : null;
    }

    /** The result of a completed job, otherwise null. */
    @SuppressWarnings("unchecked")
    public <T> T getJobResult(String jobId) {
        JobExecution<?> execution = executions.get(jobId);
        return execution != null && execution.getStatus() == JobStatus.COMPLETED ? (T) execution.getResult() : null;
    }

    /** The failure of a failed job, otherwise null. */
    public Exception getJobError(String jobId) {
        JobExecution<?> execution = executions.get(jobId);
        return execution != null && execution.getStatus() == JobStatus.FAILED ? execution.getError() : null;
    }

    public boolean isJobComplete(String jobId) {
        JobExecution<?> execution = executions.get(jobId);
        return execution != null && execution.isFinished();
    }

    public Map<String, JobExecution<?>> getAllJobExecutions() {
        return Map.copyOf(executions);
    }

    /**
     * Cancels running jobs, forgets every execution and replaces the pool.
     */
    public void resetJobs() {
        int cancelled = 0;
        for (JobExecution<?> execution : executions.values()) {
            CompletableFuture<?> future = execution.getFuture();
            if (execution.getStatus() == JobStatus.RUNNING && future != null && !future.isDone()) {
                future.cancel(true);
                execution.cancelled(new Exception("Job cancelled during state reset"));
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.warn("Cancelled {} running job(s) during state reset", cancelled);
        }
        log.info("Forgetting {} job execution(s)", executions.size());

        stopExecutor(executorService);
        executions.clear();
        executorService = Executors.newCachedThreadPool();
    }

    private static void stopExecutor(ExecutorService executor) {
        if (executor == null || executor.isShutdown()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Jobs still running after {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while stopping job executor", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
