package me.christianrobert.synthdb.core.job.model;

import me.christianrobert.synthdb.core.job.Job;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

/**
 * Tracks one submitted job: its lifecycle status, the latest progress snapshot and the outcome.
 */
public class JobExecution<T> {

    private final Job<T> job;
    private volatile JobStatus status = JobStatus.PENDING;
    private volatile JobProgress progress = new JobProgress();
    private volatile LocalDateTime startTime;
    private volatile LocalDateTime endTime;
    private volatile T result;
    private volatile Exception error;
    private CompletableFuture<T> future;

    public JobExecution(Job<T> job) {
        this.job = job;
    }

    public void started() {
        status = JobStatus.RUNNING;
        startTime = LocalDateTime.now();
    }

    public void completed(T result) {
        this.result = result;
        finish(JobStatus.COMPLETED);
    }

    public void failed(Exception error) {
        this.error = error;
        finish(JobStatus.FAILED);
    }

    public void cancelled(Exception reason) {
        this.error = reason;
        finish(JobStatus.CANCELLED);
    }

    private void finish(JobStatus finalStatus) {
        status = finalStatus;
        endTime = LocalDateTime.now();
    }

    public boolean isFinished() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED || status == JobStatus.CANCELLED;
    }

    public Duration getElapsed() {
        if (startTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime != null ? endTime : LocalDateTime.now());
    }

    public Job<T> getJob() { return job; }
    public JobStatus getStatus() { return status; }
    public JobProgress getProgress() { return progress; }
    public void setProgress(JobProgress progress) { this.progress = progress; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public T getResult() { return result; }
    public Exception getError() { return error; }
    public CompletableFuture<T> getFuture() { return future; }
    public void setFuture(CompletableFuture<T> future) { this.future = future; }
}
