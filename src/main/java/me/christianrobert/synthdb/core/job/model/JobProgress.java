package me.christianrobert.synthdb.core.job.model;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Immutable progress snapshot. A job reports a new one for every step; metadata carries
 * structured detail such as the table a generation job has just filled.
 */
public class JobProgress {

    private final int percentage;
    private final String currentTask;
    private final String details;
    private final Map<String, Object> metadata;
    private final LocalDateTime lastUpdated = LocalDateTime.now();

    public JobProgress() {
        this(0, null, null, null);
    }

    public JobProgress(int percentage, String currentTask) {
        this(percentage, currentTask, null, null);
    }

    public JobProgress(int percentage, String currentTask, String details) {
        this(percentage, currentTask, details, null);
    }

    public JobProgress(int percentage, String currentTask, String details, Map<String, Object> metadata) {
        this.percentage = Math.max(0, Math.min(100, percentage));
        this.currentTask = currentTask != null ? currentTask : "";
        this.details = details != null ? details : "";
        this.metadata = metadata != null ? Map.copyOf(metadata) : null;
    }

    public int getPercentage() {
        return percentage;
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public String getDetails() {
        return details;
    }

    /** May be null. */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return percentage + "% " + currentTask + (details.isEmpty() ? "" : " (" + details + ")");
    }
}
