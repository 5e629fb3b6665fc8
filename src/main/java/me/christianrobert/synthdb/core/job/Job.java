package me.christianrobert.synthdb.core.job;

import me.christianrobert.synthdb.core.job.model.JobProgress;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A unit of work run by the job service. Jobs are identified by the database they read or
 * write for and the operation they perform, e.g. POSTGRES / SCHEMA_METADATA.
 *
 * @param <T> result type
 */
public interface Job<T> {

    String getJobId();

    /** Database dialect the job reads from or produces output for, e.g. "POSTGRES". */
    String getDatabase();

    /** Operation key, e.g. "SCHEMA_METADATA" or "SYNTHETIC_DUMP". */
    String getOperationType();

    Class<?> getResultType();

    default String getJobType() {
        return getDatabase() + "_" + getOperationType();
    }

    String getDescription();

    CompletableFuture<T> execute(Consumer<JobProgress> progressCallback);

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask) {
        updateProgress(progressCallback, percentage, currentTask, null);
    }

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask, String details) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask, details));
        }
    }
}
