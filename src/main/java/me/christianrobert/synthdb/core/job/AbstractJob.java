package me.christianrobert.synthdb.core.job;

import jakarta.inject.Inject;
import me.christianrobert.synthdb.config.service.ConfigService;
import me.christianrobert.synthdb.core.job.model.JobProgress;
import me.christianrobert.synthdb.core.service.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Base class for jobs that compute a result, put it into the application state and report a
 * summary. Subclasses implement {@link #run(Consumer)} and {@link #storeResult(Object)}; progress
 * from 90 to 100 percent is reported here.
 *
 * @param <T> result type
 */
public abstract class AbstractJob<T> implements Job<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractJob.class);

    private final String jobId;

    @Inject
    protected ConfigService configService;

    @Inject
    protected StateService stateService;

    protected AbstractJob() {
        this.jobId = getJobType().toLowerCase(Locale.ROOT).replace('_', '-') + "-" + UUID.randomUUID();
    }

    @Override
    public String getJobId() {
        return jobId;
    }

    /** Same key as {@link #getJobType()}; used by the job registry. */
    public String getJobTypeIdentifier() {
        return getJobType();
    }

    @Override
    public String getDescription() {
        return String.format("%s for %s", readableOperation(), getDatabase());
    }

    /** Label used in log and failure messages, e.g. "SYNTHETIC_DUMP operation". */
    protected String failureLabel() {
        return getOperationType() + " operation";
    }

    @Override
    public CompletableFuture<T> execute(Consumer<JobProgress> progressCallback) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return runAndStore(progressCallback);
            } catch (Exception e) {
                log.error("{} failed", failureLabel(), e);
                throw new RuntimeException(failureLabel() + " failed: " + e.getMessage(), e);
            }
        });
    }

    protected abstract T run(Consumer<JobProgress> progressCallback) throws Exception;

    protected abstract void storeResult(T result);

    protected String summarize(T result) {
        return readableOperation() + " completed";
    }

    private T runAndStore(Consumer<JobProgress> progressCallback) throws Exception {
        T result = run(progressCallback);

        updateProgress(progressCallback, 90, "Storing results", "Updating application state");
        storeResult(result);

        updateProgress(progressCallback, 95, "Preparing summary");
        String summary = summarize(result);
        updateProgress(progressCallback, 100, "Completed", summary);

        log.info("{} finished: {}", getJobType(), summary);
        return result;
    }

    protected String readableOperation() {
        String words = getOperationType().replace('_', ' ').toLowerCase(Locale.ROOT);
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    public void setConfigService(ConfigService configService) {
        this.configService = configService;
    }

    public void setStateService(StateService stateService) {
        this.stateService = stateService;
    }
}
