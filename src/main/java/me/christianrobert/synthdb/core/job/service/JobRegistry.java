package me.christianrobert.synthdb.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import me.christianrobert.synthdb.core.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Indexes every job bean by database and operation type, e.g. POSTGRES_SYNTHETIC_DUMP,
 * and creates a fresh (dependent-scoped) instance per request.
 */
@ApplicationScoped
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    @Inject
    Instance<Job<?>> jobs;

    private final Map<String, Class<? extends Job<?>>> jobTypes = new TreeMap<>();

    @PostConstruct
    public void initialize() {
        for (Job<?> job : jobs) {
            @SuppressWarnings("unchecked")
            Class<? extends Job<?>> jobClass = (Class<? extends Job<?>>) job.getClass();
            jobTypes.put(key(job.getDatabase(), job.getOperationType()), jobClass);
            log.info("Registered job {} -> {}", job.getJobType(), jobClass.getSimpleName());
        }
        if (jobTypes.isEmpty()) {
            log.warn("No jobs discovered; job classes need a CDI scope annotation");
        }
    }

    public Optional<Job<?>> createJob(String database, String operationType) {
        Class<? extends Job<?>> jobClass = jobTypes.get(key(database, operationType));
        if (jobClass == null) {
            log.warn("No job registered for {}", key(database, operationType));
            return Optional.empty();
        }
        return Optional.of(jobs.select(jobClass).get());
    }

    public Map<String, String> getAvailableJobTypes() {
        Map<String, String> result = new TreeMap<>();
        jobTypes.forEach((key, jobClass) -> result.put(key, jobClass.getSimpleName()));
        return result;
    }

    public boolean isJobTypeSupported(String database, String operationType) {
        return jobTypes.containsKey(key(database, operationType));
    }

    private static String key(String database, String operationType) {
        return (database + "_" + operationType).toUpperCase(Locale.ROOT);
    }
}
