package com.phillippitts.strokecoach.service.analysis;

import com.phillippitts.strokecoach.config.properties.AnalysisProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory registry of analysis jobs.
 *
 * <p>Finished jobs are evicted once older than {@code analysis.job-retention}; when the
 * store still exceeds {@code analysis.max-jobs}, the oldest finished jobs go first.
 * Running jobs are never evicted.
 */
@Component
public class AnalysisJobStore {

    private static final Logger LOG = LogManager.getLogger(AnalysisJobStore.class);

    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final Duration retention;
    private final int maxJobs;
    private final Clock clock;

    @Autowired
    public AnalysisJobStore(AnalysisProperties properties) {
        this(properties.getJobRetention(), properties.getMaxJobs(), Clock.systemUTC());
    }

    AnalysisJobStore(Duration retention, int maxJobs, Clock clock) {
        this.retention = Objects.requireNonNull(retention);
        this.maxJobs = maxJobs;
        this.clock = Objects.requireNonNull(clock);
    }

    public void register(AnalysisJob job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Duplicate job id " + job.id());
        }
    }

    /**
     * Atomically replaces a job with {@code change.apply(current)}.
     *
     * @return the updated job, or empty if the id is unknown (for example already evicted)
     */
    public Optional<AnalysisJob> update(String id, UnaryOperator<AnalysisJob> change) {
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, current) -> change.apply(current)));
    }

    public Optional<AnalysisJob> find(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public int size() {
        return jobs.size();
    }

    Clock clock() {
        return clock;
    }

    @Scheduled(fixedDelayString = "${analysis.cleanup-interval-ms:60000}")
    public void scheduledCleanup() {
        int evicted = evictExpired();
        if (evicted > 0) {
            LOG.info("Evicted {} finished analysis jobs; {} remain", evicted, jobs.size());
        }
    }

    /**
     * @return number of evicted jobs
     */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (AnalysisJob job : List.copyOf(jobs.values())) {
            if (job.isFinished() && job.updatedAt().isBefore(cutoff) && jobs.remove(job.id(), job)) {
                evicted++;
            }
        }
        if (jobs.size() > maxJobs) {
            List<AnalysisJob> finished = jobs.values().stream()
                    .filter(AnalysisJob::isFinished)
                    .sorted(Comparator.comparing(AnalysisJob::updatedAt))
                    .toList();
            for (AnalysisJob job : finished) {
                if (jobs.size() <= maxJobs) {
                    break;
                }
                if (jobs.remove(job.id(), job)) {
                    evicted++;
                }
            }
        }
        return evicted;
    }
}
