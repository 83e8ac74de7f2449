package com.phillippitts.strokecoach.service.analysis;

import com.phillippitts.strokecoach.config.properties.AnalysisProperties;
import com.phillippitts.strokecoach.domain.AnalysisReport;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.exception.AnalysisNotFoundException;
import com.phillippitts.strokecoach.exception.AnalysisRejectedException;
import com.phillippitts.strokecoach.exception.AnalysisTimeoutException;
import com.phillippitts.strokecoach.exception.InvalidVideoException;
import com.phillippitts.strokecoach.exception.PoseEstimatorException;
import com.phillippitts.strokecoach.service.analysis.event.AnalysisCompletedEvent;
import com.phillippitts.strokecoach.service.analysis.event.AnalysisFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs analyses asynchronously and tracks them in {@link AnalysisJobStore}.
 *
 * <p>Lifecycle: {@code QUEUED} on submit, {@code PROCESSING} once a job thread picks the
 * job up, then {@code DONE} with the report or {@code FAILED} with a message. An analysis
 * that overruns {@code analysis.timeout} is {@code FAILED} and its partial results are
 * discarded. The uploaded video is deleted when the job finishes either way.
 */
@Service
public class AnalysisJobService {

    private static final Logger LOG = LogManager.getLogger(AnalysisJobService.class);
    static final String JOB_ID_KEY = "jobId";

    private final StrokeAnalysisService analysisService;
    private final AnalysisJobStore store;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final Duration timeout;

    public AnalysisJobService(StrokeAnalysisService analysisService,
                              AnalysisJobStore store,
                              @Qualifier("jobExecutor") Executor executor,
                              ApplicationEventPublisher publisher,
                              AnalysisProperties properties) {
        this.analysisService = Objects.requireNonNull(analysisService);
        this.store = Objects.requireNonNull(store);
        this.executor = Objects.requireNonNull(executor);
        this.publisher = Objects.requireNonNull(publisher);
        this.timeout = properties.getTimeout();
    }

    /**
     * Registers a job and schedules it on the job pool.
     *
     * @param video uploaded video; ownership passes to the job, which deletes it
     * @return the job as currently stored; usually {@code QUEUED}
     * @throws AnalysisRejectedException if the job pool is full; the job is then
     *         {@code FAILED} and the video deleted
     */
    public AnalysisJob submit(Path video, StrokeType strokeType, Handedness handedness) {
        Objects.requireNonNull(video, "video");
        AnalysisJob job = AnalysisJob.queued(UUID.randomUUID().toString(), strokeType, handedness,
                store.clock().instant());
        store.register(job);
        LOG.info("Queued analysis {} ({}, {})", job.id(), strokeType.key(), handedness);
        long t0 = System.nanoTime();
        try {
            executor.execute(() -> run(job.id(), video, strokeType, handedness));
        } catch (RejectedExecutionException e) {
            LOG.warn("Job pool saturated, rejecting analysis {}", job.id());
            fail(job.id(), strokeType, "rejected", "Analysis queue is full", t0);
            deleteQuietly(video);
            throw new AnalysisRejectedException(job.id(), e);
        }
        // an executor that runs inline may already have moved the job on
        return store.find(job.id()).orElse(job);
    }

    /**
     * @throws AnalysisNotFoundException if the id is unknown or already evicted
     */
    public AnalysisJob get(String jobId) {
        return store.find(jobId).orElseThrow(() -> new AnalysisNotFoundException(jobId));
    }

    void run(String jobId, Path video, StrokeType strokeType, Handedness handedness) {
        ThreadContext.put(JOB_ID_KEY, jobId);
        long t0 = System.nanoTime();
        try {
            store.update(jobId, job -> job.processing(store.clock().instant()));
            AnalysisContext ctx = AnalysisContext.start(jobId, strokeType, handedness, timeout, store.clock());
            AnalysisReport report = analysisService.analyze(ctx, video);
            // a result produced after the deadline is discarded
            ctx.checkDeadline("finalization");
            store.update(jobId, job -> job.done(report, store.clock().instant()));
            publisher.publishEvent(new AnalysisCompletedEvent(jobId, report, System.nanoTime() - t0,
                    store.clock().instant()));
        } catch (AnalysisTimeoutException e) {
            fail(jobId, strokeType, "timeout", e.getMessage(), t0);
        } catch (InvalidVideoException e) {
            fail(jobId, strokeType, "invalid_video", "Invalid video: the pose estimator could not process it", t0);
            LOG.debug("Invalid video details for {}: {}", jobId, e.getMessage());
        } catch (PoseEstimatorException e) {
            fail(jobId, strokeType, "estimator_unavailable", "Pose estimator unavailable", t0);
            LOG.error("Pose estimator failure for {}", jobId, e);
        } catch (RuntimeException e) {
            fail(jobId, strokeType, "error", "Analysis failed", t0);
            LOG.error("Unexpected failure in analysis {}", jobId, e);
        } finally {
            deleteQuietly(video);
            ThreadContext.remove(JOB_ID_KEY);
        }
    }

    private void fail(String jobId, StrokeType strokeType, String reason, String message, long t0) {
        store.update(jobId, job -> job.failed(message, store.clock().instant()));
        publisher.publishEvent(new AnalysisFailedEvent(jobId, strokeType, reason, message,
                System.nanoTime() - t0, store.clock().instant()));
    }

    private static void deleteQuietly(Path video) {
        try {
            Files.deleteIfExists(video);
        } catch (IOException e) {
            LOG.warn("Could not delete uploaded video {}: {}", video.getFileName(), e.getMessage());
        }
    }
}
