package com.phillippitts.strokecoach.service.analysis;

import com.phillippitts.strokecoach.config.properties.AnalysisProperties;
import com.phillippitts.strokecoach.domain.AnalysisReport;
import com.phillippitts.strokecoach.domain.ComparisonResult;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.exception.AnalysisNotFoundException;
import com.phillippitts.strokecoach.exception.AnalysisRejectedException;
import com.phillippitts.strokecoach.exception.InvalidVideoException;
import com.phillippitts.strokecoach.exception.PoseEstimatorException;
import com.phillippitts.strokecoach.service.analysis.event.AnalysisCompletedEvent;
import com.phillippitts.strokecoach.service.analysis.event.AnalysisFailedEvent;
import com.phillippitts.strokecoach.testutil.EventCapturingPublisher;
import com.phillippitts.strokecoach.testutil.MutableClock;
import com.phillippitts.strokecoach.testutil.SyncExecutor;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnalysisJobServiceTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private StrokeAnalysisService analysis;
    private AnalysisJobStore store;
    private Path video;

    @BeforeEach
    void setUp() throws IOException {
        analysis = mock(StrokeAnalysisService.class);
        store = new AnalysisJobStore(Duration.ofHours(1), 100, clock);
        video = Files.write(dir.resolve("upload.mp4"), new byte[]{1, 2, 3});
    }

    private static AnalysisProperties timeout(Duration timeout) {
        return new AnalysisProperties(timeout, null, null, null);
    }

    private static AnalysisReport report() {
        return new AnalysisReport(StrokeType.FOREHAND, Handedness.RIGHT, 42, Map.of(), Map.of(),
                ComparisonResult.noReference(Map.of()));
    }

    private AnalysisJobService service(Executor executor, Duration timeout) {
        return new AnalysisJobService(analysis, store, executor, publisher, timeout(timeout));
    }

    @Test
    void successfulJobEndsDoneWithReportAndDeletesVideo() {
        AnalysisReport report = report();
        AtomicReference<String> jobIdInContext = new AtomicReference<>();
        when(analysis.analyze(any(), eq(video))).thenAnswer(inv -> {
            jobIdInContext.set(ThreadContext.get("jobId"));
            return report;
        });

        AnalysisJob submitted = service(new SyncExecutor(), Duration.ofMinutes(5))
                .submit(video, StrokeType.FOREHAND, Handedness.RIGHT);

        assertThat(submitted.status()).isEqualTo(JobStatus.DONE);
        AnalysisJob finished = store.find(submitted.id()).orElseThrow();
        assertThat(finished.status()).isEqualTo(JobStatus.DONE);
        assertThat(finished.report()).isSameAs(report);
        assertThat(finished.error()).isNull();
        assertThat(jobIdInContext.get()).isEqualTo(submitted.id());
        assertThat(ThreadContext.get("jobId")).isNull();
        assertThat(video).doesNotExist();
        assertThat(publisher.eventsOf(AnalysisCompletedEvent.class)).hasSize(1);
    }

    @Test
    void invalidVideoFailsWithGenericMessage() {
        when(analysis.analyze(any(), any())).thenThrow(new InvalidVideoException("stderr: /secret/path"));

        AnalysisJob job = service(new SyncExecutor(), Duration.ofMinutes(5))
                .submit(video, StrokeType.SERVE, Handedness.LEFT);

        AnalysisJob failed = store.find(job.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.error()).startsWith("Invalid video").doesNotContain("/secret/path");
        assertThat(publisher.eventsOf(AnalysisFailedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.reason()).isEqualTo("invalid_video"));
        assertThat(video).doesNotExist();
    }

    @Test
    void estimatorOutageFailsJob() {
        when(analysis.analyze(any(), any())).thenThrow(new PoseEstimatorException("Cannot start", "pose-estimator"));

        AnalysisJob job = service(new SyncExecutor(), Duration.ofMinutes(5))
                .submit(video, StrokeType.FOREHAND, Handedness.RIGHT);

        assertThat(store.find(job.id()).orElseThrow().error()).isEqualTo("Pose estimator unavailable");
        assertThat(publisher.eventsOf(AnalysisFailedEvent.class).get(0).reason()).isEqualTo("estimator_unavailable");
    }

    @Test
    void resultProducedAfterDeadlineIsDiscarded() {
        when(analysis.analyze(any(), any())).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(31));
            return report();
        });

        AnalysisJob job = service(new SyncExecutor(), Duration.ofSeconds(30))
                .submit(video, StrokeType.FOREHAND, Handedness.RIGHT);

        AnalysisJob failed = store.find(job.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.report()).isNull();
        assertThat(failed.error()).contains("timed out");
        assertThat(publisher.eventsOf(AnalysisFailedEvent.class).get(0).reason()).isEqualTo("timeout");
        assertThat(publisher.eventsOf(AnalysisCompletedEvent.class)).isEmpty();
    }

    @Test
    void jobRunsAsynchronouslyOnExecutor() throws Exception {
        when(analysis.analyze(any(), any())).thenAnswer(inv -> {
            Thread.sleep(100);
            return report();
        });
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            AnalysisJobService service = service(pool, Duration.ofMinutes(5));

            AnalysisJob job = service.submit(video, StrokeType.FOREHAND, Handedness.RIGHT);

            await().atMost(2, TimeUnit.SECONDS)
                    .until(() -> service.get(job.id()).status() == JobStatus.DONE);
            assertThat(service.get(job.id()).report().frameCount()).isEqualTo(42);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void saturatedPoolRejectsJobAndDeletesVideo() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };
        AnalysisJobService service = service(full, Duration.ofMinutes(5));

        assertThatThrownBy(() -> service.submit(video, StrokeType.FOREHAND, Handedness.RIGHT))
                .isInstanceOf(AnalysisRejectedException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);

        AnalysisFailedEvent event = publisher.eventsOf(AnalysisFailedEvent.class).get(0);
        assertThat(event.reason()).isEqualTo("rejected");
        AnalysisJob failed = service.get(event.jobId());
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.error()).isEqualTo("Analysis queue is full");
        assertThat(video).doesNotExist();
        verifyNoInteractions(analysis);
    }

    @Test
    void unknownJobIsNotFound() {
        AnalysisJobService service = service(new SyncExecutor(), Duration.ofMinutes(5));

        assertThatThrownBy(() -> service.get("nope")).isInstanceOf(AnalysisNotFoundException.class);
    }
}
