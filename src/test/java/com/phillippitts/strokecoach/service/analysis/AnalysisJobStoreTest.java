package com.phillippitts.strokecoach.service.analysis;

import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisJobStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    private AnalysisJob queued(String id) {
        return AnalysisJob.queued(id, StrokeType.FOREHAND, Handedness.RIGHT, clock.instant());
    }

    @Test
    void registerAndUpdate() {
        AnalysisJobStore store = new AnalysisJobStore(Duration.ofHours(1), 10, clock);
        store.register(queued("a"));

        clock.advance(Duration.ofSeconds(3));
        AnalysisJob updated = store.update("a", job -> job.processing(clock.instant())).orElseThrow();

        assertThat(updated.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(updated.updatedAt()).isAfter(updated.createdAt());
        assertThat(store.find("a")).contains(updated);
        assertThat(store.update("missing", job -> job.failed("x", clock.instant()))).isEmpty();
    }

    @Test
    void duplicateIdIsRejected() {
        AnalysisJobStore store = new AnalysisJobStore(Duration.ofHours(1), 10, clock);
        store.register(queued("a"));

        assertThatThrownBy(() -> store.register(queued("a"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finishedJobsExpireAfterRetentionButRunningJobsStay() {
        AnalysisJobStore store = new AnalysisJobStore(Duration.ofMinutes(10), 10, clock);
        store.register(queued("done"));
        store.register(queued("running"));
        store.update("done", job -> job.failed("Analysis failed", clock.instant()));
        store.update("running", job -> job.processing(clock.instant()));

        clock.advance(Duration.ofMinutes(11));
        int evicted = store.evictExpired();

        assertThat(evicted).isEqualTo(1);
        assertThat(store.find("done")).isEmpty();
        assertThat(store.find("running")).isPresent();
    }

    @Test
    void capacityEvictsOldestFinishedJobsFirst() {
        AnalysisJobStore store = new AnalysisJobStore(Duration.ofHours(1), 2, clock);
        for (String id : new String[]{"old", "mid", "new"}) {
            store.register(queued(id));
            store.update(id, job -> job.failed("Analysis failed", clock.instant()));
            clock.advance(Duration.ofSeconds(1));
        }
        store.register(queued("queued"));

        int evicted = store.evictExpired();

        assertThat(evicted).isEqualTo(2);
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.find("new")).isPresent();
        assertThat(store.find("queued")).isPresent();
    }
}
