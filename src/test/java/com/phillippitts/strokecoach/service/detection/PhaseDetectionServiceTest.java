package com.phillippitts.strokecoach.service.detection;

import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.exception.AnalysisTimeoutException;
import com.phillippitts.strokecoach.testutil.Poses;
import com.phillippitts.strokecoach.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhaseDetectionServiceTest {

    private static final FrameSequence FRAMES = Poses.sequence(List.of(Poses.standing()));

    private static PhaseDetector fixed(Phase phase, DetectionOutcome outcome) {
        return new PhaseDetector() {
            @Override
            public Phase phase() {
                return phase;
            }

            @Override
            public DetectionOutcome detect(FrameSequence frames, StrokeType strokeType, Handedness handedness) {
                return outcome;
            }
        };
    }

    @Test
    void collectsOneOutcomePerPhase() {
        PhaseDetectionService service = new PhaseDetectionService(List.of(
                fixed(Phase.PREPARATION, DetectionOutcome.detected(2, 0.8)),
                fixed(Phase.IMPACT, DetectionOutcome.fallback(5, 0.3, DetectionOutcome.EXTENSION))),
                new SyncExecutor());

        Map<Phase, DetectionOutcome> outcomes = service.detectAll(FRAMES, StrokeType.FOREHAND, Handedness.RIGHT,
                Duration.ofSeconds(1));

        assertThat(outcomes).containsOnlyKeys(Phase.values());
        assertThat(outcomes.get(Phase.PREPARATION).frameIndex()).isEqualTo(2);
        assertThat(outcomes.get(Phase.IMPACT).kind()).isEqualTo(DetectionOutcome.Kind.FALLBACK);
        assertThat(outcomes.get(Phase.FOLLOW_THROUGH).isFound()).isFalse();
    }

    @Test
    void failingDetectorBecomesNotFound() {
        PhaseDetector broken = new PhaseDetector() {
            @Override
            public Phase phase() {
                return Phase.FOLLOW_THROUGH;
            }

            @Override
            public DetectionOutcome detect(FrameSequence frames, StrokeType strokeType, Handedness handedness) {
                throw new IllegalStateException("boom");
            }
        };
        PhaseDetectionService service = new PhaseDetectionService(List.of(
                fixed(Phase.IMPACT, DetectionOutcome.detected(0, 1.0)), broken), new SyncExecutor());

        Map<Phase, DetectionOutcome> outcomes = service.detectAll(FRAMES, StrokeType.FOREHAND, Handedness.RIGHT,
                Duration.ofSeconds(1));

        assertThat(outcomes.get(Phase.FOLLOW_THROUGH).kind()).isEqualTo(DetectionOutcome.Kind.NOT_FOUND);
        assertThat(outcomes.get(Phase.IMPACT).isFound()).isTrue();
    }

    @Test
    void slowDetectorTimesOut() {
        PhaseDetector slow = new PhaseDetector() {
            @Override
            public Phase phase() {
                return Phase.IMPACT;
            }

            @Override
            public DetectionOutcome detect(FrameSequence frames, StrokeType strokeType, Handedness handedness) {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return DetectionOutcome.detected(0, 1.0);
            }
        };
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            PhaseDetectionService service = new PhaseDetectionService(List.of(slow), pool);

            assertThatThrownBy(() -> service.detectAll(FRAMES, StrokeType.FOREHAND, Handedness.RIGHT,
                    Duration.ofMillis(50)))
                    .isInstanceOf(AnalysisTimeoutException.class)
                    .hasMessageContaining("phase detection");
        } finally {
            pool.shutdownNow();
        }
    }
}
