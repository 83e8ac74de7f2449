package com.phillippitts.strokecoach.service.detection;

import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.exception.AnalysisTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every registered {@link PhaseDetector} concurrently over one frame sequence.
 *
 * <p><b>Thread model:</b> each detector is one task on the bounded {@code computeExecutor}.
 * The call blocks until all detectors finish or the timeout expires.
 *
 * <p><b>Error handling:</b> a detector that throws is logged and reported as
 * {@code NOT_FOUND}; the other phases are unaffected. A timeout cancels the remaining
 * tasks and fails the whole call with {@link AnalysisTimeoutException}: partial phase
 * results are never returned.
 */
@Service
public class PhaseDetectionService {

    private static final Logger LOG = LogManager.getLogger(PhaseDetectionService.class);

    private final List<PhaseDetector> detectors;
    private final Executor executor;

    public PhaseDetectionService(List<PhaseDetector> detectors,
                                 @Qualifier("computeExecutor") Executor executor) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors));
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * Detects all phases.
     *
     * @return one outcome per {@link Phase}; phases without a registered detector are {@code NOT_FOUND}
     * @throws AnalysisTimeoutException if the detectors do not finish within {@code timeout}
     */
    public Map<Phase, DetectionOutcome> detectAll(FrameSequence frames,
                                                  StrokeType strokeType,
                                                  Handedness handedness,
                                                  Duration timeout) {
        Objects.requireNonNull(frames, "frames");
        long toMs = Math.max(1L, timeout.toMillis());

        List<CompletableFuture<DetectionOutcome>> futures = new ArrayList<>(detectors.size());
        for (PhaseDetector detector : detectors) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> runDetector(detector, frames, strokeType, handedness), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(toMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            futures.forEach(f -> f.cancel(true));
            LOG.warn("Phase detection timed out after {} ms", toMs);
            throw new AnalysisTimeoutException("phase detection", toMs);
        } catch (InterruptedException ie) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new AnalysisTimeoutException("phase detection (interrupted)", toMs);
        } catch (ExecutionException ee) {
            // runDetector converts failures; reaching here means a bug in the wrapper itself
            throw new IllegalStateException("Phase detection failed", ee.getCause());
        }

        Map<Phase, DetectionOutcome> outcomes = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            outcomes.put(phase, DetectionOutcome.notFound(0.0));
        }
        for (int i = 0; i < detectors.size(); i++) {
            outcomes.put(detectors.get(i).phase(), futures.get(i).join());
        }
        return Collections.unmodifiableMap(outcomes);
    }

    private DetectionOutcome runDetector(PhaseDetector detector, FrameSequence frames,
                                         StrokeType strokeType, Handedness handedness) {
        long t0 = System.nanoTime();
        try {
            DetectionOutcome outcome = detector.detect(frames, strokeType, handedness);
            LOG.debug("{} detector finished in {} ms: {}", detector.phase().key(),
                    (System.nanoTime() - t0) / 1_000_000L, outcome);
            return outcome;
        } catch (RuntimeException re) {
            LOG.error("{} detector failed unexpectedly", detector.phase().key(), re);
            return DetectionOutcome.notFound(0.0);
        }
    }
}
