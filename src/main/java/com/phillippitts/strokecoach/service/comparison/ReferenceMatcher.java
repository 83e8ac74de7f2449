package com.phillippitts.strokecoach.service.comparison;

import com.phillippitts.strokecoach.domain.BodyLandmarks;
import com.phillippitts.strokecoach.domain.ComparisonResult;
import com.phillippitts.strokecoach.domain.NormalizedPoint;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.domain.ReferenceEntry;
import com.phillippitts.strokecoach.domain.StrokeSample;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.service.corpus.ReferenceClipResolver;
import com.phillippitts.strokecoach.service.corpus.ReferenceCorpus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Finds the corpus entry closest to a user sample.
 *
 * <p>Only entries with all three phases on both sides are scored; partial candidates
 * are excluded even if their partial distance would be lowest. Candidates are scored
 * concurrently on the compute pool and reduced in player-id order, keeping the first
 * strictly smaller total, so the result does not depend on scheduling. A candidate
 * whose scoring fails is logged and excluded.
 */
@Component
public class ReferenceMatcher {

    private static final Logger LOG = LogManager.getLogger(ReferenceMatcher.class);

    private final ReferenceCorpus corpus;
    private final PhaseComparator comparator;
    private final ReferenceClipResolver clipResolver;
    private final Executor executor;

    public ReferenceMatcher(ReferenceCorpus corpus,
                            PhaseComparator comparator,
                            ReferenceClipResolver clipResolver,
                            @Qualifier("computeExecutor") Executor executor) {
        this.corpus = Objects.requireNonNull(corpus);
        this.comparator = Objects.requireNonNull(comparator);
        this.clipResolver = Objects.requireNonNull(clipResolver);
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * @return the best match, or the no-reference sentinel; never throws for an empty corpus
     */
    public ComparisonResult match(StrokeSample user, StrokeType strokeType) {
        Map<Phase, Map<Integer, NormalizedPoint>> userPoints = prepareUser(user);
        if (userPoints.size() < Phase.values().length) {
            return sentinel(user);
        }

        List<ReferenceEntry> entries = corpus.entries(strokeType);
        List<CompletableFuture<Optional<Candidate>>> futures = new ArrayList<>(entries.size());
        for (ReferenceEntry entry : entries) {
            futures.add(CompletableFuture.supplyAsync(() -> score(userPoints, entry), executor));
        }

        Candidate best = null;
        for (int i = 0; i < futures.size(); i++) {
            Optional<Candidate> candidate = await(futures.get(i), entries.get(i));
            if (candidate.isPresent() && (best == null || candidate.get().total() < best.total())) {
                best = candidate.get();
            }
        }

        if (best == null) {
            LOG.info("No qualifying {} reference among {} entries", strokeType.key(), entries.size());
            return sentinel(user);
        }

        Map<Phase, String> feedback = new EnumMap<>(Phase.class);
        best.phases().forEach((phase, comparison) -> feedback.put(phase, FeedbackFormatter.line(comparison)));
        ReferenceEntry entry = best.entry();
        LOG.info("Best {} match: {} (total DTW {})", strokeType.key(), entry.key().id(), best.total());
        return new ComparisonResult(entry.key().id(), entry.key().playerId(), best.total(), feedback,
                clipResolver.clipFor(entry.key()).orElse(null));
    }

    private Map<Phase, Map<Integer, NormalizedPoint>> prepareUser(StrokeSample user) {
        Map<Phase, Map<Integer, NormalizedPoint>> out = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            user.pose(phase).flatMap(comparator::prepare).ifPresent(points -> out.put(phase, points));
        }
        return out;
    }

    private Optional<Candidate> score(Map<Phase, Map<Integer, NormalizedPoint>> userPoints, ReferenceEntry entry) {
        Map<Phase, PhaseComparison> phases = new EnumMap<>(Phase.class);
        double total = 0.0;
        for (Phase phase : Phase.values()) {
            Optional<Map<Integer, NormalizedPoint>> ref = entry.sample().pose(phase).flatMap(comparator::prepare);
            if (ref.isEmpty()) {
                LOG.debug("Excluding {}: {} missing or unusable", entry.key().id(), phase.key());
                return Optional.empty();
            }
            PhaseComparison comparison = comparator.compare(phase, userPoints.get(phase), ref.get());
            phases.put(phase, comparison);
            total += comparison.distance();
        }
        return Optional.of(new Candidate(entry, total, phases));
    }

    private static Optional<Candidate> await(CompletableFuture<Optional<Candidate>> future, ReferenceEntry entry) {
        try {
            return future.join();
        } catch (RuntimeException e) {
            LOG.warn("Excluding {}: scoring failed", entry.key().id(), e);
            return Optional.empty();
        }
    }

    /**
     * Sentinel carrying a line for each phase the user sample lacks.
     */
    static ComparisonResult sentinel(StrokeSample user) {
        Map<Phase, String> missing = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            if (user.pose(phase).filter(ReferenceMatcher::usable).isEmpty()) {
                missing.put(phase, FeedbackFormatter.missingUserPhase(phase));
            }
        }
        return ComparisonResult.noReference(missing);
    }

    private static boolean usable(Pose pose) {
        return pose.has(BodyLandmarks.LEFT_SHOULDER, BodyLandmarks.RIGHT_SHOULDER)
                && BodyLandmarks.COMPARED_JOINTS.stream().anyMatch(joint -> pose.landmark(joint).isPresent());
    }

    private record Candidate(ReferenceEntry entry, double total, Map<Phase, PhaseComparison> phases) {
    }
}
