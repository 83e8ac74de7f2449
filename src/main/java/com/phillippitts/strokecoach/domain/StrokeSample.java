package com.phillippitts.strokecoach.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Up to three phase poses of one stroke. Any phase may be absent.
 */
public final class StrokeSample {

    private static final StrokeSample EMPTY = new StrokeSample(new EnumMap<>(Phase.class));

    private final Map<Phase, Pose> phases;

    private StrokeSample(EnumMap<Phase, Pose> phases) {
        this.phases = Collections.unmodifiableMap(phases);
    }

    public static StrokeSample of(Map<Phase, Pose> phases) {
        EnumMap<Phase, Pose> copy = new EnumMap<>(Phase.class);
        phases.forEach((phase, pose) -> {
            if (pose != null) {
                copy.put(phase, pose);
            }
        });
        return new StrokeSample(copy);
    }

    public static StrokeSample empty() {
        return EMPTY;
    }

    public Optional<Pose> pose(Phase phase) {
        return Optional.ofNullable(phases.get(phase));
    }

    public boolean has(Phase phase) {
        return phases.containsKey(phase);
    }

    public boolean isComplete() {
        return phases.size() == Phase.values().length;
    }

    public Map<Phase, Pose> phases() {
        return phases;
    }

    @Override
    public String toString() {
        return "StrokeSample" + phases.keySet();
    }
}
