package com.phillippitts.strokecoach.domain;

import java.util.Objects;

public record ReferenceEntry(ReferenceKey key, StrokeSample sample) {

    public ReferenceEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(sample, "sample");
    }
}
