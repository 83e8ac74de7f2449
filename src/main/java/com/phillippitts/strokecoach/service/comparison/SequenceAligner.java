package com.phillippitts.strokecoach.service.comparison;

import com.phillippitts.strokecoach.domain.NormalizedPoint;

import java.util.List;

/**
 * Elastic dissimilarity between two ordered point sequences.
 */
public interface SequenceAligner {

    /**
     * @return non-negative distance, zero for identical sequences
     * @throws IllegalArgumentException if either sequence is empty
     */
    double distance(List<NormalizedPoint> a, List<NormalizedPoint> b);
}
