package com.phillippitts.strokecoach.service.comparison;

import com.phillippitts.strokecoach.domain.NormalizedPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DtwSequenceAlignerTest {

    private final DtwSequenceAligner aligner = new DtwSequenceAligner();

    private static NormalizedPoint p(double x, double y) {
        return new NormalizedPoint(0, x, y);
    }

    @Test
    void identicalSequencesHaveZeroDistance() {
        List<NormalizedPoint> seq = List.of(p(0, 0), p(1, 0), p(1, 1));

        assertThat(aligner.distance(seq, List.copyOf(seq))).isZero();
    }

    @Test
    void differentSequencesHavePositiveDistance() {
        List<NormalizedPoint> a = List.of(p(0, 0), p(1, 0));
        List<NormalizedPoint> b = List.of(p(0, 0), p(1, 0.5));

        assertThat(aligner.distance(a, b)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void distanceIsSymmetric() {
        List<NormalizedPoint> a = List.of(p(0, 0), p(2, 1), p(3, 3), p(-1, 2));
        List<NormalizedPoint> b = List.of(p(0.5, 0), p(2, 2), p(4, 3));

        assertThat(aligner.distance(a, b)).isCloseTo(aligner.distance(b, a), within(1e-12));
    }

    @Test
    void singlePointsDegenerateToEuclideanDistance() {
        assertThat(aligner.distance(List.of(p(0, 0)), List.of(p(3, 4)))).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void warpingAbsorbsRepeatedPoints() {
        List<NormalizedPoint> a = List.of(p(0, 0), p(1, 1), p(2, 2));
        List<NormalizedPoint> b = List.of(p(0, 0), p(1, 1), p(1, 1), p(2, 2));

        assertThat(aligner.distance(a, b)).isZero();
    }

    @Test
    void emptySequenceIsRejected() {
        assertThatThrownBy(() -> aligner.distance(List.of(), List.of(p(0, 0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> aligner.distance(List.of(p(0, 0)), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
