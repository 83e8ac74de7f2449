package com.phillippitts.strokecoach.service.normalize;

import com.phillippitts.strokecoach.domain.BodyLandmarks;
import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.NormalizedPoint;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.exception.MissingLandmarksException;
import com.phillippitts.strokecoach.testutil.Poses;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class KeypointNormalizerTest {

    private final KeypointNormalizer normalizer = new KeypointNormalizer();

    @Test
    void shoulderMidpointBecomesOriginAndShoulderWidthUnit() {
        Map<Integer, NormalizedPoint> points = normalizer.normalize(Poses.standing());

        NormalizedPoint left = points.get(BodyLandmarks.LEFT_SHOULDER);
        NormalizedPoint right = points.get(BodyLandmarks.RIGHT_SHOULDER);
        assertThat((left.x() + right.x()) / 2).isCloseTo(0.0, within(1e-9));
        assertThat((left.y() + right.y()) / 2).isCloseTo(0.0, within(1e-9));
        assertThat(Math.hypot(left.x() - right.x(), left.y() - right.y())).isCloseTo(1.0, within(1e-9));
        assertThat(points).hasSize(BodyLandmarks.COUNT);
    }

    @Test
    void resultIsInvariantToCameraDistanceAndPosition() {
        Map<Integer, NormalizedPoint> near = normalizer.normalize(Poses.standing());
        Map<Integer, NormalizedPoint> far = normalizer.normalize(Poses.builder().transform(0.5, 0.2, -0.1).build());

        near.forEach((index, p) -> {
            assertThat(far.get(index).x()).isCloseTo(p.x(), within(1e-9));
            assertThat(far.get(index).y()).isCloseTo(p.y(), within(1e-9));
        });
    }

    @Test
    void coincidentShouldersFloorScaleToOne() {
        Pose pose = Poses.builder()
                .set(BodyLandmarks.LEFT_SHOULDER, 0.5, 0.4)
                .set(BodyLandmarks.RIGHT_SHOULDER, 0.5, 0.4)
                .build();

        Map<Integer, NormalizedPoint> points = normalizer.normalize(pose);

        Landmark wrist = pose.require(BodyLandmarks.RIGHT_WRIST);
        assertThat(points.get(BodyLandmarks.RIGHT_WRIST).x()).isCloseTo(wrist.x() - 0.5, within(1e-9));
        assertThat(points.get(BodyLandmarks.RIGHT_WRIST).y()).isCloseTo(wrist.y() - 0.4, within(1e-9));
        assertThat(KeypointNormalizer.scale(Landmark.of(0.5, 0.4), Landmark.of(0.5, 0.4))).isEqualTo(1.0);
    }

    @Test
    void missingShoulderIsReported() {
        Pose pose = Poses.builder().without(BodyLandmarks.RIGHT_SHOULDER).build();

        assertThatThrownBy(() -> normalizer.normalize(pose))
                .isInstanceOf(MissingLandmarksException.class)
                .satisfies(e -> assertThat(((MissingLandmarksException) e).getMissing())
                        .containsExactly(BodyLandmarks.RIGHT_SHOULDER));
    }

    @Test
    void selectedJointsKeepRequestedOrderAndSkipAbsent() {
        Pose pose = Poses.builder().without(BodyLandmarks.LEFT_ANKLE).build();

        List<NormalizedPoint> points = normalizer.normalize(pose,
                List.of(BodyLandmarks.RIGHT_WRIST, BodyLandmarks.LEFT_ANKLE, BodyLandmarks.LEFT_HIP));

        assertThat(points).extracting(NormalizedPoint::index)
                .containsExactly(BodyLandmarks.RIGHT_WRIST, BodyLandmarks.LEFT_HIP);
    }

    @Test
    void normalizationIsDeterministic() {
        assertThat(normalizer.normalize(Poses.standing())).isEqualTo(normalizer.normalize(Poses.standing()));
    }
}
