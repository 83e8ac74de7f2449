package com.phillippitts.strokecoach.service.comparison;

import com.phillippitts.strokecoach.domain.NormalizedPoint;
import com.phillippitts.strokecoach.service.geometry.JointGeometry;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Exact dynamic time warping with Euclidean point cost.
 *
 * <p>Steps are {@code (i-1, j)}, {@code (i, j-1)} and {@code (i-1, j-1)}; the result is
 * the summed cost along the optimal path. The recurrence is symmetric in its two
 * arguments. Sequences here are at most a dozen joints long, so the full quadratic
 * table is used.
 */
@Component
public class DtwSequenceAligner implements SequenceAligner {

    @Override
    public double distance(List<NormalizedPoint> a, List<NormalizedPoint> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            throw new IllegalArgumentException("DTW requires two non-empty sequences");
        }
        int n = a.size();
        int m = b.size();
        double[] prev = new double[m + 1];
        double[] curr = new double[m + 1];
        Arrays.fill(prev, Double.POSITIVE_INFINITY);
        prev[0] = 0.0;

        for (int i = 1; i <= n; i++) {
            curr[0] = Double.POSITIVE_INFINITY;
            NormalizedPoint pa = a.get(i - 1);
            for (int j = 1; j <= m; j++) {
                double cost = JointGeometry.distance(pa, b.get(j - 1));
                double best = Math.min(prev[j], Math.min(curr[j - 1], prev[j - 1]));
                curr[j] = cost + best;
            }
            double[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[m];
    }
}
