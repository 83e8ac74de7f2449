/**
 * Comparison of a user stroke against the reference corpus.
 *
 * <p>{@link com.phillippitts.strokecoach.service.comparison.PhaseComparator} aligns one
 * phase with {@link com.phillippitts.strokecoach.service.comparison.DtwSequenceAligner} over
 * the twelve compared joints (shoulders, elbows, wrists, hips, knees, ankles) and reports
 * elbow-angle deviations. {@link com.phillippitts.strokecoach.service.comparison.ReferenceMatcher}
 * sums the three phase distances per corpus entry and keeps the smallest.
 */
package com.phillippitts.strokecoach.service.comparison;
