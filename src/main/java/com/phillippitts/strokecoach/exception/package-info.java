/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.strokecoach.exception.StrokeCoachException}
 * (unchecked) and map to HTTP responses in
 * {@code com.phillippitts.strokecoach.presentation.exception.GlobalExceptionHandler}:
 * <ul>
 *   <li>{@link com.phillippitts.strokecoach.exception.InvalidVideoException} - the video
 *       cannot be turned into a pose track (400)</li>
 *   <li>{@link com.phillippitts.strokecoach.exception.PoseEstimatorException} - the external
 *       pose estimator cannot run (503)</li>
 *   <li>{@link com.phillippitts.strokecoach.exception.AnalysisNotFoundException} - unknown
 *       analysis id (404)</li>
 *   <li>{@link com.phillippitts.strokecoach.exception.AnalysisTimeoutException} - analysis
 *       exceeded its deadline</li>
 *   <li>{@link com.phillippitts.strokecoach.exception.MissingLandmarksException} - a
 *       landmark precondition was violated</li>
 *   <li>{@link com.phillippitts.strokecoach.exception.ReferenceCorpusException} - the corpus
 *       could not be re-read</li>
 * </ul>
 *
 * <p>Missing poses, missing phases and an empty corpus are not exceptions: they are
 * modeled as empty optionals, {@code DetectionOutcome.NOT_FOUND} and the no-reference
 * comparison result.
 *
 * @since 1.0
 */
package com.phillippitts.strokecoach.exception;
