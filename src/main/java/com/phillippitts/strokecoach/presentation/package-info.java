/**
 * HTTP boundary of the service.
 *
 * <p>Controllers are thin adapters over {@code service}: they parse request parameters
 * into domain types, delegate, and map results into the records in {@code presentation.dto}.
 * Exceptions are translated to status codes by
 * {@link com.phillippitts.strokecoach.presentation.exception.GlobalExceptionHandler}.
 *
 * <ul>
 *   <li>{@code POST /analyses} accepts a video upload and answers 202 with a job id</li>
 *   <li>{@code GET /analyses/{id}} reports job status and, when done, the analysis report</li>
 *   <li>{@code POST /comparisons} compares pre-extracted keypoints against the corpus</li>
 *   <li>{@code POST /corpus/reload} re-reads the reference corpus</li>
 * </ul>
 */
package com.phillippitts.strokecoach.presentation;
