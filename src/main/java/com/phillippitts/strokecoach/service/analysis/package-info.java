/**
 * Analysis pipeline and asynchronous job handling.
 *
 * <p>{@link com.phillippitts.strokecoach.service.analysis.StrokeAnalysisService} runs one
 * video end to end; {@link com.phillippitts.strokecoach.service.analysis.AnalysisJobService}
 * wraps it in a job with status tracking, a deadline and retention-based cleanup.
 * No job state is global: the store is a bean and each run carries its own
 * {@link com.phillippitts.strokecoach.service.analysis.AnalysisContext}.
 */
package com.phillippitts.strokecoach.service.analysis;
