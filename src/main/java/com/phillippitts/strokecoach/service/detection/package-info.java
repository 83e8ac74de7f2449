/**
 * Phase detectors and the service that runs them concurrently.
 *
 * <p>Detectors degrade through fallback tiers rather than failing:
 * <ul>
 *   <li>Preparation: biomechanical score or {@code NOT_FOUND}</li>
 *   <li>Impact: angular-acceleration peak, then maximum extension</li>
 *   <li>Follow-through: stabilized finish, then best-scoring frame, then a temporal guess</li>
 * </ul>
 * All constants come from {@link com.phillippitts.strokecoach.config.properties.PhaseDetectionProperties}.
 */
package com.phillippitts.strokecoach.service.detection;
