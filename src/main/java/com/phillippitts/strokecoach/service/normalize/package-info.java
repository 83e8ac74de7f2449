/**
 * Body-centric keypoint normalization.
 *
 * <p>Points are translated so the shoulder midpoint is the origin and divided by the
 * shoulder width, making comparisons independent of camera distance and framing. Coincident
 * shoulders floor the scale to 1.0.
 */
package com.phillippitts.strokecoach.service.normalize;
