/**
 * Immutable domain model: landmarks, poses, stroke samples, reference keys and
 * comparison results.
 *
 * <p>Types here carry no Spring dependencies and are safe to share across threads.
 *
 * @since 1.0
 */
package com.phillippitts.strokecoach.domain;
