/**
 * Actuator health indicators for the pose estimator and the reference corpus.
 */
package com.phillippitts.strokecoach.service.health;
