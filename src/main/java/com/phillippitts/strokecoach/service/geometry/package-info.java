/**
 * Pure joint-angle and signal helpers shared by phase detection and comparison.
 */
package com.phillippitts.strokecoach.service.geometry;
