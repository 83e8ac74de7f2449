/**
 * Pose estimation seam. The production {@link com.phillippitts.strokecoach.service.pose.PoseSource}
 * runs an external estimator process and parses its JSON pose track.
 */
package com.phillippitts.strokecoach.service.pose;
