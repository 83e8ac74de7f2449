/**
 * Reference corpus: file layout, keypoint record codec and clip lookup.
 */
package com.phillippitts.strokecoach.service.corpus;
