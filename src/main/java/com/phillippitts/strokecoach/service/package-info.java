/**
 * Service layer. Leaves first: geometry and normalization, pose source, phase
 * detection, comparison against the reference corpus, then the analysis pipeline
 * and its jobs.
 */
package com.phillippitts.strokecoach.service;
