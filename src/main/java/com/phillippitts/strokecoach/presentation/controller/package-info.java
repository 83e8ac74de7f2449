/**
 * REST endpoints: {@code /analyses} (upload and poll), {@code /comparisons} and
 * {@code /corpus/reload}.
 */
package com.phillippitts.strokecoach.presentation.controller;
