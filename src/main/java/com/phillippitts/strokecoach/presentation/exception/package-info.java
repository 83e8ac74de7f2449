/**
 * HTTP error mapping for the REST layer.
 */
package com.phillippitts.strokecoach.presentation.exception;
