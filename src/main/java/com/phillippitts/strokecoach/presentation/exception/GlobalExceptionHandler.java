package com.phillippitts.strokecoach.presentation.exception;

import com.phillippitts.strokecoach.exception.AnalysisNotFoundException;
import com.phillippitts.strokecoach.exception.AnalysisRejectedException;
import com.phillippitts.strokecoach.exception.AnalysisTimeoutException;
import com.phillippitts.strokecoach.exception.InvalidVideoException;
import com.phillippitts.strokecoach.exception.MissingLandmarksException;
import com.phillippitts.strokecoach.exception.PoseEstimatorException;
import com.phillippitts.strokecoach.exception.ReferenceCorpusException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions raised at the REST boundary to {@link ApiError} bodies.
 *
 * <p>Server-side failures never echo exception messages, which can carry file paths or
 * estimator stderr.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidVideoException.class)
    ResponseEntity<ApiError> handleInvalidVideo(InvalidVideoException ex) {
        LOG.warn("Invalid video: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid video", ex.getReason());
    }

    @ExceptionHandler(MissingLandmarksException.class)
    ResponseEntity<ApiError> handleMissingLandmarks(MissingLandmarksException ex) {
        LOG.warn("Rejected keypoints: missing landmarks {}", ex.getMissing());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Keypoint record is incomplete", "Missing landmarks " + ex.getMissing());
    }

    /**
     * Unknown stroke type, handedness or phase key, and malformed keypoint records.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Request validation failed", details);
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleMissingInput(Exception ex) {
        LOG.warn("Missing request input: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MissingInput", "Required request input is missing", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body", ex);
        return error(HttpStatus.BAD_REQUEST, "MalformedBody", "Request body could not be parsed",
                "Expected a JSON object");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "UploadTooLarge", "Uploaded video is too large",
                "Reduce the clip length or resolution");
    }

    @ExceptionHandler(AnalysisNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(AnalysisNotFoundException ex) {
        LOG.debug("Unknown analysis id {}", ex.getJobId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Analysis not found", "Unknown or expired job id");
    }

    @ExceptionHandler(AnalysisTimeoutException.class)
    ResponseEntity<ApiError> handleTimeout(AnalysisTimeoutException ex) {
        LOG.error("Analysis timed out after {} ms", ex.getTimeoutMs());
        return error(HttpStatus.GATEWAY_TIMEOUT, ex.getClass().getSimpleName(),
                "Analysis timed out", "Please retry with a shorter clip");
    }

    @ExceptionHandler(AnalysisRejectedException.class)
    ResponseEntity<ApiError> handleRejected(AnalysisRejectedException ex) {
        LOG.warn("Analysis {} rejected: job queue full", ex.getJobId());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Analysis queue is full", "Please retry in a few seconds");
    }

    @ExceptionHandler(PoseEstimatorException.class)
    ResponseEntity<ApiError> handleEstimatorUnavailable(PoseEstimatorException ex) {
        LOG.error("Pose estimator unavailable: estimator={}", ex.getEstimator(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Pose estimation temporarily unavailable", "Please retry in a few seconds");
    }

    @ExceptionHandler(ReferenceCorpusException.class)
    ResponseEntity<ApiError> handleCorpus(ReferenceCorpusException ex) {
        LOG.error("Reference corpus unreadable at {}", ex.getCorpusPath(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Reference data unavailable", "Contact administrator");
    }

    /**
     * Catch-all. Framework exceptions that carry their own status (unsupported media type,
     * unknown route) keep it.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            LOG.warn("Request failed with status {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status).body(new ApiError(
                    "HttpError", "Request could not be processed", "Status " + status.value(), Instant.now()));
        }
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Error body returned to API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
