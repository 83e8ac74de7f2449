package com.phillippitts.strokecoach.presentation.exception;

import com.phillippitts.strokecoach.exception.AnalysisNotFoundException;
import com.phillippitts.strokecoach.exception.AnalysisRejectedException;
import com.phillippitts.strokecoach.exception.AnalysisTimeoutException;
import com.phillippitts.strokecoach.exception.InvalidVideoException;
import com.phillippitts.strokecoach.exception.MissingLandmarksException;
import com.phillippitts.strokecoach.exception.PoseEstimatorException;
import com.phillippitts.strokecoach.exception.ReferenceCorpusException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidVideoIsBadRequestWithReason() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleInvalidVideo(new InvalidVideoException("no frames decoded"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidVideoException");
        assertThat(response.getBody().details()).isEqualTo("no frames decoded");
    }

    @Test
    void missingLandmarksListsIndices() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleMissingLandmarks(new MissingLandmarksException(List.of(11, 12)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).contains("11").contains("12");
    }

    @Test
    void unknownStrokeTypeIsBadRequest() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleIllegalArgument(new IllegalArgumentException("Unknown stroke type: lob"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("BadRequest");
        assertThat(response.getBody().details()).isEqualTo("Unknown stroke type: lob");
    }

    @Test
    void unknownJobIsNotFound() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleNotFound(new AnalysisNotFoundException("abc"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().message()).isEqualTo("Analysis not found");
    }

    @Test
    void timeoutIsGatewayTimeout() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleTimeout(new AnalysisTimeoutException("comparison", 300_000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    }

    @Test
    void estimatorOutageIsUnavailableAndHidesInternals() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleEstimatorUnavailable(
                new PoseEstimatorException("Cannot start /opt/secret/python3", "pose-estimator"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("/opt/secret");
    }

    @Test
    void saturatedJobQueueIsUnavailable() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleRejected(
                new AnalysisRejectedException("job-1", new RejectedExecutionException("pool full")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("AnalysisRejectedException");
        assertThat(response.getBody().message()).isEqualTo("Analysis queue is full");
    }

    @Test
    void corpusFailureIsUnavailableAndHidesPath() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleCorpus(
                new ReferenceCorpusException("/data/secret/corpus", new IOException("denied")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("/data/secret");
    }

    @Test
    void unexpectedErrorIsGenericWithTimestamp() {
        Instant before = Instant.now();

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("stack detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("stack detail");
        assertThat(response.getBody().timestamp()).isAfterOrEqualTo(before);
    }

    @Test
    void frameworkExceptionsKeepTheirStatus() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new HttpMediaTypeNotSupportedException("text/plain not supported"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
        assertThat(response.getBody().errorCode()).isEqualTo("HttpError");
    }
}
