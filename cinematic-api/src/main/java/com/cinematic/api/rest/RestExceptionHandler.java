package com.cinematic.api.rest;

import com.cinematic.core.exception.BuildException;
import com.cinematic.core.exception.InvalidStateException;
import com.cinematic.core.exception.NotFoundException;
import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.core.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * Maps pipeline exceptions to HTTP responses with a uniform error body.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(BuildException.class)
    public ResponseEntity<ErrorResponse> handleBuild(BuildException e) {
        log.info("Rejected project: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e, e.getErrors());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e, List.of());
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateException e) {
        log.info("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e, List.of());
    }

    @ExceptionHandler(PersistenceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(PersistenceUnavailableException e) {
        log.warn("Request refused during store outage: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, List.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("MALFORMED_REQUEST", "Request body could not be read", Instant.now(), List.of()));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, PipelineException e, List<String> details) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), Instant.now(), details));
    }

    public record ErrorResponse(
        String errorCode,
        String message,
        Instant timestamp,
        List<String> details
    ) {}
}
