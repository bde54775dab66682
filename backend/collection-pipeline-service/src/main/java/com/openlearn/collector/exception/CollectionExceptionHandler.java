package com.openlearn.collector.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 관리 API 전역 예외 핸들러
 */
@RestControllerAdvice(basePackages = "com.openlearn.collector.controller")
@Slf4j
public class CollectionExceptionHandler {

    @ExceptionHandler(SourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSourceNotFound(SourceNotFoundException ex) {
        log.warn("Source not found: {}", ex.getSourceKey());
        return respond(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(JobAlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> handleJobAlreadyRunning(JobAlreadyRunningException ex) {
        log.info("Manual trigger rejected: {}", ex.getMessage());
        return respond(ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(SchedulerHaltedException.class)
    public ResponseEntity<Map<String, Object>> handleSchedulerHalted(SchedulerHaltedException ex) {
        log.warn("Request rejected while scheduler halted: {}", ex.getMessage());
        return respond(ex, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<Map<String, Object>> handleCapacityExceeded(CapacityExceededException ex) {
        log.warn("Capacity exceeded: {}", ex.getMessage());
        ResponseEntity<Map<String, Object>> response = respond(ex, HttpStatus.TOO_MANY_REQUESTS);
        if (ex.getRetryAfter() != null) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header("Retry-After", String.valueOf(Math.max(1, ex.getRetryAfter().toSeconds())))
                    .body(response.getBody());
        }
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        Map<String, Object> body = createErrorResponse("BAD_REQUEST", ex.getMessage(), null,
                HttpStatus.BAD_REQUEST.value());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad request parameter '{}': {}", ex.getName(), ex.getValue());
        Map<String, Object> body = createErrorResponse("BAD_REQUEST",
                "Invalid value for parameter '" + ex.getName() + "': " + ex.getValue(), null,
                HttpStatus.BAD_REQUEST.value());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(CollectionException.class)
    public ResponseEntity<Map<String, Object>> handleCollectionException(CollectionException ex) {
        log.error("Collection error: {}", ex.getMessage(), ex);
        return respond(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        Map<String, Object> body = createErrorResponse(
                "INTERNAL_ERROR",
                "An unexpected error occurred",
                null,
                HttpStatus.INTERNAL_SERVER_ERROR.value()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ResponseEntity<Map<String, Object>> respond(CollectionException ex, HttpStatus status) {
        Map<String, Object> body = createErrorResponse(ex.getErrorCode(), ex.getMessage(),
                ex.getSourceKey(), status.value());
        return ResponseEntity.status(status).body(body);
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, String sourceKey, int status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status);
        response.put("timestamp", LocalDateTime.now().toString());

        if (sourceKey != null) {
            response.put("sourceKey", sourceKey);
        }

        return response;
    }
}
