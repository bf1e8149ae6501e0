package com.portfolio.mirror.common.exception;

import com.portfolio.mirror.common.Result;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.client.HttpStatusCodeException;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseBrokerException.class)
    public ResponseEntity<?> handleBrokerException(BaseBrokerException ex) {
        log.warn("Application exception: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return Http.from(Result.fail(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(BulkheadFullException.class)
    public ResponseEntity<?> handleRateLimited(BulkheadFullException ex) {
        log.warn("Upstream call not admitted: {}", ex.getMessage());
        return Http.from(Result.fail("ERR-RATE-001", "Brokerage request budget exhausted, retry later"));
    }

    @ExceptionHandler(HttpStatusCodeException.class)
    public ResponseEntity<?> handleUpstreamStatus(HttpStatusCodeException ex) {
        log.warn("Brokerage returned {}: {}", ex.getStatusCode().value(), ex.getResponseBodyAsString());
        return Http.from(Result.fail("ERR-UPSTREAM-002",
                "Brokerage rejected the request (HTTP " + ex.getStatusCode().value() + ")"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return Http.from(Result.fail("ERR-VAL-001", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((error1, error2) -> error1 + ", " + error2)
                .orElse("Validation failed");

        log.warn("Validation error: {}", errorMessage);
        return Http.from(Result.fail("ERR-VAL-003", errorMessage));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request payload: {}", ex.getMessage());
        return Http.from(Result.fail("ERR-REQ-001", "Malformed request payload"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<?> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing request parameter: {}", ex.getMessage());
        return Http.from(Result.fail("ERR-REQ-003", ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<?> handleDataAccessException(DataAccessException ex) {
        log.error("Database error", ex);
        return Http.from(Result.fail("ERR-DB-002", "Database operation failed"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleGenericException(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return Http.from(Result.fail("ERR-SYS-001", "An unexpected error occurred: " + ex.getMessage()));
    }
}
