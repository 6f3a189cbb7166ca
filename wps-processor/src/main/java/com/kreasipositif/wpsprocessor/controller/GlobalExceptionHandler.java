package com.kreasipositif.wpsprocessor.controller;

import com.kreasipositif.wpsprocessor.exception.BatchNotFoundException;
import com.kreasipositif.wpsprocessor.exception.ConnectionNotActiveException;
import com.kreasipositif.wpsprocessor.exception.ConnectionNotFoundException;
import com.kreasipositif.wpsprocessor.exception.DuplicateSubmissionException;
import com.kreasipositif.wpsprocessor.exception.InvalidRuleDefinitionException;
import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import com.kreasipositif.wpsprocessor.exception.NoEligibleEmployeesException;
import com.kreasipositif.wpsprocessor.exception.RetryExhaustedException;
import com.kreasipositif.wpsprocessor.exception.SifFormatException;
import com.kreasipositif.wpsprocessor.exception.SubmissionNotFoundException;
import com.kreasipositif.wpsprocessor.exception.ValidationBlockedException;
import com.kreasipositif.wpsprocessor.exception.WpsException;
import com.kreasipositif.wpsprocessor.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps pipeline exceptions to HTTP responses with a {@code {code, message}} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Request validation error: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(SifFormatException.class)
    public ResponseEntity<ErrorResponse> handleSifFormat(SifFormatException ex) {
        log.warn("SIF format error: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("SIF_FORMAT_ERROR", ex.getMessage()));
    }

    @ExceptionHandler({InvalidRuleDefinitionException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler({BatchNotFoundException.class, SubmissionNotFoundException.class, ConnectionNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(WpsException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateTransitionException ex) {
        log.warn("Invalid state transition: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("INVALID_STATE", ex.getMessage()));
    }

    @ExceptionHandler(DuplicateSubmissionException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateSubmissionException ex) {
        log.warn("Duplicate submission: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("DUPLICATE_SUBMISSION", ex.getMessage()));
    }

    @ExceptionHandler(ConnectionNotActiveException.class)
    public ResponseEntity<ErrorResponse> handleConnectionNotActive(ConnectionNotActiveException ex) {
        log.warn("Connection not active: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("CONNECTION_NOT_ACTIVE", ex.getMessage()));
    }

    @ExceptionHandler(NoEligibleEmployeesException.class)
    public ResponseEntity<ErrorResponse> handleNoEligibleEmployees(NoEligibleEmployeesException ex) {
        log.warn("No eligible employees: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("NO_ELIGIBLE_EMPLOYEES", ex.getMessage()));
    }

    @ExceptionHandler(ValidationBlockedException.class)
    public ResponseEntity<ValidationBlockedResponse> handleValidationBlocked(ValidationBlockedException ex) {
        log.warn("Validation blocked batch {}: {}", ex.getBatchReference(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ValidationBlockedResponse("VALIDATION_BLOCKED", ex.getMessage(), ex.getResult()));
    }

    @ExceptionHandler(RetryExhaustedException.class)
    public ResponseEntity<RetryExhaustedResponse> handleRetryExhausted(RetryExhaustedException ex) {
        log.error("Submission {} exhausted its retries: {}", ex.getSubmissionReference(), ex.getLastError());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new RetryExhaustedResponse("RETRY_EXHAUSTED", ex.getMessage(), ex.getSubmissionReference(),
                        ex.getRetryCount(), ex.getLastError(), ex.getCreatedAt(), ex.getFailedAt()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    record ErrorResponse(String code, String message) {}

    record ValidationBlockedResponse(String code, String message, ValidationResult result) {}

    record RetryExhaustedResponse(String code, String message, String submissionReference, int retryCount,
                                  String lastError, Instant createdAt, Instant failedAt) {}
}
