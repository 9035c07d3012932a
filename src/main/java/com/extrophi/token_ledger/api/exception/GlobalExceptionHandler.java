package com.extrophi.token_ledger.api.exception;

import com.extrophi.token_ledger.ledger.LedgerError;
import com.extrophi.token_ledger.ledger.LedgerErrorKind;
import com.extrophi.token_ledger.ledger.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 *
 * Ledger failures map to:
 * - 400 for invalid amounts, metadata or idempotency keys, self transfers,
 *   insufficient balance and unknown attribution kinds
 * - 404 for unknown accounts
 * - 409 for an idempotency key reused with a different request
 * - 503 for storage faults
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(LedgerException e) {
        LedgerError ledgerError = e.getError();
        HttpStatus status = statusFor(ledgerError.getKind());

        if (status.is5xxServerError()) {
            log.error("Ledger operation failed: {}", ledgerError.getMessage());
        } else {
            log.warn("Ledger operation rejected: kind={}, message={}", ledgerError.getKind(), ledgerError.getMessage());
        }

        ErrorResponse error = ErrorResponse.builder()
            .error(ledgerError.getKind().name())
            .message(ledgerError.getMessage())
            .details(ledgerError.getDetails().isEmpty() ? null : ledgerError.getDetails())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("VALIDATION_FAILED")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return badRequest("Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return badRequest("Invalid value for parameter '" + e.getName() + "'");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return badRequest(e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(LedgerErrorKind kind) {
        return switch (kind) {
            case ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case IDEMPOTENCY_KEY_CONFLICT -> HttpStatus.CONFLICT;
            case STORAGE_FAULT -> HttpStatus.SERVICE_UNAVAILABLE;
            case INVALID_AMOUNT, INVALID_METADATA, INVALID_IDEMPOTENCY_KEY, SELF_TRANSFER,
                 INSUFFICIENT_BALANCE, UNKNOWN_ATTRIBUTION_KIND -> HttpStatus.BAD_REQUEST;
        };
    }

    private ResponseEntity<ErrorResponse> badRequest(String message) {
        ErrorResponse error = ErrorResponse.builder()
            .error("INVALID_REQUEST")
            .message(message)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
