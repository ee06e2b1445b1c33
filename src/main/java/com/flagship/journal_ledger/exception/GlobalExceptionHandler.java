package com.flagship.journal_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.journal_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger failures to HTTP responses.
 *
 * Validation 400, contention 503 (retry later), state conflicts 409,
 * missing entries 404, broken chart of accounts 422.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerValidationException.class)
    public ResponseEntity<ErrorResponse> handleLedgerValidation(LedgerValidationException e) {
        log.warn("Journal entry rejected: {}", e.getViolations());

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .code(e.getErrorCode())
            .message(e.getMessage())
            .violations(e.getViolations())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(LedgerConcurrencyException.class)
    public ResponseEntity<ErrorResponse> handleContention(LedgerConcurrencyException e) {
        log.warn("Ledger contention persisted after retries: code={}, error={}", e.getErrorCode(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Service Busy")
            .code(e.getErrorCode())
            .message(e.getMessage())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header("Retry-After", "1")
            .body(error);
    }

    @ExceptionHandler(LedgerStateException.class)
    public ResponseEntity<ErrorResponse> handleState(LedgerStateException e) {
        log.warn("Invalid entry state: code={}, error={}", e.getErrorCode(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid State")
            .code(e.getErrorCode())
            .message(e.getMessage())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(JournalEntryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JournalEntryNotFoundException e) {
        ErrorResponse error = ErrorResponse.builder()
            .error("Not Found")
            .code(e.getErrorCode())
            .message(e.getMessage())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(ChartOfAccountsIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleChartOfAccounts(ChartOfAccountsIntegrityException e) {
        log.error("Chart of accounts misconfigured: account={}, error={}", e.getAccountCode(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Chart Of Accounts Integrity")
            .code(e.getErrorCode())
            .message(e.getMessage())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
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
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Malformed Request")
            .message("Request could not be read")
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid State")
            .message(e.getMessage())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        List<String> violations;
        Map<String, String> details;
        String correlationId;
        Instant timestamp;
    }
}
