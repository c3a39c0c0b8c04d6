package com.flagship.mining_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Business errors are translated through a fixed table. Persistence and
 * collaborator faults become 503 and are logged as errors.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final Map<ErrorKind, HttpStatus> STATUS_TABLE = new EnumMap<>(ErrorKind.class);

    static {
        STATUS_TABLE.put(ErrorKind.DUPLICATE_ACCOUNT, HttpStatus.CONFLICT);
        STATUS_TABLE.put(ErrorKind.INVALID_REFERRAL_CODE, HttpStatus.BAD_REQUEST);
        STATUS_TABLE.put(ErrorKind.INVALID_CREDENTIALS, HttpStatus.UNAUTHORIZED);
        STATUS_TABLE.put(ErrorKind.UNKNOWN_TIER, HttpStatus.BAD_REQUEST);
        STATUS_TABLE.put(ErrorKind.DUPLICATE_ACTIVE_ENTITLEMENT, HttpStatus.CONFLICT);
        STATUS_TABLE.put(ErrorKind.PAYMENT_UNVERIFIED, HttpStatus.UNPROCESSABLE_ENTITY);
        STATUS_TABLE.put(ErrorKind.UNKNOWN_BALANCE_TYPE, HttpStatus.BAD_REQUEST);
        STATUS_TABLE.put(ErrorKind.BELOW_MINIMUM, HttpStatus.UNPROCESSABLE_ENTITY);
        STATUS_TABLE.put(ErrorKind.NOT_ELIGIBLE, HttpStatus.FORBIDDEN);
        STATUS_TABLE.put(ErrorKind.INSUFFICIENT_FUNDS, HttpStatus.UNPROCESSABLE_ENTITY);
        STATUS_TABLE.put(ErrorKind.ACCOUNT_NOT_FOUND, HttpStatus.NOT_FOUND);
        STATUS_TABLE.put(ErrorKind.INVALID_AMOUNT, HttpStatus.BAD_REQUEST);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return STATUS_TABLE.getOrDefault(kind, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        log.warn("Request rejected: kind={}, message={}", e.getKind(), e.getMessage());

        ApiError error = ApiError.builder()
            .error(e.getKind().name())
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(statusFor(e.getKind())).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ApiError error = ApiError.builder()
            .error("MISSING_HEADER")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error("VALIDATION_FAILED")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("MALFORMED_REQUEST")
            .message("Request body is missing or malformed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Unique constraints are the last line of defence for usernames, referral
     * codes and idempotency keys racing past the service-level checks.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());

        ApiError error = ApiError.builder()
            .error("CONFLICT")
            .message("The request conflicts with the current state of the resource")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler({InfrastructureException.class, DataAccessException.class, TransactionException.class})
    public ResponseEntity<ApiError> handleInfrastructureFailure(RuntimeException e) {
        log.error("Infrastructure failure", e);

        ApiError error = ApiError.builder()
            .error("SERVICE_UNAVAILABLE")
            .message("A backing service is unavailable, please retry later")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
