package com.flagship.mining_ledger.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Every error kind has an explicit status")
    void everyKind_IsMapped() {
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorKind.DUPLICATE_ACCOUNT));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.INVALID_REFERRAL_CODE));
        assertEquals(HttpStatus.UNAUTHORIZED, GlobalExceptionHandler.statusFor(ErrorKind.INVALID_CREDENTIALS));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.UNKNOWN_TIER));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorKind.DUPLICATE_ACTIVE_ENTITLEMENT));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(ErrorKind.PAYMENT_UNVERIFIED));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.UNKNOWN_BALANCE_TYPE));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(ErrorKind.BELOW_MINIMUM));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusFor(ErrorKind.NOT_ELIGIBLE));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(ErrorKind.INSUFFICIENT_FUNDS));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(ErrorKind.ACCOUNT_NOT_FOUND));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.INVALID_AMOUNT));
    }

    @Test
    @DisplayName("Business error renders its kind and message")
    void ledgerException_Rendered() {
        ResponseEntity<ApiError> response = handler.handleLedgerException(
                new LedgerException(ErrorKind.NOT_ELIGIBLE, "Buy a node first"));

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        assertEquals("NOT_ELIGIBLE", response.getBody().getError());
        assertEquals("Buy a node first", response.getBody().getMessage());
    }

    @Test
    @DisplayName("Lock timeouts and collaborator outages are 503, not business errors")
    void infrastructure_Is503() {
        ResponseEntity<ApiError> lock = handler.handleInfrastructureFailure(
                new CannotAcquireLockException("lock timeout"));
        ResponseEntity<ApiError> collaborator = handler.handleInfrastructureFailure(
                new InfrastructureException("Payment verification timed out", new RuntimeException()));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, lock.getStatusCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, collaborator.getStatusCode());
        assertEquals("SERVICE_UNAVAILABLE", collaborator.getBody().getError());
    }
}
