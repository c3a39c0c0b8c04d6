package com.flagship.mining_ledger.exception;

/**
 * Business error kinds raised by the ledger core.
 *
 * Every kind is an expected, caller-recoverable rejection. The HTTP status for
 * each kind lives in {@link GlobalExceptionHandler}; nothing in the core knows
 * about transport codes.
 */
public enum ErrorKind {
    DUPLICATE_ACCOUNT,
    INVALID_REFERRAL_CODE,
    INVALID_CREDENTIALS,
    UNKNOWN_TIER,
    DUPLICATE_ACTIVE_ENTITLEMENT,
    PAYMENT_UNVERIFIED,
    UNKNOWN_BALANCE_TYPE,
    BELOW_MINIMUM,
    NOT_ELIGIBLE,
    INSUFFICIENT_FUNDS,
    ACCOUNT_NOT_FOUND,
    INVALID_AMOUNT
}
