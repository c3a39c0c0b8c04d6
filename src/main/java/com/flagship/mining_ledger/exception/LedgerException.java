package com.flagship.mining_ledger.exception;

import lombok.Getter;

/**
 * A business rejection. Thrown inside a transaction it rolls the whole
 * operation back, so no partial state survives a failed multi-step call.
 */
@Getter
public class LedgerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static LedgerException accountNotFound(Object accountId) {
        return new LedgerException(ErrorKind.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
    }
}
