package com.flagship.mining_ledger.exception;

/**
 * A collaborator or persistence fault (timeout, connectivity, unexpected
 * collaborator error). Never conflated with a business rejection.
 */
public class InfrastructureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
