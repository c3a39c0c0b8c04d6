package com.flagship.mining_ledger.entitlement;

/**
 * Lifecycle of an entitlement instance.
 *
 * ACTIVE -> COMPLETED, once its duration has elapsed. COMPLETED is terminal.
 */
public enum EntitlementStatus {
    ACTIVE,
    COMPLETED
}
