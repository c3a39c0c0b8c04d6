package com.flagship.mining_ledger.account;

/**
 * Monotonic account flags that gate withdrawals. Once raised, never lowered.
 */
public enum EligibilityFlag {
    ANY_ENTITLEMENT,
    TOP_TIER_ENTITLEMENT
}
