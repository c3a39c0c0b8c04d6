package com.flagship.mining_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only snapshot of an account's ledger state.
 *
 * Snapshots are taken under the account lock, so balances and flags in one
 * instance are mutually consistent.
 */
@Value
public class Account {

    /**
     * Decimal places stored for balances and amounts, matching {@code NUMERIC(19, 4)}.
     */
    public static final int AMOUNT_SCALE = 4;

    UUID id;
    String username;
    String referralCode;
    BigDecimal earnedBalance;
    BigDecimal referralBalance;
    boolean anyEntitlementPurchased;
    boolean topTierEntitlementPurchased;
    Instant createdAt;

    public BigDecimal balanceOf(BalanceType type) {
        return switch (type) {
            case EARNED -> earnedBalance;
            case REFERRAL -> referralBalance;
        };
    }

    /**
     * True when the amount needs no rounding to be stored.
     */
    public static boolean fitsAmountScale(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= AMOUNT_SCALE;
    }

    public boolean hasFlag(EligibilityFlag flag) {
        return switch (flag) {
            case ANY_ENTITLEMENT -> anyEntitlementPurchased;
            case TOP_TIER_ENTITLEMENT -> topTierEntitlementPurchased;
        };
    }
}
