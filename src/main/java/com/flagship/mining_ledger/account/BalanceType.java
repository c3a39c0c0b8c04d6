package com.flagship.mining_ledger.account;

import java.util.Arrays;
import java.util.Optional;

/**
 * The two balances every account carries. The wire value is what clients send
 * in withdrawal requests.
 */
public enum BalanceType {
    /**
     * Signup bonus plus entitlement payouts.
     */
    EARNED("mine"),

    /**
     * Rewards for validated referrals.
     */
    REFERRAL("referral");

    private final String wireValue;

    BalanceType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<BalanceType> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.wireValue.equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
