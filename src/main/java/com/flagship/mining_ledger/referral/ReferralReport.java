package com.flagship.mining_ledger.referral;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
public class ReferralReport {
    String referralCode;
    List<Entry> validReferrals;
    List<Entry> invalidReferrals;
    BigDecimal totalEarned;

    @Value
    public static class Entry {
        String username;
        Instant joinedAt;
        boolean valid;
    }
}
