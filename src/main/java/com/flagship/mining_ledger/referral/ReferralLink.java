package com.flagship.mining_ledger.referral;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Records that {@code referredId} signed up with {@code referrerId}'s code.
 * Starts unvalidated and becomes valid at most once, on the referred
 * account's first purchase.
 */
@Value
public class ReferralLink {
    UUID id;
    UUID referrerId;
    UUID referredId;
    boolean valid;
    Instant createdAt;
    Instant validatedAt;

    public static ReferralLink create(UUID id, UUID referrerId, UUID referredId, Instant createdAt) {
        return new ReferralLink(id, referrerId, referredId, false, createdAt, null);
    }

    /**
     * @throws IllegalStateException if the link is already valid
     */
    public ReferralLink validate(Instant now) {
        if (valid) {
            throw new IllegalStateException("Referral link " + id + " is already validated");
        }
        return new ReferralLink(id, referrerId, referredId, true, createdAt, now);
    }
}
