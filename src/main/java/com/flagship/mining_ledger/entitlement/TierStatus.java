package com.flagship.mining_ledger.entitlement;

import com.flagship.mining_ledger.catalog.EntitlementTier;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Status of one catalog tier for one account, as of the report time.
 * A tier counts as owned while an instance of it is active; {@code entitlementId}
 * and {@code purchasedAt} are null otherwise.
 */
@Value
public class TierStatus {
    EntitlementTier tier;
    boolean owned;
    boolean active;
    double progress;
    boolean canRebuy;
    UUID entitlementId;
    Instant purchasedAt;

    static TierStatus idle(EntitlementTier tier) {
        return new TierStatus(tier, false, false, 0.0, true, null, null);
    }

    static TierStatus running(EntitlementTier tier, Entitlement active, Instant now) {
        return new TierStatus(tier, true, true, active.progressAt(now), false,
                active.getId(), active.getPurchasedAt());
    }
}
