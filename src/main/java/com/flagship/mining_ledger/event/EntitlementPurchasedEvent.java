package com.flagship.mining_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when an account buys an entitlement. {@code firstPurchase} is the
 * value captured before the purchase raised any flag.
 */
@Value
public class EntitlementPurchasedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID entitlementId;
    String tierId;
    BigDecimal cost;
    boolean firstPurchase;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EntitlementPurchased";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EntitlementPurchasedEvent of(UUID accountId, UUID entitlementId, String tierId,
                                               BigDecimal cost, boolean firstPurchase, Instant occurredAt) {
        return new EntitlementPurchasedEvent(UUID.randomUUID(), accountId, entitlementId, tierId,
                cost, firstPurchase, occurredAt);
    }
}
