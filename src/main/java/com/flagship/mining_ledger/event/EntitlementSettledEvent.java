package com.flagship.mining_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published exactly once per entitlement, when its payout is credited.
 */
@Value
public class EntitlementSettledEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID entitlementId;
    String tierId;
    BigDecimal payout;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EntitlementSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EntitlementSettledEvent of(UUID accountId, UUID entitlementId, String tierId,
                                             BigDecimal payout, Instant occurredAt) {
        return new EntitlementSettledEvent(UUID.randomUUID(), accountId, entitlementId, tierId,
                payout, occurredAt);
    }
}
