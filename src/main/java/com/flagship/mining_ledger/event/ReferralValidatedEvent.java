package com.flagship.mining_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a referred account's first purchase validates its referral.
 * The aggregate is the referrer, whose referral balance was credited.
 */
@Value
public class ReferralValidatedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID referredAccountId;
    UUID referralLinkId;
    BigDecimal reward;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ReferralValidated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ReferralValidatedEvent of(UUID referrerId, UUID referredAccountId, UUID referralLinkId,
                                            BigDecimal reward, Instant occurredAt) {
        return new ReferralValidatedEvent(UUID.randomUUID(), referrerId, referredAccountId, referralLinkId,
                reward, occurredAt);
    }
}
