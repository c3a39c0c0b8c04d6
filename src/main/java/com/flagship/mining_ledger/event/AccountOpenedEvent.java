package com.flagship.mining_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class AccountOpenedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    String username;
    String referralCode;
    BigDecimal signupBonus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AccountOpenedEvent of(UUID accountId, String username, String referralCode,
                                        BigDecimal signupBonus, Instant occurredAt) {
        return new AccountOpenedEvent(UUID.randomUUID(), accountId, username, referralCode,
                signupBonus, occurredAt);
    }
}
