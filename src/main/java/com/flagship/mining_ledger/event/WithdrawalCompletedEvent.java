package com.flagship.mining_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class WithdrawalCompletedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID withdrawalId;
    String balanceType;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WithdrawalCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WithdrawalCompletedEvent of(UUID accountId, UUID withdrawalId, String balanceType,
                                              BigDecimal amount, Instant occurredAt) {
        return new WithdrawalCompletedEvent(UUID.randomUUID(), accountId, withdrawalId, balanceType,
                amount, occurredAt);
    }
}
