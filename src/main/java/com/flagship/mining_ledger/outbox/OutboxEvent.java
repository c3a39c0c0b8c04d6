package com.flagship.mining_ledger.outbox;

import com.flagship.mining_ledger.event.LedgerEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in, or already published from, the outbox table.
 *
 * The row id is the event id, so a consumer that deduplicates on the event id
 * also deduplicates redeliveries of the same row.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID accountId;
    String eventType;
    String payload;
    Instant occurredAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent pending(LedgerEvent event, String payload) {
        return new OutboxEvent(
            event.getEventId(),
            LedgerEvent.AGGREGATE_TYPE,
            event.getAccountId(),
            event.getEventType(),
            payload,
            event.getOccurredAt(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
