package com.flagship.mining_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger domain events.
 *
 * Every event is a fact about one account. The account id is the outbox
 * aggregate id and the Kafka key, so consumers see one account's events in
 * commit order.
 */
public interface LedgerEvent {

    String AGGREGATE_TYPE = "Account";

    /**
     * Unique identifier for this event instance, for consumer deduplication.
     */
    UUID getEventId();

    /**
     * The account whose ledger state this event describes.
     */
    UUID getAccountId();

    Instant getOccurredAt();

    String getEventType();
}
