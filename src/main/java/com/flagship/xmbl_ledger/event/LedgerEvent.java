package com.flagship.xmbl_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger events.
 *
 * One event is emitted per successful mutating operation, carrying enough
 * data for an indexer to rebuild the share table from the event log.
 */
public interface LedgerEvent {

    String SHARE_AGGREGATE = "Share";
    String LEDGER_AGGREGATE = "Ledger";

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * Aggregate the event is about ("Share" or "Ledger").
     */
    String getAggregateType();

    /**
     * Identifier of the aggregate instance, also used as the Kafka key.
     */
    String getAggregateId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
