package com.flagship.xmbl_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an outbox event.
 *
 * A ledger event waiting to be published to Kafka. Written in the same
 * database transaction as the ledger mutation that produced it, then
 * published asynchronously by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;                   // same as the ledger event's eventId
    String aggregateType;      // "Share" or "Ledger"
    String aggregateId;        // share id, or "Ledger" for distributions
    String eventType;          // e.g. "ShareIssued"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * Creates a new unpublished outbox event.
     */
    public static OutboxEvent create(UUID id, String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            id,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
