package com.flagship.xmbl_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Emitted when units reserved by a meta-share are materialized as ordinary shares.
 */
@Value
public class UnitsMintedFromMetaEvent implements LedgerEvent {
    UUID eventId;
    long metaShareId;
    List<Long> newShareIds;
    String ownerId;
    long metaRemainingCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "UnitsMintedFromMeta";

    public static UnitsMintedFromMetaEvent of(long metaShareId, List<Long> newShareIds,
                                              String ownerId, long metaRemainingCount) {
        return new UnitsMintedFromMetaEvent(UUID.randomUUID(), metaShareId, List.copyOf(newShareIds),
            ownerId, metaRemainingCount, Instant.now());
    }

    @Override
    public String getAggregateType() {
        return SHARE_AGGREGATE;
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(metaShareId);
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
