package com.flagship.xmbl_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted once per share whose accrued yield was claimed.
 */
@Value
public class YieldClaimedEvent implements LedgerEvent {
    UUID eventId;
    long shareId;
    String ownerId;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "YieldClaimed";

    public static YieldClaimedEvent of(long shareId, String ownerId, BigInteger amount) {
        return new YieldClaimedEvent(UUID.randomUUID(), shareId, ownerId, amount, Instant.now());
    }

    @Override
    public String getAggregateType() {
        return SHARE_AGGREGATE;
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(shareId);
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
