package com.flagship.xmbl_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a share is redeemed and removed from the ledger.
 */
@Value
public class ShareWithdrawnEvent implements LedgerEvent {
    UUID eventId;
    long shareId;
    String ownerId;
    BigInteger depositValueReturned;
    BigInteger yieldReturned;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ShareWithdrawn";

    public static ShareWithdrawnEvent of(long shareId, String ownerId,
                                         BigInteger depositValueReturned, BigInteger yieldReturned) {
        return new ShareWithdrawnEvent(UUID.randomUUID(), shareId, ownerId,
            depositValueReturned, yieldReturned, Instant.now());
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
