package com.flagship.xmbl_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a deposit creates a share, either an ordinary unit or a meta-share
 * reserving several positions.
 */
@Value
public class ShareIssuedEvent implements LedgerEvent {
    UUID eventId;
    long shareId;
    String ownerId;
    BigInteger depositValue;
    boolean meta;
    Long metaUnitsReserved;
    long startPosition;
    BigInteger refundedRemainder;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ShareIssued";

    public static ShareIssuedEvent ordinary(long shareId, String ownerId, BigInteger depositValue,
                                            long position, BigInteger refundedRemainder) {
        return new ShareIssuedEvent(UUID.randomUUID(), shareId, ownerId, depositValue,
            false, null, position, refundedRemainder, Instant.now());
    }

    public static ShareIssuedEvent meta(long shareId, String ownerId, BigInteger depositValue,
                                        long unitsReserved, long startPosition, BigInteger refundedRemainder) {
        return new ShareIssuedEvent(UUID.randomUUID(), shareId, ownerId, depositValue,
            true, unitsReserved, startPosition, refundedRemainder, Instant.now());
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
