package com.flagship.xmbl_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a share changes owner.
 */
@Value
public class ShareTransferredEvent implements LedgerEvent {
    UUID eventId;
    long shareId;
    String fromOwnerId;
    String toOwnerId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ShareTransferred";

    public static ShareTransferredEvent of(long shareId, String fromOwnerId, String toOwnerId) {
        return new ShareTransferredEvent(UUID.randomUUID(), shareId, fromOwnerId, toOwnerId, Instant.now());
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
