package com.flagship.xmbl_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Emitted when external yield income is credited across all outstanding shares.
 *
 * {@code totalAmount - totalCredited} is the truncation residual that was
 * not attributed to any share.
 */
@Value
public class YieldDistributedEvent implements LedgerEvent {
    UUID eventId;
    BigInteger totalAmount;
    BigInteger totalCredited;
    Map<Long, BigInteger> perShareCredits;
    Instant occurredAt;

    public static final String EVENT_TYPE = "YieldDistributed";

    public static YieldDistributedEvent of(BigInteger totalAmount, BigInteger totalCredited,
                                           Map<Long, BigInteger> perShareCredits) {
        return new YieldDistributedEvent(UUID.randomUUID(), totalAmount, totalCredited,
            perShareCredits, Instant.now());
    }

    @Override
    public String getAggregateType() {
        return LEDGER_AGGREGATE;
    }

    @Override
    public String getAggregateId() {
        return LEDGER_AGGREGATE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
