package com.flagship.xmbl_ledger.history;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * One projected distribution round.
 */
@Value
public class DistributionRecord {
    UUID eventId;
    BigInteger totalAmount;
    BigInteger totalCredited;
    int shareCount;
    Instant occurredAt;

    public BigInteger getResidual() {
        return totalAmount.subtract(totalCredited);
    }
}
