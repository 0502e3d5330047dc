package com.flagship.xmbl_ledger.share;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A single issued unit.
 */
@Value
public class OrdinaryShare implements Share {
    long id;
    String ownerId;
    BigInteger depositValue;
    BigInteger accruedYield;
    Instant createdAt;

    /**
     * Creates a freshly issued unit with no accrued yield.
     */
    public static OrdinaryShare issue(long id, String ownerId, BigInteger depositValue) {
        return new OrdinaryShare(id, ownerId, depositValue, BigInteger.ZERO, Instant.now());
    }

    @Override
    public ShareKind getKind() {
        return ShareKind.ORDINARY;
    }

    @Override
    public OrdinaryShare withAccruedYield(BigInteger accruedYield) {
        return new OrdinaryShare(id, ownerId, depositValue, accruedYield, createdAt);
    }

    @Override
    public OrdinaryShare withOwner(String ownerId) {
        return new OrdinaryShare(id, ownerId, depositValue, accruedYield, createdAt);
    }
}
