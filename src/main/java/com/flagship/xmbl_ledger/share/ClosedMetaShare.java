package com.flagship.xmbl_ledger.share;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A meta-share with no unminted capacity left.
 * Its deposit value stays on the books and keeps earning yield.
 */
@Value
public class ClosedMetaShare implements Share {
    long id;
    String ownerId;
    BigInteger depositValue;
    BigInteger accruedYield;
    Instant createdAt;
    long reservedUnits;

    @Override
    public ShareKind getKind() {
        return ShareKind.CLOSED_META;
    }

    @Override
    public ClosedMetaShare withAccruedYield(BigInteger accruedYield) {
        return new ClosedMetaShare(id, ownerId, depositValue, accruedYield, createdAt, reservedUnits);
    }

    @Override
    public ClosedMetaShare withOwner(String ownerId) {
        return new ClosedMetaShare(id, ownerId, depositValue, accruedYield, createdAt, reservedUnits);
    }
}
