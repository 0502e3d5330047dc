package com.flagship.xmbl_ledger.share;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A reserved block of curve positions bought by one deposit.
 *
 * The positions are counted as issued as soon as the meta-share exists;
 * individual units are materialized later through {@link #consume(long)}.
 * {@code depositValue} is the summed price of every reserved position and
 * does not shrink as units are minted.
 */
@Value
public class MetaShare implements Share {
    long id;
    String ownerId;
    BigInteger depositValue;
    BigInteger accruedYield;
    Instant createdAt;
    long reservedUnits;
    long remainingCount;
    long startPosition;

    public static MetaShare reserve(long id, String ownerId, BigInteger depositValue,
                                    long units, long startPosition) {
        if (units < 2) {
            throw new IllegalArgumentException("A meta-share reserves at least two units");
        }
        return new MetaShare(id, ownerId, depositValue, BigInteger.ZERO, Instant.now(),
            units, units, startPosition);
    }

    @Override
    public ShareKind getKind() {
        return ShareKind.META;
    }

    /**
     * Removes {@code units} positions from the front of the remaining block.
     *
     * @return the updated meta-share, or a {@link ClosedMetaShare} once nothing remains
     * @throws IllegalArgumentException if {@code units} is outside [1, remainingCount]
     */
    public Share consume(long units) {
        if (units <= 0 || units > remainingCount) {
            throw new IllegalArgumentException(
                String.format("Cannot consume %d units from meta-share %d with %d remaining",
                    units, id, remainingCount));
        }
        long remaining = remainingCount - units;
        if (remaining == 0) {
            return new ClosedMetaShare(id, ownerId, depositValue, accruedYield, createdAt, reservedUnits);
        }
        return new MetaShare(id, ownerId, depositValue, accruedYield, createdAt,
            reservedUnits, remaining, startPosition + units);
    }

    @Override
    public MetaShare withAccruedYield(BigInteger accruedYield) {
        return new MetaShare(id, ownerId, depositValue, accruedYield, createdAt,
            reservedUnits, remainingCount, startPosition);
    }

    @Override
    public MetaShare withOwner(String ownerId) {
        return new MetaShare(id, ownerId, depositValue, accruedYield, createdAt,
            reservedUnits, remainingCount, startPosition);
    }
}
