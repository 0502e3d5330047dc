package com.flagship.xmbl_ledger.share;

import com.flagship.xmbl_ledger.curve.Amounts;

import java.math.BigInteger;
import java.time.Instant;

/**
 * An issued share of the ledger.
 *
 * Shares are immutable values. Yield credits, claims and transfers return a
 * new instance of the same variant; only {@link MetaShare#consume(long)}
 * changes the variant (META to CLOSED_META).
 *
 * Invariants:
 * - {@code id} is assigned once at issuance and never reused
 * - {@code depositValue} is fixed at creation
 * - {@code accruedYield} is never negative
 */
public sealed interface Share permits OrdinaryShare, MetaShare, ClosedMetaShare {

    long getId();

    String getOwnerId();

    BigInteger getDepositValue();

    BigInteger getAccruedYield();

    Instant getCreatedAt();

    ShareKind getKind();

    Share withAccruedYield(BigInteger accruedYield);

    Share withOwner(String ownerId);

    default boolean isMeta() {
        return getKind() == ShareKind.META;
    }

    default boolean isOwnedBy(String ownerId) {
        return getOwnerId().equals(ownerId);
    }

    default boolean hasClaimableYield() {
        return getAccruedYield().signum() > 0;
    }

    /**
     * Adds a distribution credit to the accrued yield.
     */
    default Share creditYield(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Yield credit cannot be negative");
        }
        return withAccruedYield(Amounts.add(getAccruedYield(), amount));
    }

    /**
     * Resets the accrued yield after a claim or withdrawal.
     */
    default Share clearYield() {
        return withAccruedYield(BigInteger.ZERO);
    }
}
