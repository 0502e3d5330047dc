package com.flagship.xmbl_ledger.ledger;

import com.flagship.xmbl_ledger.curve.Amounts;
import lombok.Value;

import java.math.BigInteger;

/**
 * Ledger-wide counters and switches.
 *
 * {@code totalUnitsIssued} and {@code nextShareId} only ever increase.
 * {@code totalValueLocked} grows with each deposit's charged cost and shrinks
 * when a share is withdrawn.
 */
@Value
public class LedgerState {
    long totalUnitsIssued;
    long nextShareId;
    BigInteger totalValueLocked;
    boolean depositsPaused;
    boolean distributionsPaused;

    public static LedgerState initial() {
        return new LedgerState(0L, 1L, BigInteger.ZERO, false, false);
    }

    /**
     * State after one deposit reserved {@code units} curve positions under one new share id.
     */
    public LedgerState afterIssuance(long units, BigInteger cost) {
        return new LedgerState(
            Math.addExact(totalUnitsIssued, units),
            Math.addExact(nextShareId, 1L),
            Amounts.add(totalValueLocked, cost),
            depositsPaused,
            distributionsPaused
        );
    }

    /**
     * State after {@code mintedShares} ids were handed out for units carved from a meta-share.
     * The issuance counter is unchanged: those positions were reserved at deposit time.
     */
    public LedgerState afterMetaMint(int mintedShares) {
        return new LedgerState(
            totalUnitsIssued,
            Math.addExact(nextShareId, mintedShares),
            totalValueLocked,
            depositsPaused,
            distributionsPaused
        );
    }

    public LedgerState afterWithdrawal(BigInteger depositValue) {
        return new LedgerState(
            totalUnitsIssued,
            nextShareId,
            Amounts.subtract(totalValueLocked, depositValue),
            depositsPaused,
            distributionsPaused
        );
    }

    public LedgerState withDepositsPaused(boolean paused) {
        return new LedgerState(totalUnitsIssued, nextShareId, totalValueLocked, paused, distributionsPaused);
    }

    public LedgerState withDistributionsPaused(boolean paused) {
        return new LedgerState(totalUnitsIssued, nextShareId, totalValueLocked, depositsPaused, paused);
    }
}
