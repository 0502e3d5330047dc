package com.flagship.xmbl_ledger.distribution;

import java.math.BigInteger;

/**
 * External income that the scheduled distributor pushes into the ledger.
 *
 * The source keeps the amount pending until {@link #markDistributed} is
 * called, so a skipped or failed round carries its yield into the next one.
 */
public interface YieldSource {

    /**
     * Yield harvested but not yet distributed.
     */
    BigInteger pendingYield();

    /**
     * Confirms that {@code amount} was consumed by a committed round: its net
     * part was distributed and the protocol fee retained.
     */
    void markDistributed(BigInteger amount);
}
