package com.flagship.xmbl_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Aggregate view of one holder: the ids of the shares they own (ascending)
 * and the sum of those shares' deposit values, which is the holder's weight
 * in a distribution.
 */
@Value
public class HolderPosition {
    String ownerId;
    List<Long> shareIds;
    BigInteger totalDeposit;

    public int getShareCount() {
        return shareIds.size();
    }
}
