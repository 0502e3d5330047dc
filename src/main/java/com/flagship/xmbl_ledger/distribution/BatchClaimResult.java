package com.flagship.xmbl_ledger.distribution;

import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Outcome of a batch claim. Only shares that actually paid out are listed.
 */
@Value
public class BatchClaimResult {
    String ownerId;
    Map<Long, BigInteger> claimedPerShare;
    BigInteger totalClaimed;
}
