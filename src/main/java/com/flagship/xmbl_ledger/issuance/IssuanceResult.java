package com.flagship.xmbl_ledger.issuance;

import com.flagship.xmbl_ledger.share.Share;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of a deposit.
 *
 * Invariant: {@code totalCost + remainder} equals the deposited amount and
 * {@code totalCost} equals the deposit value of the created share.
 */
@Value
public class IssuanceResult {
    List<Long> shareIds;
    BigInteger totalCost;
    long unitsIssued;
    BigInteger remainder;
    boolean meta;
    Share share;
}
