package com.flagship.xmbl_ledger.distribution;

import com.flagship.xmbl_ledger.curve.Amounts;
import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Outcome of a yield distribution.
 *
 * {@code perShareCredits} lists every share that received a non-zero credit,
 * ascending by owner id then share id. The truncation residuals are what
 * integer division left unattributed at the holder level and within each
 * holder; they are reported, never redistributed.
 */
@Value
public class DistributionResult {
    BigInteger totalYield;
    BigInteger totalCredited;
    Map<Long, BigInteger> perShareCredits;
    int holderCount;
    BigInteger holderTruncation;
    BigInteger shareTruncation;

    public BigInteger getUndistributed() {
        return Amounts.subtract(totalYield, totalCredited);
    }
}
