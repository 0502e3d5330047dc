package com.flagship.xmbl_ledger.history;

import lombok.Value;

import java.math.BigInteger;

/**
 * Totals over every projected distribution.
 * {@code averageDistribution} is the credited amount per distribution, truncated.
 */
@Value
public class DistributionStatistics {
    long distributionCount;
    BigInteger totalYield;
    BigInteger totalCredited;
    BigInteger totalResidual;
    long uniqueRecipients;
    BigInteger averageDistribution;
}
