package com.flagship.xmbl_ledger.distribution;

import lombok.Value;

/**
 * Outcome of one scheduled round: the fee split of the harvested yield and
 * the distribution of its net part.
 */
@Value
public class ScheduledDistribution {
    FeeAssessment fee;
    DistributionResult distribution;
}
