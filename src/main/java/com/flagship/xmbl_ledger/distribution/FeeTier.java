package com.flagship.xmbl_ledger.distribution;

import lombok.Value;

import java.math.BigInteger;

/**
 * Protocol fee charged on a harvested yield of at least {@code minYield}.
 */
@Value
public class FeeTier {
    BigInteger minYield;
    int feeBps;
}
