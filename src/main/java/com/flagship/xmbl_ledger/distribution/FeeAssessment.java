package com.flagship.xmbl_ledger.distribution;

import lombok.Value;

import java.math.BigInteger;

/**
 * Split of a harvested yield into the retained protocol fee and the amount
 * passed on to shareholders. {@code protocolFee + netYield == grossYield}.
 */
@Value
public class FeeAssessment {
    BigInteger grossYield;
    int feeBps;
    BigInteger protocolFee;
    BigInteger netYield;
}
