package com.flagship.xmbl_ledger.issuance;

import lombok.Value;

import java.math.BigInteger;

/**
 * How many whole units a deposit buys at a given curve position.
 * Pure result of {@link IssuanceEngine#quote}; nothing is reserved.
 */
@Value
public class IssuanceQuote {
    long startPosition;
    long units;
    BigInteger totalCost;
    BigInteger remainder;

    public boolean isAffordable() {
        return units > 0;
    }
}
