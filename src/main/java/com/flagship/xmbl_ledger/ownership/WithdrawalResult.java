package com.flagship.xmbl_ledger.ownership;

import lombok.Value;

import java.math.BigInteger;

/**
 * Value released by redeeming a share.
 */
@Value
public class WithdrawalResult {
    long shareId;
    String ownerId;
    BigInteger depositValueReturned;
    BigInteger yieldReturned;
}
