package com.flagship.xmbl_ledger.curve;

import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;

import java.math.BigInteger;

/**
 * Checked arithmetic over unsigned 256-bit amounts.
 *
 * Every amount in the ledger (prices, deposit values, yield) lives in
 * [0, 2^256 - 1]. Results outside that range raise ARITHMETIC_OVERFLOW
 * instead of wrapping.
 */
public final class Amounts {

    public static final BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Amounts() {
        // Utility class
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checked(a.add(b));
    }

    public static BigInteger multiply(BigInteger a, BigInteger b) {
        return checked(a.multiply(b));
    }

    public static BigInteger subtract(BigInteger a, BigInteger b) {
        return checked(a.subtract(b));
    }

    /**
     * Validates an amount supplied from outside the ledger.
     */
    public static BigInteger requireAmount(BigInteger amount, String name) {
        if (amount == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return checked(amount);
    }

    private static BigInteger checked(BigInteger value) {
        if (value.signum() < 0) {
            throw new LedgerException(LedgerErrorCode.ARITHMETIC_OVERFLOW,
                "Amount underflows zero: " + value);
        }
        if (value.compareTo(MAX_AMOUNT) > 0) {
            throw new LedgerException(LedgerErrorCode.ARITHMETIC_OVERFLOW,
                "Amount exceeds 2^256-1");
        }
        return value;
    }
}
