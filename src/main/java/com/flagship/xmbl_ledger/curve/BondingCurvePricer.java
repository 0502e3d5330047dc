package com.flagship.xmbl_ledger.curve;

import java.math.BigInteger;

/**
 * Linear bonding curve with a flat basis-point fee.
 *
 * The price of the unit at 1-indexed position n is
 * {@code n * unitScale + (n * unitScale * feeBps / 10000)}.
 * It depends on the issuance position only, so the cost of any
 * position can be recomputed at any time (meta-share minting relies on this).
 */
public final class BondingCurvePricer {

    /** 1 satoshi expressed in wei. */
    public static final BigInteger DEFAULT_UNIT_SCALE = BigInteger.TEN.pow(10);
    public static final int DEFAULT_FEE_BPS = 100;
    public static final int BPS_DENOMINATOR = 10_000;

    private static final BigInteger BPS = BigInteger.valueOf(BPS_DENOMINATOR);

    private final BigInteger unitScale;
    private final BigInteger feeBps;

    public BondingCurvePricer(BigInteger unitScale, int feeBps) {
        if (unitScale == null || unitScale.signum() <= 0) {
            throw new IllegalArgumentException("Unit scale must be positive");
        }
        if (feeBps < 0 || feeBps > BPS_DENOMINATOR) {
            throw new IllegalArgumentException("Fee must be between 0 and " + BPS_DENOMINATOR + " bps");
        }
        this.unitScale = Amounts.requireAmount(unitScale, "Unit scale");
        this.feeBps = BigInteger.valueOf(feeBps);
    }

    public static BondingCurvePricer withDefaults() {
        return new BondingCurvePricer(DEFAULT_UNIT_SCALE, DEFAULT_FEE_BPS);
    }

    /**
     * Price of the next unit given how many units were issued before it.
     *
     * @param totalIssued number of units already issued (0-based position of the next unit)
     * @return strictly positive price in reference units
     * @throws com.flagship.xmbl_ledger.exception.LedgerException ARITHMETIC_OVERFLOW if the price exceeds 2^256-1
     */
    public BigInteger price(long totalIssued) {
        if (totalIssued < 0) {
            throw new IllegalArgumentException("Issued count cannot be negative: " + totalIssued);
        }
        BigInteger position = BigInteger.valueOf(totalIssued).add(BigInteger.ONE);
        BigInteger basePrice = Amounts.multiply(position, unitScale);
        BigInteger fee = Amounts.multiply(basePrice, feeBps).divide(BPS);
        return Amounts.add(basePrice, fee);
    }

    /**
     * Cumulative cost of {@code count} consecutive units starting at {@code startPosition}.
     *
     * Evaluated in closed form: the base part is an arithmetic series and the
     * truncated fee part is a floor sum, so the result equals summing
     * {@link #price(long)} over every position without walking them.
     */
    public BigInteger costOf(long startPosition, long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Unit count cannot be negative: " + count);
        }
        if (startPosition < 0) {
            throw new IllegalArgumentException("Issued count cannot be negative: " + startPosition);
        }
        Math.addExact(startPosition, count);
        return Amounts.requireAmount(rawCost(startPosition, count), "Cost");
    }

    /**
     * Largest number of consecutive units from {@code startPosition} whose
     * cumulative cost does not exceed {@code amount}.
     */
    public long affordableUnits(long startPosition, BigInteger amount) {
        if (startPosition < 0) {
            throw new IllegalArgumentException("Issued count cannot be negative: " + startPosition);
        }
        Amounts.requireAmount(amount, "Amount");

        // cost(n) >= unitScale * n(n+1)/2, so sqrt(2 * amount / unitScale) + 1 is unaffordable
        BigInteger bound = amount.shiftLeft(1).divide(unitScale).sqrt().add(BigInteger.ONE);
        long hi = bound.min(BigInteger.valueOf(Long.MAX_VALUE - startPosition)).longValueExact();
        long lo = 0;
        while (lo < hi) {
            long mid = lo + (hi - lo + 1) / 2;
            if (rawCost(startPosition, mid).compareTo(amount) <= 0) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    private BigInteger rawCost(long startPosition, long count) {
        if (count == 0) {
            return BigInteger.ZERO;
        }
        BigInteger n = BigInteger.valueOf(count);
        BigInteger first = BigInteger.valueOf(startPosition).add(BigInteger.ONE);
        // first + (first+1) + ... + (first+n-1)
        BigInteger positions = n.multiply(first.shiftLeft(1).add(n).subtract(BigInteger.ONE)).shiftRight(1);
        BigInteger base = positions.multiply(unitScale);

        BigInteger step = unitScale.multiply(feeBps);
        BigInteger fees = floorSum(n, BPS, step, step.multiply(first));
        return base.add(fees);
    }

    /**
     * Sum of {@code floor((a*i + b) / m)} for {@code i} in {@code [0, n)}, with non-negative inputs.
     */
    static BigInteger floorSum(BigInteger n, BigInteger m, BigInteger a, BigInteger b) {
        BigInteger total = BigInteger.ZERO;
        while (true) {
            if (a.compareTo(m) >= 0) {
                BigInteger[] qr = a.divideAndRemainder(m);
                total = total.add(n.multiply(n.subtract(BigInteger.ONE)).shiftRight(1).multiply(qr[0]));
                a = qr[1];
            }
            if (b.compareTo(m) >= 0) {
                BigInteger[] qr = b.divideAndRemainder(m);
                total = total.add(n.multiply(qr[0]));
                b = qr[1];
            }
            BigInteger yMax = a.multiply(n).add(b);
            if (yMax.compareTo(m) < 0) {
                return total;
            }
            BigInteger[] qr = yMax.divideAndRemainder(m);
            n = qr[0];
            b = qr[1];
            BigInteger swap = m;
            m = a;
            a = swap;
        }
    }
}
