package com.flagship.xmbl_ledger.curve;

import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the linear bonding curve.
 *
 * Default curve: unit scale 1e10, fee 100 bps, so unit n costs n * 1.01e10.
 */
class BondingCurvePricerTest {

    private final BondingCurvePricer pricer = BondingCurvePricer.withDefaults();

    @Nested
    @DisplayName("price")
    class Price {

        @Test
        @DisplayName("First unit costs one unit scale plus 1% fee")
        void testFirstUnitPrice() {
            assertEquals(new BigInteger("10100000000"), pricer.price(0));
        }

        @Test
        @DisplayName("Price grows linearly with issuance position")
        void testLinearGrowth() {
            assertEquals(new BigInteger("20200000000"), pricer.price(1));
            assertEquals(new BigInteger("30300000000"), pricer.price(2));
            assertEquals(new BigInteger("1010000000000"), pricer.price(99));
        }

        @Test
        @DisplayName("Price is strictly increasing")
        void testStrictlyIncreasing() {
            for (long n = 0; n < 500; n++) {
                assertTrue(pricer.price(n + 1).compareTo(pricer.price(n)) > 0, "price(" + n + ")");
            }
        }

        @Test
        @DisplayName("Fee truncates toward zero")
        void testFeeTruncation() {
            BondingCurvePricer small = new BondingCurvePricer(BigInteger.valueOf(7), 100);

            // base 7, fee 7 * 100 / 10000 = 0
            assertEquals(BigInteger.valueOf(7), small.price(0));
            // base 700, fee 7
            assertEquals(BigInteger.valueOf(707), small.price(99));
        }

        @Test
        @DisplayName("Same position always yields the same price")
        void testDeterministic() {
            BondingCurvePricer other = BondingCurvePricer.withDefaults();
            assertEquals(pricer.price(12345), other.price(12345));
        }

        @Test
        @DisplayName("Negative position is rejected")
        void testNegativePosition() {
            assertThrows(IllegalArgumentException.class, () -> pricer.price(-1));
        }

        @Test
        @DisplayName("Price beyond 2^256-1 fails with ARITHMETIC_OVERFLOW")
        void testOverflow() {
            BondingCurvePricer huge = new BondingCurvePricer(Amounts.MAX_AMOUNT, 0);

            assertEquals(Amounts.MAX_AMOUNT, huge.price(0));
            LedgerException ex = assertThrows(LedgerException.class, () -> huge.price(1));
            assertEquals(LedgerErrorCode.ARITHMETIC_OVERFLOW, ex.getCode());
        }
    }

    @Nested
    @DisplayName("costOf")
    class CostOf {

        @Test
        @DisplayName("Sums consecutive unit prices")
        void testCumulativeCost() {
            assertEquals(new BigInteger("60600000000"), pricer.costOf(0, 3));
            assertEquals(pricer.price(5).add(pricer.price(6)), pricer.costOf(5, 2));
        }

        @Test
        @DisplayName("Zero units cost nothing")
        void testZeroUnits() {
            assertEquals(BigInteger.ZERO, pricer.costOf(10, 0));
        }

        @Test
        @DisplayName("Matches the per-unit sum when the fee truncates")
        void testTruncatingFeeMatchesUnitSum() {
            BondingCurvePricer odd = new BondingCurvePricer(BigInteger.valueOf(7), 333);

            for (long start = 0; start < 40; start += 13) {
                BigInteger walked = BigInteger.ZERO;
                for (long count = 0; count < 120; count++) {
                    assertEquals(walked, odd.costOf(start, count), "costOf(" + start + ", " + count + ")");
                    walked = walked.add(odd.price(start + count));
                }
            }
        }

        @Test
        @DisplayName("Cost beyond 2^256-1 fails with ARITHMETIC_OVERFLOW")
        void testOverflow() {
            BondingCurvePricer huge = new BondingCurvePricer(Amounts.MAX_AMOUNT.shiftRight(1), 0);

            LedgerException ex = assertThrows(LedgerException.class, () -> huge.costOf(0, 2));
            assertEquals(LedgerErrorCode.ARITHMETIC_OVERFLOW, ex.getCode());
        }
    }

    @Nested
    @DisplayName("affordableUnits")
    class AffordableUnits {

        @Test
        @DisplayName("One ETH at position 0 affords 14071 units")
        void testOneEth() {
            BigInteger oneEth = BigInteger.TEN.pow(18);

            long units = pricer.affordableUnits(0, oneEth);

            assertEquals(14_071L, units);
            assertTrue(pricer.costOf(0, units).compareTo(oneEth) <= 0);
            assertTrue(pricer.costOf(0, units + 1).compareTo(oneEth) > 0);
        }

        @Test
        @DisplayName("Exact cumulative cost buys exactly that many units")
        void testExactBoundary() {
            BigInteger cost = pricer.costOf(7, 25);

            assertEquals(25L, pricer.affordableUnits(7, cost));
            assertEquals(24L, pricer.affordableUnits(7, cost.subtract(BigInteger.ONE)));
        }

        @Test
        @DisplayName("Amount below the next price affords nothing")
        void testNothingAffordable() {
            assertEquals(0L, pricer.affordableUnits(3, pricer.price(3).subtract(BigInteger.ONE)));
            assertEquals(0L, pricer.affordableUnits(0, BigInteger.ZERO));
        }
    }

    @Test
    @DisplayName("Invalid curve parameters are rejected")
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new BondingCurvePricer(BigInteger.ZERO, 100));
        assertThrows(IllegalArgumentException.class, () -> new BondingCurvePricer(BigInteger.TEN, -1));
        assertThrows(IllegalArgumentException.class, () -> new BondingCurvePricer(BigInteger.TEN, 10_001));
    }
}
