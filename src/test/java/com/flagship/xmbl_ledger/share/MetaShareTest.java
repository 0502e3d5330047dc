package com.flagship.xmbl_ledger.share;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class MetaShareTest {

    @Test
    @DisplayName("Consuming part of a meta-share shifts the remaining block")
    void testPartialConsume() {
        MetaShare meta = MetaShare.reserve(7, "alice", BigInteger.valueOf(100), 5, 10);

        MetaShare next = assertInstanceOf(MetaShare.class, meta.consume(2));

        assertEquals(3, next.getRemainingCount());
        assertEquals(12, next.getStartPosition());
        assertEquals(5, next.getReservedUnits());
        assertEquals(BigInteger.valueOf(100), next.getDepositValue());
    }

    @Test
    @DisplayName("Consuming the last units closes the meta-share and keeps its yield")
    void testCloses() {
        MetaShare meta = MetaShare.reserve(7, "alice", BigInteger.valueOf(100), 2, 0)
                .withAccruedYield(BigInteger.TEN);

        ClosedMetaShare closed = assertInstanceOf(ClosedMetaShare.class, meta.consume(2));

        assertEquals(ShareKind.CLOSED_META, closed.getKind());
        assertFalse(closed.isMeta());
        assertEquals(BigInteger.TEN, closed.getAccruedYield());
        assertEquals(BigInteger.valueOf(100), closed.getDepositValue());
    }

    @Test
    @DisplayName("Out-of-range consume and single-unit reservations are rejected")
    void testInvalid() {
        MetaShare meta = MetaShare.reserve(7, "alice", BigInteger.ONE, 2, 0);

        assertThrows(IllegalArgumentException.class, () -> meta.consume(0));
        assertThrows(IllegalArgumentException.class, () -> meta.consume(3));
        assertThrows(IllegalArgumentException.class,
                () -> MetaShare.reserve(8, "alice", BigInteger.ONE, 1, 0));
    }

    @Test
    @DisplayName("Negative yield credit is rejected")
    void testNegativeCredit() {
        Share share = OrdinaryShare.issue(1, "alice", BigInteger.ONE);

        assertThrows(IllegalArgumentException.class, () -> share.creditYield(BigInteger.valueOf(-1)));
        assertEquals(BigInteger.valueOf(4), share.creditYield(BigInteger.valueOf(4)).getAccruedYield());
    }
}
