package com.flagship.xmbl_ledger.vault;

import com.flagship.xmbl_ledger.distribution.DistributionResult;
import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.issuance.IssuanceResult;
import com.flagship.xmbl_ledger.ledger.LedgerState;
import com.flagship.xmbl_ledger.ledger.XmblLedger;
import com.flagship.xmbl_ledger.observability.LedgerMetrics;
import com.flagship.xmbl_ledger.share.OrdinaryShare;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Tests for the service facade: metrics, MDC hygiene and error propagation.
 * Transaction boundaries are covered by {@link VaultServiceIntegrationTest}.
 */
@ExtendWith(MockitoExtension.class)
class VaultServiceTest {

    @Mock
    private XmblLedger ledger;

    private SimpleMeterRegistry registry;
    private VaultService vaultService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        vaultService = new VaultService(ledger, new LedgerMetrics(registry));
    }

    private double count(String name, String... tags) {
        var counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("Successful deposit records outcome, units and latency")
    void testDepositMetrics() {
        BigInteger amount = new BigInteger("10100000000");
        OrdinaryShare share = OrdinaryShare.issue(1L, "alice", amount);
        when(ledger.issue("alice", amount))
                .thenReturn(new IssuanceResult(List.of(1L), amount, 1, BigInteger.ZERO, false, share));

        IssuanceResult result = vaultService.deposit("alice", amount);

        assertEquals(1, result.getUnitsIssued());
        assertEquals(1.0, count("ledger.operations", "operation", "deposit", "outcome", "success"));
        assertEquals(1.0, count("ledger.units.issued", "type", "ordinary"));
        assertNotNull(registry.find("ledger.latency").tags("operation", "deposit").timer());
    }

    @Test
    @DisplayName("Rejected operation is counted by error code and rethrown unchanged")
    void testRejection() {
        LedgerException rejection = new LedgerException(LedgerErrorCode.NOTHING_TO_CLAIM, "empty");
        when(ledger.claim(5L, "bob")).thenThrow(rejection);

        LedgerException thrown = assertThrows(LedgerException.class, () -> vaultService.claimYield(5L, "bob"));

        assertSame(rejection, thrown);
        assertEquals(1.0, count("ledger.operations", "operation", "claim", "outcome", "rejected"));
        assertEquals(1.0, count("ledger.rejections", "operation", "claim", "code", "NOTHING_TO_CLAIM"));
    }

    @Test
    @DisplayName("Unexpected failure is counted as an error")
    void testUnexpectedError() {
        when(ledger.withdraw(1L, "bob")).thenThrow(new IllegalStateException("storage offline"));

        assertThrows(IllegalStateException.class, () -> vaultService.withdraw(1L, "bob"));

        assertEquals(1.0, count("ledger.operations", "operation", "withdraw", "outcome", "error"));
    }

    @Test
    @DisplayName("MDC is cleared after success and failure")
    void testMdcCleared() {
        when(ledger.claim(5L, "bob")).thenThrow(new LedgerException(LedgerErrorCode.NOT_SHARE_OWNER, "no"));

        assertThrows(LedgerException.class, () -> vaultService.claimYield(5L, "bob"));

        assertNull(MDC.get("operation"));
        assertNull(MDC.get("shareId"));
        assertNull(MDC.get("ownerId"));
    }

    @Test
    @DisplayName("Distribution records credited and residual yield")
    void testDistributionMetrics() {
        when(ledger.distribute(BigInteger.TEN)).thenReturn(new DistributionResult(
                BigInteger.TEN, BigInteger.valueOf(8), Map.of(1L, BigInteger.valueOf(8)), 1,
                BigInteger.ONE, BigInteger.ONE));

        vaultService.distributeYield(BigInteger.TEN);

        assertEquals(8.0, count("ledger.yield.credited"));
        assertEquals(2.0, count("ledger.yield.residual"));
    }

    @Test
    @DisplayName("Pause is applied through the ledger and returned")
    void testPause() {
        LedgerState paused = LedgerState.initial().withDepositsPaused(true);
        when(ledger.pauseDeposits()).thenReturn(paused);

        assertTrue(vaultService.pauseDeposits().isDepositsPaused());
        assertEquals(1.0, count("ledger.operations", "operation", "pause_deposits", "outcome", "success"));
    }
}
