package com.flagship.xmbl_ledger.vault;

import com.flagship.xmbl_ledger.curve.BondingCurvePricer;
import com.flagship.xmbl_ledger.event.ShareIssuedEvent;
import com.flagship.xmbl_ledger.event.UnitsMintedFromMetaEvent;
import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.issuance.IssuanceResult;
import com.flagship.xmbl_ledger.ledger.HolderPosition;
import com.flagship.xmbl_ledger.ledger.LedgerState;
import com.flagship.xmbl_ledger.outbox.OutboxEvent;
import com.flagship.xmbl_ledger.outbox.OutboxEventRepository;
import com.flagship.xmbl_ledger.outbox.OutboxService;
import com.flagship.xmbl_ledger.share.ClosedMetaShare;
import com.flagship.xmbl_ledger.share.Share;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the ledger on PostgreSQL.
 *
 * These tests verify that:
 * - Share rows, ledger counters and the outbox event commit together
 * - A rejected operation rolls back completely
 * - Concurrent deposits serialize on the ledger_state row lock
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class VaultServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("xmbl_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private VaultService vaultService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MeterRegistry meterRegistry;

    private final BondingCurvePricer pricer = BondingCurvePricer.withDefaults();

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE shares, outbox_events, processed_events, "
                + "share_yield_credits, yield_distributions, yield_claims");
        jdbcTemplate.update("UPDATE ledger_state SET total_units_issued = 0, next_share_id = 1, "
                + "total_value_locked = 0, deposits_paused = FALSE, distributions_paused = FALSE WHERE id = 1");
    }

    private double depositSuccesses() {
        return meterRegistry.counter("ledger.operations", "operation", "deposit", "outcome", "success").count();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Nested
    @DisplayName("Atomicity")
    class Atomicity {

        @Test
        @DisplayName("Deposit writes share, counters and outbox event together")
        void testDepositWritesOutbox() {
            printTestHeader("Deposit - share and outbox event in one transaction");

            IssuanceResult result = vaultService.deposit("alice", pricer.costOf(0, 3));
            long shareId = result.getShare().getId();

            assertTrue(vaultService.getShare(shareId).isPresent());
            assertEquals(3, vaultService.getState().getTotalUnitsIssued());

            List<OutboxEvent> events = outboxService.getEventsForAggregate("Share", String.valueOf(shareId));
            assertEquals(1, events.size());
            assertEquals(ShareIssuedEvent.EVENT_TYPE, events.get(0).getEventType());
            assertFalse(events.get(0).isPublished());
        }

        @Test
        @DisplayName("Default configuration spends a large deposit on every affordable unit")
        void testLargeDepositUsesWholeCurve() {
            printTestHeader("Large deposit - no per-deposit unit limit by default");

            IssuanceResult result = vaultService.deposit("alice", BigInteger.TEN.pow(18));

            assertEquals(14_071L, result.getUnitsIssued());
            assertTrue(result.getRemainder().compareTo(vaultService.priceOfNextUnit()) < 0);
            assertEquals(14_071L, vaultService.getState().getTotalUnitsIssued());
        }

        @Test
        @DisplayName("Operations are counted in the application meter registry")
        void testOperationMetricsRegistered() {
            printTestHeader("Metrics - deposit counted by the auto-configured registry");

            double before = depositSuccesses();
            vaultService.deposit("alice", pricer.price(0));

            assertEquals(before + 1, depositSuccesses());
        }

        @Test
        @DisplayName("Rejected deposit leaves no share, no counter change and no event")
        void testRejectedDepositRollsBack() {
            printTestHeader("Rejected deposit - nothing persisted");
            LedgerState before = vaultService.getState();

            LedgerException ex = assertThrows(LedgerException.class,
                    () -> vaultService.deposit("alice", BigInteger.ONE));

            assertEquals(LedgerErrorCode.INSUFFICIENT_DEPOSIT, ex.getCode());
            assertEquals(before, vaultService.getState());
            assertTrue(vaultService.getAllShares().isEmpty());
            assertEquals(0, outboxEventRepository.count());
        }

        @Test
        @DisplayName("Paused deposits are persisted and enforced")
        void testPausePersists() {
            vaultService.pauseDeposits();

            assertTrue(vaultService.getState().isDepositsPaused());
            LedgerException ex = assertThrows(LedgerException.class,
                    () -> vaultService.deposit("alice", pricer.price(0)));
            assertEquals(LedgerErrorCode.DEPOSITS_PAUSED, ex.getCode());

            vaultService.resumeDeposits();
            assertEquals(1, vaultService.deposit("alice", pricer.price(0)).getUnitsIssued());
        }
    }

    @Nested
    @DisplayName("Share lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Meta deposit, mint, distribute, claim and withdraw on PostgreSQL")
        void testFullLifecycle() {
            printTestHeader("Full lifecycle on PostgreSQL");

            long metaId = vaultService.deposit("bob", pricer.costOf(0, 3)).getShare().getId();
            long aliceId = vaultService.deposit("alice", pricer.price(3)).getShare().getId();
            var minted = vaultService.mintFromMeta(metaId, 3, "bob");

            Share closed = vaultService.getShare(metaId).orElseThrow();
            assertInstanceOf(ClosedMetaShare.class, closed);
            assertEquals(pricer.price(2), vaultService.getShare(minted.getNewShareIds().get(2))
                    .orElseThrow().getDepositValue());

            vaultService.distributeYield(BigInteger.valueOf(400));

            assertEquals(BigInteger.valueOf(75), vaultService.getShare(metaId).orElseThrow().getAccruedYield());
            assertEquals(BigInteger.valueOf(100), vaultService.claimYield(aliceId, "alice"));
            assertEquals(BigInteger.valueOf(300),
                    vaultService.claimYield(List.of(metaId, minted.getNewShareIds().get(0),
                            minted.getNewShareIds().get(1), minted.getNewShareIds().get(2)), "bob")
                            .getTotalClaimed());

            vaultService.withdraw(aliceId, "alice");
            assertEquals(pricer.costOf(0, 3), vaultService.getState().getTotalValueLocked());

            List<OutboxEvent> metaEvents = outboxService.getEventsForAggregate("Share", String.valueOf(metaId));
            assertEquals(List.of(ShareIssuedEvent.EVENT_TYPE, UnitsMintedFromMetaEvent.EVENT_TYPE, "YieldClaimed"),
                    metaEvents.stream().map(OutboxEvent::getEventType).toList());
        }

        @Test
        @DisplayName("Transfer moves the share to the new owner's position")
        void testTransfer() {
            long id = vaultService.deposit("alice", pricer.price(0)).getShare().getId();

            vaultService.transfer(id, "alice", "bob");

            assertTrue(vaultService.getSharesOf("alice").isEmpty());
            assertEquals(pricer.price(0), vaultService.getHolderPosition("bob").orElseThrow().getTotalDeposit());
            assertEquals(List.of("bob"), vaultService.getHolderPositions().stream()
                .map(HolderPosition::getOwnerId)
                .toList());
        }
    }

    @Test
    @DisplayName("Concurrent deposits never reuse a curve position or a share id")
    void testConcurrentDeposits() throws InterruptedException {
        printTestHeader("Concurrent deposits");

        int threadCount = 6;
        int depositsPerThread = 5;
        BigInteger deposit = new BigInteger("100000000000000");

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger failures = new AtomicInteger();
        List<IssuanceResult> results = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int t = 0; t < threadCount; t++) {
            String depositor = "depositor-" + t;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < depositsPerThread; i++) {
                        results.add(vaultService.deposit(depositor, deposit));
                    }
                } catch (Exception e) {
                    System.out.println("Deposit failed: " + e.getMessage());
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "deposits did not finish");
        executor.shutdown();

        assertEquals(0, failures.get());

        Set<Long> ids = new HashSet<>();
        results.forEach(r -> ids.add(r.getShare().getId()));
        assertEquals(threadCount * depositsPerThread, ids.size());

        long totalUnits = results.stream().mapToLong(IssuanceResult::getUnitsIssued).sum();
        BigInteger totalCost = results.stream().map(IssuanceResult::getTotalCost)
                .reduce(BigInteger.ZERO, BigInteger::add);
        LedgerState state = vaultService.getState();
        assertEquals(totalUnits, state.getTotalUnitsIssued());
        assertEquals(totalCost, state.getTotalValueLocked());
        assertEquals(threadCount * depositsPerThread, outboxEventRepository.count());
    }
}
