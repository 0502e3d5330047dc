package com.flagship.xmbl_ledger.ledger;

import com.flagship.xmbl_ledger.curve.Amounts;
import com.flagship.xmbl_ledger.share.ClosedMetaShare;
import com.flagship.xmbl_ledger.share.MetaShare;
import com.flagship.xmbl_ledger.share.OrdinaryShare;
import com.flagship.xmbl_ledger.share.Share;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
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
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the PostgreSQL share store: amount fidelity, share variants and
 * the holder aggregation the distribution depends on.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JdbcShareStoreTest {

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
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private JdbcShareStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE shares");
        jdbcTemplate.update("UPDATE ledger_state SET total_units_issued = 0, next_share_id = 1, "
                + "total_value_locked = 0, deposits_paused = FALSE, distributions_paused = FALSE WHERE id = 1");
    }

    @Test
    @DisplayName("Ledger state starts at its initial values and round-trips")
    void testStateRoundTrip() {
        assertEquals(LedgerState.initial(), store.loadState());

        LedgerState next = LedgerState.initial()
                .afterIssuance(3, Amounts.MAX_AMOUNT)
                .withDistributionsPaused(true);
        store.saveState(next);

        assertEquals(next, store.loadState());
    }

    @Test
    @DisplayName("Amounts up to 2^256-1 are stored exactly")
    void testMaxAmount() {
        store.insert(OrdinaryShare.issue(1, "alice", Amounts.MAX_AMOUNT));

        assertEquals(Amounts.MAX_AMOUNT, store.findById(1L).orElseThrow().getDepositValue());
    }

    @Test
    @DisplayName("Each share variant reads back as the same variant")
    void testVariantsRoundTrip() {
        MetaShare meta = MetaShare.reserve(2, "bob", BigInteger.valueOf(300), 3, 10);
        store.insert(OrdinaryShare.issue(1, "alice", BigInteger.TEN));
        store.insert(meta);

        MetaShare loaded = assertInstanceOf(MetaShare.class, store.findById(2L).orElseThrow());
        assertEquals(3, loaded.getRemainingCount());
        assertEquals(10, loaded.getStartPosition());

        store.update(meta.consume(3).withAccruedYield(BigInteger.valueOf(7)));

        ClosedMetaShare closed = assertInstanceOf(ClosedMetaShare.class, store.findById(2L).orElseThrow());
        assertEquals(3, closed.getReservedUnits());
        assertEquals(BigInteger.valueOf(7), closed.getAccruedYield());
        assertInstanceOf(OrdinaryShare.class, store.findById(1L).orElseThrow());
    }

    @Test
    @DisplayName("Holder positions group positive-value shares by owner in byte order")
    void testHolderPositions() {
        store.insert(OrdinaryShare.issue(1, "bob", BigInteger.valueOf(3)));
        store.insert(OrdinaryShare.issue(2, "alice", BigInteger.ONE));
        store.insert(OrdinaryShare.issue(3, "Zed", BigInteger.ONE));
        store.insert(OrdinaryShare.issue(4, "alice", BigInteger.ONE));
        store.insert(OrdinaryShare.issue(5, "alice", BigInteger.ZERO));

        List<HolderPosition> positions = store.holderPositions();

        assertEquals(List.of("Zed", "alice", "bob"), positions.stream().map(HolderPosition::getOwnerId).toList());
        HolderPosition alice = positions.get(1);
        assertEquals(List.of(2L, 4L), alice.getShareIds());
        assertEquals(BigInteger.TWO, alice.getTotalDeposit());
        assertEquals(alice, store.holderPosition("alice").orElseThrow());
    }

    @Test
    @DisplayName("Batch update, owner lookup and delete")
    void testBatchUpdateAndDelete() {
        store.insert(OrdinaryShare.issue(1, "alice", BigInteger.ONE));
        store.insert(OrdinaryShare.issue(2, "alice", BigInteger.ONE));

        List<Share> credited = store.findByOwner("alice").stream()
                .map(share -> share.creditYield(BigInteger.valueOf(5)))
                .toList();
        store.updateAll(credited);
        store.delete(1L);

        List<Share> remaining = store.findByOwner("alice");
        assertEquals(1, remaining.size());
        assertEquals(BigInteger.valueOf(5), remaining.get(0).getAccruedYield());
    }

    @Test
    @DisplayName("Duplicate id and missing share are rejected")
    void testIntegrity() {
        store.insert(OrdinaryShare.issue(1, "alice", BigInteger.ONE));

        assertThrows(IllegalStateException.class,
                () -> store.insert(OrdinaryShare.issue(1, "bob", BigInteger.ONE)));
        assertThrows(IllegalStateException.class,
                () -> store.update(OrdinaryShare.issue(9, "bob", BigInteger.ONE)));
    }
}
