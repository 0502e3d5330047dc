package com.flagship.xmbl_ledger.ledger;

import com.flagship.xmbl_ledger.curve.Amounts;
import com.flagship.xmbl_ledger.share.ClosedMetaShare;
import com.flagship.xmbl_ledger.share.MetaShare;
import com.flagship.xmbl_ledger.share.OrdinaryShare;
import com.flagship.xmbl_ledger.share.Share;
import com.flagship.xmbl_ledger.share.ShareKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed share store.
 *
 * Uses JDBC directly, like the rest of the ledger persistence, so that the
 * database enforces what it can (non-negative amounts, unique ids) and the
 * single ledger_state row doubles as the cross-instance write lock.
 *
 * Must be called inside a transaction: {@link #lockForWrite()} takes a row
 * lock that is held until commit.
 */
@Repository
public class JdbcShareStore implements ShareStore {

    private static final String SHARE_COLUMNS =
        "id, owner_id, kind, deposit_value, accrued_yield, reserved_units, " +
        "meta_remaining_count, meta_start_position, created_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcShareStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void lockForWrite() {
        jdbcTemplate.queryForObject("SELECT id FROM ledger_state WHERE id = 1 FOR UPDATE", Integer.class);
    }

    @Override
    public LedgerState loadState() {
        return jdbcTemplate.queryForObject(
            "SELECT total_units_issued, next_share_id, total_value_locked, deposits_paused, distributions_paused " +
            "FROM ledger_state WHERE id = 1",
            (rs, rowNum) -> new LedgerState(
                rs.getLong("total_units_issued"),
                rs.getLong("next_share_id"),
                toAmount(rs.getBigDecimal("total_value_locked")),
                rs.getBoolean("deposits_paused"),
                rs.getBoolean("distributions_paused")
            )
        );
    }

    @Override
    public void saveState(LedgerState state) {
        jdbcTemplate.update(
            "UPDATE ledger_state SET total_units_issued = ?, next_share_id = ?, total_value_locked = ?, " +
            "deposits_paused = ?, distributions_paused = ?, updated_at = CURRENT_TIMESTAMP WHERE id = 1",
            state.getTotalUnitsIssued(),
            state.getNextShareId(),
            new BigDecimal(state.getTotalValueLocked()),
            state.isDepositsPaused(),
            state.isDistributionsPaused()
        );
    }

    @Override
    public Optional<Share> findById(long shareId) {
        List<Share> found = jdbcTemplate.query(
            "SELECT " + SHARE_COLUMNS + " FROM shares WHERE id = ?",
            shareRowMapper(),
            shareId
        );
        return found.stream().findFirst();
    }

    @Override
    public List<Share> findByOwner(String ownerId) {
        return jdbcTemplate.query(
            "SELECT " + SHARE_COLUMNS + " FROM shares WHERE owner_id = ? ORDER BY id",
            shareRowMapper(),
            ownerId
        );
    }

    @Override
    public List<Share> findAll() {
        return jdbcTemplate.query("SELECT " + SHARE_COLUMNS + " FROM shares ORDER BY id", shareRowMapper());
    }

    @Override
    public List<HolderPosition> holderPositions() {
        return groupByOwner(jdbcTemplate.query(
            "SELECT owner_id, id, deposit_value FROM shares WHERE deposit_value > 0 " +
            "ORDER BY owner_id COLLATE \"C\", id",
            (rs, rowNum) -> new WeightedShare(rs.getString("owner_id"), rs.getLong("id"),
                toAmount(rs.getBigDecimal("deposit_value")))
        ));
    }

    @Override
    public Optional<HolderPosition> holderPosition(String ownerId) {
        return groupByOwner(jdbcTemplate.query(
            "SELECT owner_id, id, deposit_value FROM shares WHERE owner_id = ? AND deposit_value > 0 ORDER BY id",
            (rs, rowNum) -> new WeightedShare(rs.getString("owner_id"), rs.getLong("id"),
                toAmount(rs.getBigDecimal("deposit_value"))),
            ownerId
        )).stream().findFirst();
    }

    @Override
    public void insert(Share share) {
        Object[] columns = columnsOf(share);
        int inserted = jdbcTemplate.update(
            "INSERT INTO shares (owner_id, kind, deposit_value, accrued_yield, reserved_units, " +
            "meta_remaining_count, meta_start_position, created_at, id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (id) DO NOTHING",
            columns
        );
        if (inserted == 0) {
            throw new IllegalStateException("Share id already in use: " + share.getId());
        }
    }

    @Override
    public void update(Share share) {
        int updated = jdbcTemplate.update(
            "UPDATE shares SET owner_id = ?, kind = ?, deposit_value = ?, accrued_yield = ?, reserved_units = ?, " +
            "meta_remaining_count = ?, meta_start_position = ?, created_at = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ?",
            columnsOf(share)
        );
        if (updated == 0) {
            throw new IllegalStateException("Share not found: " + share.getId());
        }
    }

    @Override
    public void updateAll(Collection<? extends Share> shares) {
        if (shares.isEmpty()) {
            return;
        }
        List<Object[]> batch = shares.stream().map(this::columnsOf).toList();
        jdbcTemplate.batchUpdate(
            "UPDATE shares SET owner_id = ?, kind = ?, deposit_value = ?, accrued_yield = ?, reserved_units = ?, " +
            "meta_remaining_count = ?, meta_start_position = ?, created_at = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ?",
            batch
        );
    }

    @Override
    public void delete(long shareId) {
        jdbcTemplate.update("DELETE FROM shares WHERE id = ?", shareId);
    }

    /**
     * Column values in the order shared by the insert and update statements (id last).
     */
    private Object[] columnsOf(Share share) {
        Long reservedUnits = null;
        Long remaining = null;
        Long startPosition = null;
        if (share instanceof MetaShare meta) {
            reservedUnits = meta.getReservedUnits();
            remaining = meta.getRemainingCount();
            startPosition = meta.getStartPosition();
        } else if (share instanceof ClosedMetaShare closed) {
            reservedUnits = closed.getReservedUnits();
            remaining = 0L;
        }
        return new Object[] {
            share.getOwnerId(),
            share.getKind().name(),
            new BigDecimal(share.getDepositValue()),
            new BigDecimal(share.getAccruedYield()),
            reservedUnits,
            remaining,
            startPosition,
            Timestamp.from(share.getCreatedAt()),
            share.getId()
        };
    }

    private RowMapper<Share> shareRowMapper() {
        return (rs, rowNum) -> {
            long id = rs.getLong("id");
            String owner = rs.getString("owner_id");
            BigInteger deposit = toAmount(rs.getBigDecimal("deposit_value"));
            BigInteger accrued = toAmount(rs.getBigDecimal("accrued_yield"));
            var createdAt = rs.getTimestamp("created_at").toInstant();

            return switch (ShareKind.valueOf(rs.getString("kind"))) {
                case ORDINARY -> new OrdinaryShare(id, owner, deposit, accrued, createdAt);
                case META -> new MetaShare(id, owner, deposit, accrued, createdAt,
                    rs.getLong("reserved_units"),
                    rs.getLong("meta_remaining_count"),
                    rs.getLong("meta_start_position"));
                case CLOSED_META -> new ClosedMetaShare(id, owner, deposit, accrued, createdAt,
                    rs.getLong("reserved_units"));
            };
        };
    }

    private static List<HolderPosition> groupByOwner(List<WeightedShare> rows) {
        Map<String, List<Long>> ids = new LinkedHashMap<>();
        Map<String, BigInteger> totals = new LinkedHashMap<>();
        for (WeightedShare row : rows) {
            ids.computeIfAbsent(row.ownerId(), owner -> new ArrayList<>()).add(row.shareId());
            totals.merge(row.ownerId(), row.depositValue(), Amounts::add);
        }
        List<HolderPosition> positions = new ArrayList<>(ids.size());
        ids.forEach((owner, shareIds) -> positions.add(new HolderPosition(owner, List.copyOf(shareIds), totals.get(owner))));
        return positions;
    }

    private static BigInteger toAmount(BigDecimal value) throws SQLException {
        if (value == null) {
            throw new SQLException("Unexpected NULL amount");
        }
        return value.toBigIntegerExact();
    }

    private record WeightedShare(String ownerId, long shareId, BigInteger depositValue) {}
}
