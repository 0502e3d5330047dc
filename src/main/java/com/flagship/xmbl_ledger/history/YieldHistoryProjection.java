package com.flagship.xmbl_ledger.history;

import com.flagship.xmbl_ledger.event.ShareWithdrawnEvent;
import com.flagship.xmbl_ledger.event.YieldClaimedEvent;
import com.flagship.xmbl_ledger.event.YieldDistributedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read model of yield flow, built from the ledger event stream.
 *
 * Writes are keyed by event id and ignore conflicts, so applying the same
 * event twice leaves the tables unchanged.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class YieldHistoryProjection {

    private final JdbcTemplate jdbcTemplate;

    public void onYieldDistributed(YieldDistributedEvent event) {
        Map<Long, BigInteger> credits = event.getPerShareCredits();
        int inserted = jdbcTemplate.update("""
            INSERT INTO yield_distributions (event_id, total_amount, total_credited, share_count, occurred_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (event_id) DO NOTHING
            """,
            event.getEventId(),
            new BigDecimal(event.getTotalAmount()),
            new BigDecimal(event.getTotalCredited()),
            credits.size(),
            Timestamp.from(event.getOccurredAt()));

        if (inserted == 0) {
            log.debug("Distribution {} already projected", event.getEventId());
            return;
        }

        List<Object[]> rows = new ArrayList<>(credits.size());
        credits.forEach((shareId, amount) ->
            rows.add(new Object[]{event.getEventId(), shareId, new BigDecimal(amount)}));
        jdbcTemplate.batchUpdate(
            "INSERT INTO share_yield_credits (distribution_event_id, share_id, amount) VALUES (?, ?, ?)",
            rows);

        log.debug("Projected distribution {}: {} share credits", event.getEventId(), rows.size());
    }

    public void onYieldClaimed(YieldClaimedEvent event) {
        recordClaim(event.getEventId(), event.getShareId(), event.getOwnerId(), event.getAmount(),
            event.getOccurredAt());
    }

    /**
     * A withdrawal pays out accrued yield along with the deposit; that part
     * counts as a claim.
     */
    public void onShareWithdrawn(ShareWithdrawnEvent event) {
        if (event.getYieldReturned().signum() > 0) {
            recordClaim(event.getEventId(), event.getShareId(), event.getOwnerId(),
                event.getYieldReturned(), event.getOccurredAt());
        }
    }

    private void recordClaim(UUID eventId, long shareId, String ownerId, BigInteger amount,
                             Instant occurredAt) {
        jdbcTemplate.update("""
            INSERT INTO yield_claims (event_id, share_id, owner_id, amount, occurred_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (event_id) DO NOTHING
            """,
            eventId, shareId, ownerId, new BigDecimal(amount), Timestamp.from(occurredAt));
    }
}
