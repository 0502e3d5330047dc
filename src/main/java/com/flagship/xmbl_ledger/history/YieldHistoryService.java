package com.flagship.xmbl_ledger.history;

import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.share.Share;
import com.flagship.xmbl_ledger.vault.VaultService;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Queries over the projected yield history.
 *
 * The projection is eventually consistent with the ledger: it trails the
 * outbox publisher and the consumer.
 */
@Service
@RequiredArgsConstructor
public class YieldHistoryService {

    private static final BigDecimal SECONDS_PER_YEAR = BigDecimal.valueOf(365L * 24 * 60 * 60);
    private static final BigDecimal PERCENT = BigDecimal.valueOf(100);
    private static final int APY_SCALE = 4;

    private final JdbcTemplate jdbcTemplate;
    private final VaultService vaultService;

    /**
     * Distributions with {@code from <= occurredAt < to}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<DistributionRecord> getDistributions(Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new IllegalArgumentException("Date range must be non-empty: " + from + " .. " + to);
        }
        return jdbcTemplate.query("""
            SELECT event_id, total_amount, total_credited, share_count, occurred_at
            FROM yield_distributions
            WHERE occurred_at >= ? AND occurred_at < ?
            ORDER BY occurred_at, event_id
            """,
            (rs, rowNum) -> new DistributionRecord(
                rs.getObject("event_id", UUID.class),
                rs.getBigDecimal("total_amount").toBigIntegerExact(),
                rs.getBigDecimal("total_credited").toBigIntegerExact(),
                rs.getInt("share_count"),
                rs.getTimestamp("occurred_at").toInstant()),
            Timestamp.from(from), Timestamp.from(to));
    }

    @Transactional(readOnly = true)
    public BigInteger getTotalCreditedToShare(long shareId) {
        return sum("SELECT COALESCE(SUM(amount), 0) FROM share_yield_credits WHERE share_id = ?", shareId);
    }

    @Transactional(readOnly = true)
    public BigInteger getTotalClaimedByOwner(String ownerId) {
        return sum("SELECT COALESCE(SUM(amount), 0) FROM yield_claims WHERE owner_id = ?", ownerId);
    }

    @Transactional(readOnly = true)
    public DistributionStatistics getDistributionStatistics() {
        return jdbcTemplate.queryForObject("""
            SELECT COUNT(*) AS distribution_count,
                   COALESCE(SUM(total_amount), 0) AS total_yield,
                   COALESCE(SUM(total_credited), 0) AS total_credited,
                   (SELECT COUNT(DISTINCT share_id) FROM share_yield_credits) AS unique_recipients
            FROM yield_distributions
            """,
            (rs, rowNum) -> {
                long count = rs.getLong("distribution_count");
                BigInteger totalYield = rs.getBigDecimal("total_yield").toBigIntegerExact();
                BigInteger totalCredited = rs.getBigDecimal("total_credited").toBigIntegerExact();
                BigInteger average = count == 0
                    ? BigInteger.ZERO
                    : totalCredited.divide(BigInteger.valueOf(count));
                return new DistributionStatistics(count, totalYield, totalCredited,
                    totalYield.subtract(totalCredited), rs.getLong("unique_recipients"), average);
            });
    }

    /**
     * Annualized yield of a share, in percent of its deposit value, over the
     * period from its first credit up to now.
     */
    @Transactional(readOnly = true)
    public BigDecimal getApy(long shareId) {
        return getApy(shareId, Instant.now());
    }

    /**
     * Annualized yield of a share over the period from its first credit up to {@code asOf}.
     *
     * @return zero when the share has no credits yet or the period is empty
     * @throws LedgerException SHARE_NOT_FOUND if the share is not live
     */
    @Transactional(readOnly = true)
    public BigDecimal getApy(long shareId, Instant asOf) {
        Share share = requireShare(shareId);
        CreditWindow credits = jdbcTemplate.queryForObject("""
            SELECT COALESCE(SUM(c.amount), 0) AS total, MIN(d.occurred_at) AS first_credit
            FROM share_yield_credits c
            JOIN yield_distributions d ON d.event_id = c.distribution_event_id
            WHERE c.share_id = ? AND d.occurred_at <= ?
            """,
            (rs, rowNum) -> {
                Timestamp first = rs.getTimestamp("first_credit");
                return new CreditWindow(rs.getBigDecimal("total").toBigIntegerExact(),
                    first == null ? null : first.toInstant());
            },
            shareId, Timestamp.from(asOf));

        if (credits == null || credits.firstCredit() == null) {
            return BigDecimal.ZERO;
        }
        return annualize(credits.total(), share.getDepositValue(), Duration.between(credits.firstCredit(), asOf));
    }

    /**
     * Annualized yield of a share over the trailing {@code window} ending now.
     */
    @Transactional(readOnly = true)
    public BigDecimal getApy(long shareId, Duration window) {
        return getApy(shareId, window, Instant.now());
    }

    /**
     * Annualized yield of a share from credits in {@code (asOf - window, asOf]}.
     */
    @Transactional(readOnly = true)
    public BigDecimal getApy(long shareId, Duration window, Instant asOf) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Window must be positive: " + window);
        }
        Share share = requireShare(shareId);
        BigInteger total = sum("""
            SELECT COALESCE(SUM(c.amount), 0)
            FROM share_yield_credits c
            JOIN yield_distributions d ON d.event_id = c.distribution_event_id
            WHERE c.share_id = ? AND d.occurred_at > ? AND d.occurred_at <= ?
            """, shareId, Timestamp.from(asOf.minus(window)), Timestamp.from(asOf));
        return annualize(total, share.getDepositValue(), window);
    }

    private Share requireShare(long shareId) {
        return vaultService.getShare(shareId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.SHARE_NOT_FOUND,
                "Share not found: " + shareId));
    }

    private static BigDecimal annualize(BigInteger yield, BigInteger depositValue, Duration period) {
        long seconds = period.getSeconds();
        if (yield.signum() == 0 || depositValue.signum() == 0 || seconds <= 0) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(yield)
            .multiply(SECONDS_PER_YEAR)
            .multiply(PERCENT)
            .divide(new BigDecimal(depositValue).multiply(BigDecimal.valueOf(seconds)),
                APY_SCALE, RoundingMode.HALF_EVEN);
    }

    private record CreditWindow(BigInteger total, Instant firstCredit) {}

    private BigInteger sum(String sql, Object... args) {
        BigDecimal total = jdbcTemplate.queryForObject(sql, BigDecimal.class, args);
        return total == null ? BigInteger.ZERO : total.toBigIntegerExact();
    }
}
