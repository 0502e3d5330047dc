package com.flagship.xmbl_ledger.observability;

import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.ledger.LedgerState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: counter per operation and outcome (success / rejected / error)
 * - ledger.rejections: counter per operation and error code
 * - ledger.latency: timer per operation
 * - ledger.units.issued: units reserved by deposits, tagged ordinary / meta
 * - ledger.yield.credited / ledger.yield.residual / ledger.yield.claimed: yield flow
 * - ledger.units.total / ledger.tvl: gauges over the last observed ledger state
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final AtomicLong totalUnitsIssued = new AtomicLong(0);
    private final AtomicReference<Double> totalValueLocked = new AtomicReference<>(0.0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("ledger.units.total", totalUnitsIssued, AtomicLong::get)
                .description("Curve positions issued so far")
                .register(registry);

        Gauge.builder("ledger.tvl", totalValueLocked, AtomicReference::get)
                .description("Total value locked in reference units")
                .register(registry);
    }

    // ==================== Operation Outcomes ====================

    public void recordSuccess(String operation) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", "success"
        ).increment();
    }

    /**
     * Records a precondition failure raised by the ledger.
     */
    public void recordRejection(String operation, LedgerErrorCode code) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", "rejected"
        ).increment();
        registry.counter("ledger.rejections",
                "operation", sanitizeTag(operation),
                "code", code.name()
        ).increment();
    }

    /**
     * Records an unexpected failure (storage, serialization).
     */
    public void recordError(String operation) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", "error"
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Ledger Flow ====================

    public void recordUnitsIssued(long units, boolean meta) {
        registry.counter("ledger.units.issued",
                "type", meta ? "meta" : "ordinary"
        ).increment(units);
    }

    public void recordYieldDistributed(BigInteger credited, BigInteger residual) {
        registry.counter("ledger.yield.credited").increment(credited.doubleValue());
        registry.counter("ledger.yield.residual").increment(residual.doubleValue());
    }

    public void recordProtocolFee(BigInteger fee) {
        registry.counter("ledger.yield.protocol_fee").increment(fee.doubleValue());
    }

    public void recordYieldClaimed(BigInteger amount) {
        registry.counter("ledger.yield.claimed").increment(amount.doubleValue());
    }

    // ==================== Gauges ====================

    public void updateLedgerState(LedgerState state) {
        totalUnitsIssued.set(state.getTotalUnitsIssued());
        totalValueLocked.set(state.getTotalValueLocked().doubleValue());
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
