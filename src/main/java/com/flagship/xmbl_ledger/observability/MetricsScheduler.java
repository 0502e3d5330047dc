package com.flagship.xmbl_ledger.observability;

import com.flagship.xmbl_ledger.vault.VaultService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need a database read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final VaultService vaultService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshLedgerMetrics() {
        try {
            ledgerMetrics.updateLedgerState(vaultService.getState());
        } catch (Exception e) {
            log.warn("Failed to refresh ledger metrics: {}", e.getMessage());
        }
    }
}
