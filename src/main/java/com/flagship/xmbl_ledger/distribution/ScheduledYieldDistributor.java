package com.flagship.xmbl_ledger.distribution;

import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.observability.LedgerMetrics;
import com.flagship.xmbl_ledger.vault.VaultService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Periodically distributes whatever the {@link YieldSource} has accumulated,
 * net of the {@link ProtocolFeeSchedule} fee.
 *
 * Rounds whose net yield is below the distribution threshold, rounds with no
 * deposits and rounds while distributions are paused are skipped; the yield
 * stays pending at the source.
 */
@Component
@ConditionalOnProperty(name = "xmbl.distribution.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ScheduledYieldDistributor {

    private final YieldSource yieldSource;
    private final VaultService vaultService;
    private final DistributionEngine distributionEngine;
    private final ProtocolFeeSchedule feeSchedule;
    private final LedgerMetrics metrics;

    @Scheduled(fixedDelayString = "${xmbl.distribution.scheduler.interval:3600000}",
               initialDelayString = "${xmbl.distribution.scheduler.initial-delay:60000}")
    public void distributePendingYield() {
        runRound();
    }

    /**
     * Runs one distribution round.
     *
     * @return the fee split and distribution, or empty if the round was skipped
     */
    public Optional<ScheduledDistribution> runRound() {
        BigInteger pending = yieldSource.pendingYield();
        if (pending == null || pending.signum() <= 0) {
            log.debug("No pending yield to distribute");
            return Optional.empty();
        }
        FeeAssessment fee = feeSchedule.assess(pending);
        if (fee.getNetYield().compareTo(distributionEngine.getMinimumYield()) < 0) {
            log.debug("Net yield {} (gross {}) below threshold {}, waiting for next round",
                    fee.getNetYield(), pending, distributionEngine.getMinimumYield());
            return Optional.empty();
        }

        try {
            DistributionResult result = vaultService.distributeYield(fee.getNetYield());
            yieldSource.markDistributed(pending);
            metrics.recordProtocolFee(fee.getProtocolFee());
            log.info("Scheduled distribution: gross={}, feeBps={}, protocolFee={}, credited={}",
                    pending, fee.getFeeBps(), fee.getProtocolFee(), result.getTotalCredited());
            return Optional.of(new ScheduledDistribution(fee, result));

        } catch (LedgerException e) {
            if (e.getCode() == LedgerErrorCode.NO_ACTIVE_DEPOSITS
                    || e.getCode() == LedgerErrorCode.DISTRIBUTIONS_PAUSED
                    || e.getCode() == LedgerErrorCode.BELOW_DISTRIBUTION_THRESHOLD) {
                log.info("Scheduled distribution skipped: {}", e.getCode());
                return Optional.empty();
            }
            throw e;
        }
    }
}
