package com.flagship.xmbl_ledger.observability;

import com.flagship.xmbl_ledger.ledger.LedgerState;
import com.flagship.xmbl_ledger.outbox.OutboxEventRepository;
import com.flagship.xmbl_ledger.vault.VaultService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the ledger service.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Reports the emergency switches. A paused ledger is still up (claims and
     * withdrawals keep working) but is flagged as PAUSED.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final VaultService vaultService;

        public LedgerHealthIndicator(VaultService vaultService) {
            this.vaultService = vaultService;
        }

        @Override
        public Health health() {
            try {
                LedgerState state = vaultService.getState();
                boolean paused = state.isDepositsPaused() || state.isDistributionsPaused();

                return (paused ? Health.status("PAUSED") : Health.up())
                        .withDetail("totalUnitsIssued", state.getTotalUnitsIssued())
                        .withDetail("totalValueLocked", state.getTotalValueLocked().toString())
                        .withDetail("depositsPaused", state.isDepositsPaused())
                        .withDetail("distributionsPaused", state.isDistributionsPaused())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
