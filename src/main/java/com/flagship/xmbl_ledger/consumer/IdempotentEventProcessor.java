package com.flagship.xmbl_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs an event handler at most once per consumer group.
 *
 * The handler's writes and the processed_events record share one
 * transaction: a redelivered event either finds the record and is skipped,
 * or finds nothing because the earlier attempt rolled back entirely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, String aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} by consumer group {}: {}",
                    eventId, consumerGroup, e.getMessage(), e);
            // Propagate so the offset is not committed
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
            eventId, eventType, aggregateType, aggregateId, consumerGroup)));

        log.debug("Successfully processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Marks an event as not relevant to this consumer so replays skip it.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));

        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
