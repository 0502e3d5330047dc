package com.flagship.xmbl_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.xmbl_ledger.event.ShareIssuedEvent;
import com.flagship.xmbl_ledger.event.ShareTransferredEvent;
import com.flagship.xmbl_ledger.event.ShareWithdrawnEvent;
import com.flagship.xmbl_ledger.event.UnitsMintedFromMetaEvent;
import com.flagship.xmbl_ledger.event.YieldClaimedEvent;
import com.flagship.xmbl_ledger.event.YieldDistributedEvent;
import com.flagship.xmbl_ledger.history.YieldHistoryProjection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for ledger events.
 *
 * Feeds the yield history projection. Offsets are acknowledged manually
 * after the handler and its processed_events record have committed; a
 * handler failure leaves the record unacknowledged for redelivery.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerEventConsumer {

    static final String CONSUMER_GROUP = "yield-history-projection";

    private final IdempotentEventProcessor eventProcessor;
    private final YieldHistoryProjection projection;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.ledger-events:xmbl-ledger-events}",
        groupId = "${spring.kafka.consumer.group-id:xmbl-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event, acknowledging to skip: {}", record.value());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = routeEvent(envelope, record.value());
            ack.acknowledge();

            if (processed) {
                log.info("Processed event: type={}, eventId={}, aggregateId={}",
                        envelope.eventType, envelope.eventId, envelope.aggregateId);
            }

        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private boolean routeEvent(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType) {
            case YieldDistributedEvent.EVENT_TYPE -> process(envelope, () ->
                projection.onYieldDistributed(deserialize(rawPayload, YieldDistributedEvent.class)));
            case YieldClaimedEvent.EVENT_TYPE -> process(envelope, () ->
                projection.onYieldClaimed(deserialize(rawPayload, YieldClaimedEvent.class)));
            case ShareWithdrawnEvent.EVENT_TYPE -> process(envelope, () ->
                projection.onShareWithdrawn(deserialize(rawPayload, ShareWithdrawnEvent.class)));
            case ShareIssuedEvent.EVENT_TYPE,
                 UnitsMintedFromMetaEvent.EVENT_TYPE,
                 ShareTransferredEvent.EVENT_TYPE -> {
                eventProcessor.skipEvent(envelope.eventId, envelope.eventType,
                    envelope.aggregateType, envelope.aggregateId,
                    CONSUMER_GROUP, "No yield movement");
                yield false;
            }
            default -> {
                log.debug("Unknown event type: {}, skipping", envelope.eventType);
                eventProcessor.skipEvent(envelope.eventId, envelope.eventType,
                    envelope.aggregateType, envelope.aggregateId,
                    CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    private boolean process(EventEnvelope envelope, Runnable handler) {
        return eventProcessor.processEvent(
            envelope.eventId, envelope.eventType,
            envelope.aggregateType, envelope.aggregateId,
            CONSUMER_GROUP, handler);
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                node.path("aggregateType").asText("Unknown"),
                node.get("aggregateId").asText(),
                node.get("eventType").asText());

        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize event: " + e.getMessage(), e);
        }
    }

    private record EventEnvelope(UUID eventId, String aggregateType, String aggregateId, String eventType) {}
}
