package com.flagship.xmbl_ledger.outbox;

import com.flagship.xmbl_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the outbox to Kafka relay.
 *
 * These tests verify that:
 * - Events are sent keyed by aggregate id and marked published
 * - Send failures count a retry and leave the event unpublished
 * - Events past the retry limit are not sent again
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "xmbl-ledger-events";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "ledgerEventsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
    }

    private static OutboxEvent pending(String aggregateId, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Share", aggregateId, "ShareIssued",
                "{\"shareId\":" + aggregateId + "}", Instant.now(), null, retryCount, null, 1L);
    }

    private static CompletableFuture<SendResult<String, String>> sent(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, event.getAggregateId(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Published event is keyed by aggregate id and marked published")
    void testPublishSuccess() {
        OutboxEvent event = pending("42", 0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, "42", event.getPayload())).thenReturn(sent(event));

        publisher.triggerPublish();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("ShareIssued");
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString());
    }

    @Test
    @DisplayName("Send failure marks the event failed and keeps going")
    void testPublishFailure() {
        OutboxEvent failing = pending("1", 0);
        OutboxEvent ok = pending("2", 0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(failing, ok));
        when(kafkaTemplate.send(TOPIC, "1", failing.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        when(kafkaTemplate.send(TOPIC, "2", ok.getPayload())).thenReturn(sent(ok));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(failing.getId()), anyString());
        verify(outboxMetrics).recordEventPublishFailed("ShareIssued");
        verify(outboxService, never()).markPublished(failing.getId());
        verify(outboxService).markPublished(ok.getId());
    }

    @Test
    @DisplayName("Event past the retry limit is dead-lettered and not sent")
    void testDeadLetter() {
        OutboxEvent exhausted = pending("9", 5);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(exhausted));

        publisher.triggerPublish();

        verify(outboxMetrics).recordEventDeadLettered("ShareIssued");
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        verify(outboxService, never()).markPublished(exhausted.getId());
    }

    @Test
    @DisplayName("Polling failure is contained")
    void testPollingFailure() {
        when(outboxService.findUnpublishedEvents(100)).thenThrow(new IllegalStateException("db down"));

        publisher.triggerPublish();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
