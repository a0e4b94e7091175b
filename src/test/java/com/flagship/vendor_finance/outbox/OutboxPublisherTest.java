package com.flagship.vendor_finance.outbox;

import com.flagship.vendor_finance.observability.OutboxMetrics;
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
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

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
        ReflectionTestUtils.setField(publisher, "ledgerTopic", "vendor-ledger");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
    }

    private static OutboxEvent event(UUID vendorId, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), OutboxService.WALLET_AGGREGATE, vendorId, "LedgerEntryRecorded",
            "{\"vendorId\":\"" + vendorId + "\"}", Instant.parse("2024-06-01T12:00:00Z"), null, retryCount, null, 1L);
    }

    private static CompletableFuture<SendResult<String, String>> acked(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>("vendor-ledger",
            event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("vendor-ledger", 2), 41L, 0, 0L, 36, 40);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Acknowledged events are marked published, keyed by vendor")
    void publishesAndMarks() {
        UUID vendorId = UUID.randomUUID();
        OutboxEvent event = event(vendorId, 0);
        when(outboxService.lockNextBatch(100, 5)).thenReturn(List.of(event));
        when(kafkaTemplate.send("vendor-ledger", vendorId.toString(), event.getPayload())).thenReturn(acked(event));

        publisher.triggerPublish();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("LedgerEntryRecorded");
        verify(outboxService, never()).markFailed(any(), anyString());
    }

    @Test
    void failedSendIsRecordedForRetry() {
        OutboxEvent event = event(UUID.randomUUID(), 1);
        when(outboxService.lockNextBatch(100, 5)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(event.getId(), "broker unavailable");
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("LedgerEntryRecorded");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void deadLettersOnFinalAttempt() {
        OutboxEvent event = event(UUID.randomUUID(), 4);
        when(outboxService.lockNextBatch(100, 5)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventDeadLettered("LedgerEntryRecorded");
    }

    @Test
    void oneFailureDoesNotStopTheBatch() {
        OutboxEvent failing = event(UUID.randomUUID(), 0);
        OutboxEvent healthy = event(UUID.randomUUID(), 0);
        when(outboxService.lockNextBatch(100, 5)).thenReturn(List.of(failing, healthy));
        when(kafkaTemplate.send("vendor-ledger", failing.getAggregateId().toString(), failing.getPayload()))
            .thenThrow(new IllegalStateException("serializer error"));
        when(kafkaTemplate.send("vendor-ledger", healthy.getAggregateId().toString(), healthy.getPayload()))
            .thenReturn(acked(healthy));

        publisher.triggerPublish();

        verify(outboxService).markFailed(failing.getId(), "serializer error");
        verify(outboxService).markPublished(healthy.getId());
    }

    @Test
    void unreadableBatchIsSkipped() {
        when(outboxService.lockNextBatch(100, 5)).thenThrow(new IllegalStateException("db down"));

        publisher.triggerPublish();

        verifyNoInteractions(kafkaTemplate);
    }
}
