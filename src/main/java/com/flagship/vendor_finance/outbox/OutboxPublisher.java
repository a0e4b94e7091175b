package com.flagship.vendor_finance.outbox;

import com.flagship.vendor_finance.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Drains the outbox into the ledger topic.
 *
 * Events are sent one by one and acknowledged before being marked published, keyed by
 * vendor id so a vendor's events stay ordered within a partition. Delivery is at least
 * once: a crash between send and mark repeats the event, consumers dedupe on {@code eventId}.
 * Events that fail {@code max-retries} times stay in the table as dead letters.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger:vendor-ledger}")
    private String ledgerTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.lockNextBatch(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read outbox batch", e);
            return;
        }
        if (!batch.isEmpty()) {
            log.debug("Publishing {} outbox events", batch.size());
        }
        for (OutboxEvent event : batch) {
            publish(event);
        }
    }

    private void publish(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(ledgerTopic, event.getAggregateId().toString(), event.getPayload())
                .get();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published {} {} to {}-{}@{}", event.getEventType(), event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted while sending");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (ExecutionException | RuntimeException e) {
            String error = e instanceof ExecutionException && e.getCause() != null
                ? e.getCause().getMessage()
                : e.getMessage();
            outboxService.markFailed(event.getId(), error);
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.error("Outbox event {} ({}) dead-lettered after {} attempts",
                    event.getId(), event.getEventType(), maxRetries);
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Runs one publishing pass on the calling thread.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
