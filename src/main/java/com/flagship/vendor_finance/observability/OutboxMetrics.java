package com.flagship.vendor_finance.observability;

import com.flagship.vendor_finance.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and delivery counters.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}, so a Prometheus
 * scrape never queries the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicLong backlogSize = new AtomicLong();
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong();
    private final AtomicLong deadLetterCount = new AtomicLong();

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @PostConstruct
    void registerGauges() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
            .description("Unpublished ledger events in the outbox")
            .register(meterRegistry);
        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
            .description("Age of the oldest unpublished ledger event")
            .register(meterRegistry);
        Gauge.builder("outbox.events.dead_lettered", deadLetterCount, AtomicLong::get)
            .description("Ledger events that exhausted their delivery attempts")
            .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());
            oldestEventAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                .orElse(0L));
            deadLetterCount.set(outboxRepository.countDeadLettered(maxRetries));
            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLettered={}",
                backlogSize.get(), oldestEventAgeSeconds.get(), deadLetterCount.get());
        } catch (RuntimeException e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered.total", "event_type", eventType).increment();
    }
}
