package com.flagship.vendor_finance.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox and tracks their delivery.
 *
 * {@link #saveEvent} must run inside the posting transaction: if the wallet update rolls
 * back, so does the event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String WALLET_AGGREGATE = "VendorWallet";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.pending(aggregateType, aggregateId, eventType,
            serialize(payload), clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Queued outbox event {} for {} {}", eventType, aggregateType, aggregateId);
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> lockNextBatch(int limit, int maxRetries) {
        return repository.lockNextBatch(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String error) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(error);
            repository.save(entity);
            log.warn("Outbox event {} failed (attempt {}): {}", eventId, entity.getRetryCount(), error);
        });
    }

    /**
     * Events written for one vendor, in commit order. For auditing.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsForVendor(UUID vendorId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(vendorId).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize outbox payload " + payload.getClass().getSimpleName(), e);
        }
    }
}
