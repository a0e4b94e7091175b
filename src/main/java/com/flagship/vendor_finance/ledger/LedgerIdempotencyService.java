package com.flagship.vendor_finance.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves ledger idempotency keys to the entry they produced.
 *
 * Redis maps key to entry id as a fast path. The unique {@code idempotency_key} column is
 * the source of truth, so a Redis outage only costs a database lookup.
 */
@Service
@Slf4j
public class LedgerIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerEntryStore entryStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public LedgerIdempotencyService(LedgerEntryStore entryStore, Optional<StringRedisTemplate> redisTemplate) {
        this.entryStore = entryStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Finds the entry previously written under this key, if any.
     */
    public Optional<LedgerEntry> findAppliedEntry(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        Optional<UUID> cachedId = lookupCached(idempotencyKey);
        if (cachedId.isPresent()) {
            Optional<LedgerEntry> cached = entryStore.findById(cachedId.get());
            if (cached.isPresent()) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return cached;
            }
        }

        Optional<LedgerEntry> stored = entryStore.findByIdempotencyKey(idempotencyKey);
        stored.ifPresent(entry -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            remember(idempotencyKey, entry.getId());
        });
        return stored;
    }

    /**
     * Caches a key after its entry has been committed. Best effort.
     */
    public void remember(String idempotencyKey, UUID entryId) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, entryId.toString(), REDIS_TTL);
            } catch (RuntimeException e) {
                log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
            }
        });
    }

    private Optional<UUID> lookupCached(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }
}
