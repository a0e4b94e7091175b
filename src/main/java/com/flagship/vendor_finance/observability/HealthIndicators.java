package com.flagship.vendor_finance.observability;

import com.flagship.vendor_finance.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health checks for the ledger feed and its infrastructure.
 */
public final class HealthIndicators {

    private HealthIndicators() {
    }

    /**
     * DOWN once the outbox backlog passes the critical threshold; WARNING above the warning one.
     */
    @Component("ledgerOutboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1_000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10_000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                Health.Builder builder;
                if (backlog < BACKLOG_WARNING_THRESHOLD) {
                    builder = Health.up();
                } else if (backlog < BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.down();
                }
                return builder
                    .withDetail("backlogSize", backlog)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage reports DEGRADED rather than DOWN.
     */
    @Component("idempotencyCacheHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return degraded("Redis not configured");
            }
            RedisConnectionFactory factory = template.getConnectionFactory();
            try (RedisConnection connection = factory.getConnection()) {
                String pong = connection.ping();
                return "PONG".equals(pong)
                    ? Health.up().withDetail("response", pong).build()
                    : degraded("Unexpected ping response: " + pong);
            } catch (RuntimeException e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                .withDetail("error", error)
                .withDetail("note", "Idempotency checks fall back to the database")
                .build();
        }
    }

    @Component("ledgerKafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate;

        public KafkaHealthIndicator(ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
            if (template == null) {
                return Health.unknown().withDetail("error", "KafkaTemplate not configured").build();
            }
            try {
                int metricCount = template.metrics().size();
                return metricCount > 0
                    ? Health.up().withDetail("metricsCount", metricCount).build()
                    : Health.down().withDetail("error", "No Kafka producer metrics yet").build();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }
}
