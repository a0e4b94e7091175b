package com.flagship.vendor_finance.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ledger topic when the outbox publisher runs.
 * Partitioned by vendor id, so partitions bound the number of parallel consumers.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.ledger:vendor-ledger}")
    private String ledgerTopic;

    @Value("${kafka.topic.ledger-partitions:6}")
    private int partitions;

    @Bean
    public NewTopic ledgerTopic() {
        return TopicBuilder.name(ledgerTopic)
            .partitions(partitions)
            .replicas(1)
            .build();
    }
}
