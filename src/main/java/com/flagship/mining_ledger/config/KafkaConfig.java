package com.flagship.mining_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.time.Duration;

/**
 * Declares the ledger events topic. Records are keyed by account id, so the
 * partition count bounds consumer parallelism without breaking per-account order.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic ledgerEventsTopic(
            @Value("${kafka.topic.ledger-events:ledger-events}") String name,
            @Value("${kafka.topic.partitions:3}") int partitions,
            @Value("${kafka.topic.replicas:1}") int replicas) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicas)
                .config("retention.ms", String.valueOf(Duration.ofDays(30).toMillis()))
                .build();
    }
}
