package com.flagship.mining_ledger.observability;

import com.flagship.mining_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Ledger-specific health contributors, exposed under /actuator/health.
 */
public class HealthIndicators {

    static final Status WARNING = new Status("WARNING");
    static final Status DEGRADED = new Status("DEGRADED");

    /**
     * Reports the unpublished ledger event backlog. Dead letters never clear on
     * their own, so any of them turns the status to WARNING.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final long warningBacklog;
        private final long criticalBacklog;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.health.warning-backlog:1000}") long warningBacklog,
                                     @Value("${outbox.health.critical-backlog:10000}") long criticalBacklog,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.warningBacklog = warningBacklog;
            this.criticalBacklog = criticalBacklog;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            long pending;
            long deadLetters;
            try {
                pending = outboxRepository.countUnpublished();
                deadLetters = outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }

            Status status;
            if (pending >= criticalBacklog) {
                status = Status.DOWN;
            } else if (pending >= warningBacklog || deadLetters > 0) {
                status = WARNING;
            } else {
                status = Status.UP;
            }

            return Health.status(status)
                    .withDetail("pendingEvents", pending)
                    .withDetail("deadLetters", deadLetters)
                    .withDetail("warningBacklog", warningBacklog)
                    .withDetail("criticalBacklog", criticalBacklog)
                    .build();
        }
    }

    /**
     * Redis only backs the withdrawal replay fast path, so an outage degrades
     * the service instead of taking it down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
            if (factory == null) {
                return degraded("no connection factory");
            }
            try (RedisConnection connection = factory.getConnection()) {
                String reply = connection.ping();
                return "PONG".equals(reply)
                        ? Health.up().build()
                        : degraded("ping replied " + reply);
            } catch (RuntimeException e) {
                return degraded(describe(e));
            }
        }

        private Health degraded(String reason) {
            return Health.status(DEGRADED)
                    .withDetail("reason", reason)
                    .withDetail("withdrawalReplay", "database only")
                    .build();
        }
    }

    /**
     * Up once the ledger event producer has opened a connection to the cluster.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final String topic;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                    @Value("${kafka.topic.ledger-events:ledger-events}") String topic) {
            this.kafkaTemplate = kafkaTemplate;
            this.topic = topic;
        }

        @Override
        public Health health() {
            try {
                int producerMetrics = kafkaTemplate.metrics().size();
                Health.Builder builder = producerMetrics > 0 ? Health.up() : Health.unknown();
                return builder
                        .withDetail("topic", topic)
                        .withDetail("producerMetrics", producerMetrics)
                        .build();
            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("topic", topic)
                        .withDetail("reason", describe(e))
                        .build();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
