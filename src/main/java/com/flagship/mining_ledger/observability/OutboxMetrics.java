package com.flagship.mining_ledger.observability;

import com.flagship.mining_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and publish counters.
 *
 * Gauges read cached values that a scheduled task refreshes, so a Prometheus
 * scrape never queries the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private static final String PUBLISH_ATTEMPTS = "ledger.outbox.publish.attempts";

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong deadLetters = new AtomicLong();

    @PostConstruct
    void registerGauges() {
        Gauge.builder("ledger.outbox.pending", pending, AtomicLong::get)
                .description("Ledger events waiting to be published")
                .register(meterRegistry);
        Gauge.builder("ledger.outbox.pending.age", oldestPendingAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished ledger event")
                .baseUnit("seconds")
                .register(meterRegistry);
        Gauge.builder("ledger.outbox.dead_letters", deadLetters, AtomicLong::get)
                .description("Unpublished ledger events that exhausted their retries")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pending.set(outboxRepository.countUnpublished());
            deadLetters.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));
            long age = outboxRepository.findOldestUnpublishedOccurredAt()
                    .map(oldest -> Duration.between(oldest, Instant.now(clock)).getSeconds())
                    .orElse(0L);
            oldestPendingAgeSeconds.set(Math.max(0, age));
        } catch (RuntimeException e) {
            // gauges keep their last values until the next refresh
            log.warn("Outbox metrics refresh failed: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        attempts(eventType, "published").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        attempts(eventType, "failed").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        Counter.builder("ledger.outbox.dead_lettered")
                .description("Ledger events that reached the retry limit")
                .tag("event_type", eventType)
                .register(meterRegistry)
                .increment();
    }

    private Counter attempts(String eventType, String outcome) {
        return Counter.builder(PUBLISH_ATTEMPTS)
                .description("Ledger event publish attempts by outcome")
                .tag("event_type", eventType)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}
