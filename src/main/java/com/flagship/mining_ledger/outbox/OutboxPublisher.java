package com.flagship.mining_ledger.outbox;

import com.flagship.mining_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Drains the outbox into the ledger events topic.
 *
 * - Unpublished rows are read in sequence order
 * - The record key is the account id, so one account's events share a
 *   partition and keep their commit order
 * - {@code event-id} and {@code event-type} headers let consumers route and
 *   deduplicate without parsing the payload
 * - A row is marked published only after the broker acknowledged it
 * - A row whose retries reach {@code max-retries} stays behind as a dead letter
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_ID_HEADER = "event-id";
    static final String EVENT_TYPE_HEADER = "event-type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox, will retry on the next poll", e);
            return;
        }

        if (!batch.isEmpty()) {
            log.debug("Publishing {} ledger events", batch.size());
        }
        for (OutboxEvent event : batch) {
            if (!publish(event)) {
                // later events of the same account must not overtake this one
                break;
            }
        }
    }

    /**
     * Runs one publishing pass on the caller's thread.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    private boolean publish(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(ledgerEventsTopic,
                event.getAccountId().toString(), event.getPayload());
        record.headers()
                .add(EVENT_ID_HEADER, event.getId().toString().getBytes(StandardCharsets.UTF_8))
                .add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record)
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published ledger event: eventId={}, eventType={}, partition={}, offset={}",
                    event.getId(), event.getEventType(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
            return false;
        } catch (Exception e) {
            log.error("Failed to publish ledger event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            recordFailure(event, e.getMessage());
            return false;
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Ledger event {} reached {} retries and is left as a dead letter: eventType={}, accountId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAccountId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
