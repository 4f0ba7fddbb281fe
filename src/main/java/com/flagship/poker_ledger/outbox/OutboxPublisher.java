package com.flagship.poker_ledger.outbox;

import com.flagship.poker_ledger.observability.OutboxMetrics;
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

/**
 * Polls the outbox and publishes game events to Kafka.
 *
 * Events are keyed by game id, so everything that happens to one game lands
 * on one partition in commit order. Each send is awaited before the row is
 * marked published, which makes delivery at-least-once; consumers
 * deduplicate on the eventId in the payload. Events that reach max-retries
 * stay in the table as dead letters and are no longer claimed.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String HEADER_EVENT_TYPE = "event-type";
    static final String HEADER_EVENT_ID = "event-id";
    static final String HEADER_CORRELATION_ID = "correlation-id";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.games:poker-games}")
    private String gamesTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.claimBatch(batchSize, maxRetries);
        } catch (Exception e) {
            log.error("Could not read the outbox", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }

        log.debug("Publishing {} game event(s)", batch.size());
        for (OutboxEvent event : batch) {
            publish(event);
        }
    }

    /**
     * Runs one polling cycle on demand.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    private void publish(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate.send(toRecord(event)).get();

            log.debug("Published {} {} for game {} to {}-{}@{}",
                event.getEventType(), event.getId(), event.getAggregateId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(event, "Interrupted while publishing");
        } catch (Exception e) {
            log.error("Failed to publish {} {} for game {}: {}",
                event.getEventType(), event.getId(), event.getAggregateId(), e.getMessage());
            fail(event, e.getMessage());
        }
    }

    private void fail(OutboxEvent event, String reason) {
        outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("{} {} for game {} is now a dead letter after {} attempts",
                event.getEventType(), event.getId(), event.getAggregateId(), maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(gamesTopic, event.partitionKey(), event.getPayload());
        record.headers().add(HEADER_EVENT_TYPE, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(HEADER_EVENT_ID, event.getId().toString().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(HEADER_CORRELATION_ID, event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }
}
