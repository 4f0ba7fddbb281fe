package com.flagship.poker_ledger.observability;

import com.flagship.poker_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Outbox backlog gauges and publish counters.
 *
 * Gauges read the last {@link OutboxBacklog} snapshot taken by
 * {@link MetricsScheduler}, so a Prometheus scrape never queries the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;

    private final AtomicReference<OutboxBacklog> backlog = new AtomicReference<>(OutboxBacklog.EMPTY);

    public OutboxMetrics(OutboxEventRepository outboxRepository, MeterRegistry meterRegistry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.maxRetries = maxRetries;

        Gauge.builder("outbox.backlog.size", backlog, ref -> ref.get().getPending())
            .description("Game events waiting to be published")
            .register(meterRegistry);
        Gauge.builder("outbox.backlog.age.seconds", backlog, ref -> ref.get().getOldestAgeSeconds())
            .description("Age of the oldest unpublished game event")
            .register(meterRegistry);
        Gauge.builder("outbox.events.dead_letters", backlog, ref -> ref.get().getDeadLetters())
            .description("Game events that exhausted their publish attempts")
            .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public OutboxBacklog refresh() {
        try {
            Instant now = Instant.now();
            long ageSeconds = outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, now).getSeconds()))
                .orElse(0L);
            OutboxBacklog snapshot = new OutboxBacklog(outboxRepository.countUnpublished(), ageSeconds,
                outboxRepository.countDeadLetters(maxRetries));
            backlog.set(snapshot);
            log.debug("Outbox backlog: {}", snapshot);
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
        return backlog.get();
    }

    public OutboxBacklog getBacklog() {
        return backlog.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
