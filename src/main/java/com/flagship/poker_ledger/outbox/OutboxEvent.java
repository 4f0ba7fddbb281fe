package com.flagship.poker_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A game event waiting in the outbox.
 *
 * Written in the same database transaction as the change it describes and
 * published later by {@link OutboxPublisher}. The correlation id of the
 * request that caused it travels along as a Kafka header.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    String correlationId;      // null for events raised outside a request
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, String correlationId) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            correlationId, Instant.now(), null, 0, null);
    }

    /**
     * Kafka key. All events of one game share it and therefore a partition.
     */
    public String partitionKey() {
        return aggregateId.toString();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
