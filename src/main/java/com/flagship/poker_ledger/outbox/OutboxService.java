package com.flagship.poker_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.poker_ledger.game.event.GameEvent;
import com.flagship.poker_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes game events to the outbox inside the caller's transaction.
 *
 * A game change and its event commit or roll back together. Publishing is
 * {@link OutboxPublisher}'s job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_GAME = "Game";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Must be called within an existing transaction (MANDATORY propagation).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType,
            serializePayload(payload), CorrelationContext.currentCorrelationId().orElse(null));
        repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Queued {} for game {}", eventType, aggregateId);
        return event;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveGameEvent(GameEvent event) {
        return saveEvent(AGGREGATE_GAME, event.getGameId(), event.getEventType(), event);
    }

    /**
     * Oldest events still worth sending, skipping dead letters.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> claimBatch(int limit, int maxRetries) {
        return repository.lockPublishable(maxRetries, limit).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Publishing {} failed (attempt {}): {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Event history of one game, oldest first.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForGame(UUID gameId) {
        return repository.findByAggregateTypeAndAggregateIdOrderByCreatedAtAsc(AGGREGATE_GAME, gameId).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForGame(UUID gameId, String eventType) {
        return repository.findByAggregateTypeAndAggregateIdAndEventTypeOrderByCreatedAtAsc(
                AGGREGATE_GAME, gameId, eventType).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
