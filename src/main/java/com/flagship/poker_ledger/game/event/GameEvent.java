package com.flagship.poker_ledger.game.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of everything published about a game.
 *
 * The game id is the outbox aggregate id and the Kafka key, so all events of
 * one game are consumed in the order they were committed.
 */
public interface GameEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getGameId();

    Instant getOccurredAt();

    String getEventType();
}
