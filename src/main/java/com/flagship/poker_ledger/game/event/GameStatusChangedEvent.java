package com.flagship.poker_ledger.game.event;

import com.flagship.poker_ledger.game.Game;
import com.flagship.poker_ledger.game.GameStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a game starts or is cancelled. Completion has its own,
 * richer {@link GameCompletedEvent}.
 */
@Value
public class GameStatusChangedEvent implements GameEvent {
    UUID eventId;
    UUID gameId;
    GameStatus previousStatus;
    GameStatus newStatus;
    int participantCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GameStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static GameStatusChangedEvent from(GameStatus previousStatus, Game game) {
        return new GameStatusChangedEvent(
            UUID.randomUUID(),
            game.getId(),
            previousStatus,
            game.getStatus(),
            game.getParticipants().size(),
            Instant.now()
        );
    }
}
