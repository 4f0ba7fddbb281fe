package com.flagship.poker_ledger.settlement.event;

import com.flagship.poker_ledger.game.event.GameEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A settlement record was removed, either by a user or because the plan
 * changed under it.
 */
@Value
public class SettlementResetEvent implements GameEvent {
    UUID eventId;
    UUID gameId;
    UUID fromUserId;
    UUID toUserId;
    Reason reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementReset";

    public enum Reason {
        USER_RESET,
        PLAN_CHANGED
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementResetEvent of(UUID gameId, UUID fromUserId, UUID toUserId, Reason reason) {
        return new SettlementResetEvent(UUID.randomUUID(), gameId, fromUserId, toUserId, reason, Instant.now());
    }
}
