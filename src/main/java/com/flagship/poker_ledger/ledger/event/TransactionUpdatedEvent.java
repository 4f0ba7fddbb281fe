package com.flagship.poker_ledger.ledger.event;

import com.flagship.poker_ledger.game.event.GameEvent;
import com.flagship.poker_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded amount was corrected. Both values are carried so consumers can
 * apply the delta.
 */
@Value
public class TransactionUpdatedEvent implements GameEvent {
    UUID eventId;
    UUID gameId;
    UUID transactionId;
    UUID userId;
    BigDecimal previousAmount;
    BigDecimal newAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionUpdatedEvent from(Transaction before, Transaction after) {
        return new TransactionUpdatedEvent(
            UUID.randomUUID(),
            after.getGameId(),
            after.getId(),
            after.getUserId(),
            before.getAmount(),
            after.getAmount(),
            Instant.now()
        );
    }
}
