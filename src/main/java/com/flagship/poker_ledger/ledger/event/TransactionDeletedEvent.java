package com.flagship.poker_ledger.ledger.event;

import com.flagship.poker_ledger.game.event.GameEvent;
import com.flagship.poker_ledger.ledger.Transaction;
import com.flagship.poker_ledger.ledger.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class TransactionDeletedEvent implements GameEvent {
    UUID eventId;
    UUID gameId;
    UUID transactionId;
    UUID userId;
    TransactionType type;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionDeleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionDeletedEvent from(Transaction transaction) {
        return new TransactionDeletedEvent(
            UUID.randomUUID(),
            transaction.getGameId(),
            transaction.getId(),
            transaction.getUserId(),
            transaction.getType(),
            transaction.getAmount(),
            Instant.now()
        );
    }
}
