package com.flagship.poker_ledger.settlement.event;

import com.flagship.poker_ledger.game.event.GameEvent;
import com.flagship.poker_ledger.settlement.PaymentMethod;
import com.flagship.poker_ledger.settlement.SettlementRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A planned transfer was confirmed as paid.
 */
@Value
public class SettlementMarkedEvent implements GameEvent {
    UUID eventId;
    UUID gameId;
    UUID fromUserId;
    UUID toUserId;
    BigDecimal amount;
    PaymentMethod paymentMethod;
    Instant settledAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementMarked";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementMarkedEvent from(SettlementRecord record) {
        return new SettlementMarkedEvent(
            UUID.randomUUID(),
            record.getGameId(),
            record.getFromUserId(),
            record.getToUserId(),
            record.getAmount(),
            record.getPaymentMethod(),
            record.getSettledAt(),
            Instant.now()
        );
    }
}
