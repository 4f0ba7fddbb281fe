package com.flagship.poker_ledger.settlement;

import com.flagship.poker_ledger.ledger.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;

/**
 * Persisted proof that a planned transfer was paid.
 * At most one per (game, from, to); see {@link SettlementKey}.
 */
@Value
public class SettlementRecord {

    /**
     * Listing order: by payer, then payee.
     */
    public static final Comparator<SettlementRecord> BY_PAIR =
        Comparator.comparing(SettlementRecord::getFromUserId).thenComparing(SettlementRecord::getToUserId);

    UUID gameId;
    UUID fromUserId;
    UUID toUserId;
    BigDecimal amount;
    PaymentMethod paymentMethod;
    Instant settledAt;

    public static SettlementRecord create(SettlementKey key, BigDecimal amount, PaymentMethod method) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Settlement amount must be positive");
        }
        if (method == null) {
            throw new IllegalArgumentException("Payment method is required");
        }
        return new SettlementRecord(key.getGameId(), key.getFromUserId(), key.getToUserId(),
            Money.normalize(amount), method, Instant.now());
    }

    public SettlementKey key() {
        return new SettlementKey(gameId, fromUserId, toUserId);
    }

    /**
     * True while the plan still contains this exact pair for a comparable amount.
     */
    public boolean matches(SettlementTransfer transfer) {
        return transfer.isPair(fromUserId, toUserId)
            && Money.withinTolerance(amount, transfer.getAmount());
    }
}
