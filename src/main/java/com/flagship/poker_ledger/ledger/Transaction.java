package com.flagship.poker_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * A single buy-in or cash-out recorded against a game.
 *
 * Plain domain object: the ledger computations only ever see materialized
 * snapshots of these, never the persistence layer.
 */
@Value
public class Transaction {

    /**
     * Audit order: oldest first, ties broken by id so the order is total.
     */
    public static final Comparator<Transaction> CHRONOLOGICAL =
        Comparator.comparing(Transaction::getTimestamp).thenComparing(Transaction::getId);

    UUID id;
    UUID gameId;
    UUID userId;
    TransactionType type;
    BigDecimal amount;
    Instant timestamp;
    String notes;

    private Transaction(UUID id, UUID gameId, UUID userId, TransactionType type,
                        BigDecimal amount, Instant timestamp, String notes) {
        this.id = Objects.requireNonNull(id, "id");
        this.gameId = Objects.requireNonNull(gameId, "gameId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.type = Objects.requireNonNull(type, "type");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Transaction amount cannot be negative: " + amount);
        }
        this.amount = Money.normalize(amount);
        this.notes = notes;
    }

    public static Transaction of(UUID id, UUID gameId, UUID userId, TransactionType type,
                                 BigDecimal amount, Instant timestamp, String notes) {
        return new Transaction(id, gameId, userId, type, amount, timestamp, notes);
    }

    public static Transaction buyIn(UUID gameId, UUID userId, BigDecimal amount, String notes) {
        return new Transaction(UUID.randomUUID(), gameId, userId, TransactionType.BUYIN,
            amount, Instant.now(), notes);
    }

    public static Transaction cashOut(UUID gameId, UUID userId, BigDecimal amount, String notes) {
        return new Transaction(UUID.randomUUID(), gameId, userId, TransactionType.CASHOUT,
            amount, Instant.now(), notes);
    }

    /**
     * Returns a copy with a corrected amount and notes. Identity, owner and
     * timestamp are kept.
     */
    public Transaction withAmount(BigDecimal newAmount, String newNotes) {
        return new Transaction(id, gameId, userId, type, newAmount, timestamp, newNotes);
    }

    public BigDecimal signedAmount() {
        return type.signed(amount);
    }
}
