package com.flagship.poker_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for buy-ins and cash-outs.
 *
 * Game, player, type and timestamp are fixed at creation; only amount and
 * notes can be corrected, and only through {@link #correct(Transaction)}.
 * The idempotency key is a persistence concern and is null for transactions
 * the system creates itself (initial buy-ins).
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_game_id", columnList = "game_id"),
        @Index(name = "idx_transactions_idempotency_key", columnList = "idempotency_key")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "game_id", nullable = false, updatable = false)
    private UUID gameId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10, updatable = false)
    private TransactionType type;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(length = 500)
    private String notes;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TransactionEntity fromDomain(Transaction transaction, String idempotencyKey) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getGameId(),
            transaction.getUserId(),
            transaction.getType(),
            transaction.getAmount(),
            transaction.getTimestamp(),
            transaction.getNotes(),
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Transaction toDomain() {
        return Transaction.of(id, gameId, userId, type, amount, occurredAt, notes);
    }

    void correct(Transaction corrected) {
        if (!corrected.getId().equals(this.id)) {
            throw new IllegalArgumentException(
                "Correction for " + corrected.getId() + " applied to transaction " + this.id);
        }
        this.amount = corrected.getAmount();
        this.notes = corrected.getNotes();
    }
}
