package com.flagship.poker_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for paid transfers.
 *
 * The unique constraint on (game_id, from_user_id, to_user_id) is the last
 * line against duplicate records if two writers ever get past the game lock.
 */
@Entity
@Table(
    name = "settlements",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_settlements_pair",
        columnNames = {"game_id", "from_user_id", "to_user_id"}),
    indexes = @Index(name = "idx_settlements_game_id", columnList = "game_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "game_id", nullable = false, updatable = false)
    private UUID gameId;

    @Column(name = "from_user_id", nullable = false, updatable = false)
    private UUID fromUserId;

    @Column(name = "to_user_id", nullable = false, updatable = false)
    private UUID toUserId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "settled_at", nullable = false)
    private Instant settledAt;

    static SettlementRecordEntity fromDomain(SettlementRecord record) {
        return new SettlementRecordEntity(
            UUID.randomUUID(),
            record.getGameId(),
            record.getFromUserId(),
            record.getToUserId(),
            record.getAmount(),
            record.getPaymentMethod(),
            record.getSettledAt()
        );
    }

    SettlementRecord toDomain() {
        return new SettlementRecord(gameId, fromUserId, toUserId, amount, paymentMethod, settledAt);
    }

    /**
     * Overwrites amount, method and time when an already settled pair is marked again.
     */
    void overwrite(SettlementRecord record) {
        if (!record.key().equals(new SettlementKey(gameId, fromUserId, toUserId))) {
            throw new IllegalArgumentException("Record for " + record.key() + " applied to another pair");
        }
        this.amount = record.getAmount();
        this.paymentMethod = record.getPaymentMethod();
        this.settledAt = record.getSettledAt();
    }
}
