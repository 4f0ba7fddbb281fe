package com.flagship.poker_ledger.game;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * JPA entity for games.
 *
 * No setters: state changes go through the {@link Game} state machine and are
 * copied back with {@link #updateFromDomain(Game)}. The row is also the
 * per-game lock that serializes transaction writes against closing.
 */
@Entity
@Table(
    name = "games",
    indexes = {
        @Index(name = "idx_games_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GameEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "buyin_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal buyinAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GameStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "game_participants", joinColumns = @JoinColumn(name = "game_id"))
    @Column(name = "user_id", nullable = false)
    private Set<UUID> participants = new LinkedHashSet<>();

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

    static GameEntity fromDomain(Game game) {
        return new GameEntity(
            game.getId(),
            game.getName(),
            game.getCurrency(),
            game.getBuyinAmount(),
            game.getStatus(),
            new LinkedHashSet<>(game.getParticipants()),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Game toDomain() {
        return new Game(
            id,
            name,
            currency,
            buyinAmount,
            status,
            Collections.unmodifiableSet(new LinkedHashSet<>(participants)),
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable parts (status, seated players) from the domain object.
     * Currency, buy-in amount and identity never change after creation.
     */
    void updateFromDomain(Game game) {
        this.status = game.getStatus();
        this.participants.clear();
        this.participants.addAll(game.getParticipants());
    }
}
