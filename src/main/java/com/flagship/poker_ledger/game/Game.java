package com.flagship.poker_ledger.game;

import com.flagship.poker_ledger.ledger.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Game domain object with an explicit state machine.
 *
 * SCHEDULED -> IN_PROGRESS -> COMPLETED, and SCHEDULED/IN_PROGRESS -> CANCELLED.
 * Every transition returns a new instance; invalid transitions are rejected.
 */
@Value
public class Game {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 50;
    public static final int MAX_NAME_LENGTH = 100;
    public static final BigDecimal MAX_BUYIN = new BigDecimal("10000.00");

    UUID id;
    String name;
    CurrencyCode currency;
    BigDecimal buyinAmount;
    GameStatus status;
    Set<UUID> participants;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new game in SCHEDULED status.
     */
    public static Game create(UUID id, String name, CurrencyCode currency,
                              BigDecimal buyinAmount, Set<UUID> participants) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Game name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Game name cannot exceed %d characters", MAX_NAME_LENGTH));
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency is required");
        }
        if (buyinAmount == null || buyinAmount.compareTo(Money.EPSILON) < 0
            || buyinAmount.compareTo(MAX_BUYIN) > 0) {
            throw new IllegalArgumentException(String.format(
                "Buy-in amount must be between %s and %s", Money.EPSILON, MAX_BUYIN));
        }
        if (!Money.hasValidScale(buyinAmount)) {
            throw new IllegalArgumentException(String.format(
                "Buy-in amount must have at most %d decimal places: %s", Money.SCALE, buyinAmount.toPlainString()));
        }
        Set<UUID> players = participants == null ? Set.of() : participants;
        if (players.size() > MAX_PLAYERS) {
            throw new IllegalArgumentException(
                String.format("A game cannot have more than %d players", MAX_PLAYERS));
        }
        Instant now = Instant.now();
        return new Game(id, name.trim(), currency, Money.normalize(buyinAmount), GameStatus.SCHEDULED,
            Collections.unmodifiableSet(new LinkedHashSet<>(players)), now, now);
    }

    /**
     * Transitions the game to IN_PROGRESS. Only valid from SCHEDULED with
     * enough players seated.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public Game start() {
        if (status != GameStatus.SCHEDULED) {
            throw new IllegalStateException(String.format(
                "Cannot start game in %s status. Only SCHEDULED games can be started.", status));
        }
        if (participants.size() < MIN_PLAYERS) {
            throw new IllegalStateException(String.format(
                "Cannot start game with %d player(s); at least %d are required.",
                participants.size(), MIN_PLAYERS));
        }
        return withStatus(GameStatus.IN_PROGRESS);
    }

    /**
     * Transitions the game to COMPLETED. Only valid from IN_PROGRESS.
     * Whether the books balance is checked by the caller, which holds the ledger.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public Game complete() {
        if (status != GameStatus.IN_PROGRESS) {
            throw new IllegalStateException(String.format(
                "Cannot complete game in %s status. Only IN_PROGRESS games can be completed.", status));
        }
        return withStatus(GameStatus.COMPLETED);
    }

    /**
     * Transitions the game to CANCELLED. Only valid before completion.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public Game cancel() {
        if (isTerminal()) {
            throw new IllegalStateException(String.format(
                "Cannot cancel game in %s status.", status));
        }
        return withStatus(GameStatus.CANCELLED);
    }

    /**
     * Seats another player. Seating an already seated player is a no-op.
     */
    public Game withParticipant(UUID userId) {
        if (isTerminal()) {
            throw new IllegalStateException(String.format(
                "Cannot add players to a game in %s status.", status));
        }
        if (participants.contains(userId)) {
            return this;
        }
        if (participants.size() >= MAX_PLAYERS) {
            throw new IllegalArgumentException(
                String.format("A game cannot have more than %d players", MAX_PLAYERS));
        }
        Set<UUID> seated = new LinkedHashSet<>(participants);
        seated.add(userId);
        return new Game(id, name, currency, buyinAmount, status,
            Collections.unmodifiableSet(seated), createdAt, Instant.now());
    }

    public boolean isTerminal() {
        return status == GameStatus.COMPLETED || status == GameStatus.CANCELLED;
    }

    /**
     * Buy-ins and cash-outs may only be recorded or corrected while the game runs.
     */
    public boolean acceptsTransactions() {
        return status == GameStatus.IN_PROGRESS;
    }

    public boolean isParticipant(UUID userId) {
        return participants.contains(userId);
    }

    public boolean canTransitionTo(GameStatus target) {
        if (status == target) {
            return true;
        }
        return switch (status) {
            case SCHEDULED -> target == GameStatus.IN_PROGRESS || target == GameStatus.CANCELLED;
            case IN_PROGRESS -> target == GameStatus.COMPLETED || target == GameStatus.CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    private Game withStatus(GameStatus target) {
        return new Game(id, name, currency, buyinAmount, target, participants, createdAt, Instant.now());
    }
}
