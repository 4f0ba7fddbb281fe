package com.flagship.poker_ledger.game;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Game state machine: valid transitions succeed, everything else is rejected.
 */
class GameTest {

    private static Game scheduled(int players) {
        Set<UUID> participants = new HashSet<>();
        for (int i = 0; i < players; i++) {
            participants.add(UUID.randomUUID());
        }
        return Game.create(UUID.randomUUID(), "Friday cash game", CurrencyCode.USD,
            new BigDecimal("100"), participants);
    }

    @Test
    @DisplayName("New game is SCHEDULED with a normalized buy-in")
    void create() {
        Game game = scheduled(3);

        assertEquals(GameStatus.SCHEDULED, game.getStatus());
        assertEquals(new BigDecimal("100.00"), game.getBuyinAmount());
        assertEquals(3, game.getParticipants().size());
        assertFalse(game.acceptsTransactions());
    }

    @Test
    @DisplayName("Invalid names, buy-ins and player counts are rejected")
    void createValidation() {
        UUID id = UUID.randomUUID();
        assertThrows(IllegalArgumentException.class,
            () -> Game.create(id, " ", CurrencyCode.USD, new BigDecimal("10"), Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> Game.create(id, "x".repeat(101), CurrencyCode.USD, new BigDecimal("10"), Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> Game.create(id, "ok", CurrencyCode.USD, new BigDecimal("0.00"), Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> Game.create(id, "ok", CurrencyCode.USD, new BigDecimal("10000.01"), Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> Game.create(id, "ok", null, new BigDecimal("10"), Set.of()));
        assertThrows(IllegalArgumentException.class, () -> scheduled(51));
    }

    @Test
    @DisplayName("Buy-ins with sub-cent precision are rejected rather than rounded")
    void createRejectsSubCentBuyin() {
        UUID id = UUID.randomUUID();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Game.create(id, "ok", CurrencyCode.USD, new BigDecimal("100.005"), Set.of()));
        assertTrue(e.getMessage().contains("decimal places"));

        Game trailingZeros = Game.create(id, "ok", CurrencyCode.USD, new BigDecimal("100.500"), Set.of());
        assertEquals(new BigDecimal("100.50"), trailingZeros.getBuyinAmount());
    }

    @Test
    @DisplayName("SCHEDULED -> IN_PROGRESS -> COMPLETED")
    void happyPath() {
        Game started = scheduled(2).start();
        assertEquals(GameStatus.IN_PROGRESS, started.getStatus());
        assertTrue(started.acceptsTransactions());

        Game completed = started.complete();
        assertEquals(GameStatus.COMPLETED, completed.getStatus());
        assertTrue(completed.isTerminal());
        assertFalse(completed.acceptsTransactions());
    }

    @Test
    @DisplayName("A game cannot start with fewer than two players")
    void startNeedsTwoPlayers() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> scheduled(1).start());
        assertTrue(e.getMessage().contains("at least 2"), e.getMessage());
    }

    @Test
    @DisplayName("Only IN_PROGRESS games complete; terminal games cannot change")
    void invalidTransitions() {
        Game game = scheduled(2);
        assertThrows(IllegalStateException.class, game::complete);

        Game completed = game.start().complete();
        assertThrows(IllegalStateException.class, completed::start);
        assertThrows(IllegalStateException.class, completed::cancel);
        assertThrows(IllegalStateException.class, () -> completed.withParticipant(UUID.randomUUID()));

        Game cancelled = scheduled(2).cancel();
        assertEquals(GameStatus.CANCELLED, cancelled.getStatus());
        assertThrows(IllegalStateException.class, cancelled::start);
        assertThrows(IllegalStateException.class, cancelled::complete);
    }

    @Test
    @DisplayName("Running games can be cancelled")
    void cancelInProgress() {
        assertEquals(GameStatus.CANCELLED, scheduled(2).start().cancel().getStatus());
    }

    @Test
    @DisplayName("Seating an already seated player changes nothing")
    void withParticipant() {
        Game game = scheduled(1);
        UUID newcomer = UUID.randomUUID();

        Game seated = game.withParticipant(newcomer);
        assertEquals(2, seated.getParticipants().size());
        assertTrue(seated.isParticipant(newcomer));
        assertSame(seated, seated.withParticipant(newcomer));
        assertEquals(1, game.getParticipants().size(), "Original instance must not change");
    }

    @Test
    @DisplayName("Transition table")
    void canTransitionTo() {
        Game game = scheduled(2);
        assertTrue(game.canTransitionTo(GameStatus.IN_PROGRESS));
        assertTrue(game.canTransitionTo(GameStatus.CANCELLED));
        assertTrue(game.canTransitionTo(GameStatus.SCHEDULED));
        assertFalse(game.canTransitionTo(GameStatus.COMPLETED));

        Game completed = game.start().complete();
        assertFalse(completed.canTransitionTo(GameStatus.CANCELLED));
        assertTrue(completed.canTransitionTo(GameStatus.COMPLETED));
    }
}
