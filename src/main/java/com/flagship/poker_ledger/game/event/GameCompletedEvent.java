package com.flagship.poker_ledger.game.event;

import com.flagship.poker_ledger.game.Game;
import com.flagship.poker_ledger.ledger.GameLedger;
import com.flagship.poker_ledger.settlement.SettlementTransfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Published when a game closes with balanced books.
 *
 * Carries the final per-player nets and the settlement plan computed from the
 * same snapshot, so consumers never have to recompute either.
 */
@Value
public class GameCompletedEvent implements GameEvent {
    UUID eventId;
    UUID gameId;
    String currency;
    BigDecimal totalBuyin;
    BigDecimal totalCashout;
    Map<UUID, BigDecimal> netBalances;
    List<SettlementTransfer> settlementPlan;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GameCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static GameCompletedEvent from(Game game, GameLedger ledger, List<SettlementTransfer> plan) {
        return new GameCompletedEvent(
            UUID.randomUUID(),
            game.getId(),
            game.getCurrency().name(),
            ledger.getTotalBuyin(),
            ledger.getTotalCashout(),
            ledger.getNetBalances(),
            plan,
            Instant.now()
        );
    }
}
