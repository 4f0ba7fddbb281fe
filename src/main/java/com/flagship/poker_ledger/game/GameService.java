package com.flagship.poker_ledger.game;

import com.flagship.poker_ledger.game.event.GameCompletedEvent;
import com.flagship.poker_ledger.game.event.GameStatusChangedEvent;
import com.flagship.poker_ledger.ledger.BalanceCheck;
import com.flagship.poker_ledger.ledger.BalanceValidator;
import com.flagship.poker_ledger.ledger.GameLedger;
import com.flagship.poker_ledger.ledger.LedgerService;
import com.flagship.poker_ledger.ledger.TransactionService;
import com.flagship.poker_ledger.observability.CorrelationContext;
import com.flagship.poker_ledger.observability.SettlementMetrics;
import com.flagship.poker_ledger.outbox.OutboxService;
import com.flagship.poker_ledger.settlement.GameSettlementService;
import com.flagship.poker_ledger.settlement.SettlementTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Game lifecycle: creation, seating and status transitions.
 *
 * Transitions hold the game row lock, so completing a game is serialized with
 * every transaction edit of the same game and the balance check sees a fixed
 * snapshot. Requesting the status a game already has is a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final GamePersistenceService persistenceService;
    private final LedgerService ledgerService;
    private final TransactionService transactionService;
    private final GameSettlementService settlementService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;

    @Transactional
    public Game createGame(String name, CurrencyCode currency, BigDecimal buyinAmount, Set<UUID> participants) {
        Game game = persistenceService.save(Game.create(UUID.randomUUID(), name, currency, buyinAmount, participants));
        log.info("Game created: id={}, name={}, currency={}, buyin={}, players={}",
            game.getId(), game.getName(), game.getCurrency(), game.getBuyinAmount(), game.getParticipants().size());
        return game;
    }

    @Transactional(readOnly = true)
    public Game getGame(UUID gameId) {
        return persistenceService.findById(gameId)
            .orElseThrow(() -> new GameNotFoundException(gameId));
    }

    /**
     * Seats a player. Allowed until the game is completed or cancelled. A
     * player joining a running game records their own buy-in.
     */
    @Transactional
    public Game addParticipant(UUID gameId, UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        CorrelationContext.putGameId(gameId);
        try {
            Game game = persistenceService.lock(gameId);
            Game seated = game.withParticipant(userId);
            if (seated == game) {
                return game;
            }
            Game updated = persistenceService.update(seated);
            log.info("Participant added: userId={}, players={}", userId, updated.getParticipants().size());
            return updated;
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    /**
     * SCHEDULED -> IN_PROGRESS, recording everyone's initial buy-in.
     */
    @Transactional
    public Game startGame(UUID gameId) {
        CorrelationContext.putGameId(gameId);
        try {
            Game game = persistenceService.lock(gameId);
            if (game.getStatus() == GameStatus.IN_PROGRESS) {
                return game;
            }
            Game started = persistenceService.update(game.start());
            transactionService.recordInitialBuyins(started);
            outboxService.saveGameEvent(GameStatusChangedEvent.from(game.getStatus(), started));
            log.info("Game started with {} players", started.getParticipants().size());
            return started;
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    /**
     * IN_PROGRESS -> COMPLETED, only if buy-ins and cash-outs agree within 0.01.
     *
     * @throws GameNotBalancedException with the discrepancy if they do not
     */
    @Transactional
    public Game completeGame(UUID gameId) {
        CorrelationContext.putGameId(gameId);
        try {
            Game game = persistenceService.lock(gameId);
            if (game.getStatus() == GameStatus.COMPLETED) {
                return game;
            }
            if (game.getStatus() != GameStatus.IN_PROGRESS) {
                // let the state machine produce the error
                game.complete();
            }

            GameLedger ledger = ledgerService.getLedger(game);
            BalanceCheck check = BalanceValidator.check(ledger);
            if (!check.isBalanced()) {
                metrics.recordGameCompleted(false);
                log.warn("Refusing to complete game: {}", check.describe());
                throw new GameNotBalancedException(gameId, check);
            }

            Game completed = persistenceService.update(game.complete());
            List<SettlementTransfer> plan = settlementService.computePlan(ledger);
            outboxService.saveGameEvent(GameCompletedEvent.from(completed, ledger, plan));
            metrics.recordGameCompleted(true);

            log.info("Game completed: {}, {} settlement transfer(s)", check.describe(), plan.size());
            return completed;
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    @Transactional
    public Game cancelGame(UUID gameId) {
        CorrelationContext.putGameId(gameId);
        try {
            Game game = persistenceService.lock(gameId);
            if (game.getStatus() == GameStatus.CANCELLED) {
                return game;
            }
            Game cancelled = persistenceService.update(game.cancel());
            outboxService.saveGameEvent(GameStatusChangedEvent.from(game.getStatus(), cancelled));
            log.info("Game cancelled from {}", game.getStatus());
            return cancelled;
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    /**
     * Per-player balances together with the closing check, for display.
     */
    @Transactional(readOnly = true)
    public GameLedger getLedger(UUID gameId) {
        return ledgerService.getLedger(getGame(gameId));
    }
}
