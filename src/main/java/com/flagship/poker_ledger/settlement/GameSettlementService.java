package com.flagship.poker_ledger.settlement;

import com.flagship.poker_ledger.game.Game;
import com.flagship.poker_ledger.game.GameNotFoundException;
import com.flagship.poker_ledger.game.GamePersistenceService;
import com.flagship.poker_ledger.game.GameStatus;
import com.flagship.poker_ledger.ledger.GameLedger;
import com.flagship.poker_ledger.ledger.LedgerService;
import com.flagship.poker_ledger.observability.CorrelationContext;
import com.flagship.poker_ledger.observability.SettlementMetrics;
import com.flagship.poker_ledger.outbox.OutboxService;
import com.flagship.poker_ledger.settlement.event.SettlementMarkedEvent;
import com.flagship.poker_ledger.settlement.event.SettlementResetEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Settlement status for a game: which planned transfers have been paid.
 *
 * The plan is never stored. Each call recomputes it from the current
 * transactions and overlays the stored records. Writes hold the game row lock,
 * so a mark can never interleave with a transaction edit of the same game.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameSettlementService {

    private final GamePersistenceService gamePersistenceService;
    private final LedgerService ledgerService;
    private final SettlementStatusStore statusStore;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;

    /**
     * The current plan with paid/unpaid status. Orphaned records are reported
     * separately and never shown as paid.
     */
    @Transactional(readOnly = true)
    public SettlementOverview getOverview(UUID gameId) {
        Game game = gamePersistenceService.findById(gameId)
            .orElseThrow(() -> new GameNotFoundException(gameId));
        List<SettlementTransfer> plan = computePlan(ledgerService.getLedger(game));
        return SettlementReconciler.reconcile(gameId, plan, statusStore.listSettled(gameId));
    }

    /**
     * Marks a planned transfer as paid, for the amount the plan currently says.
     *
     * @throws TransferNotFoundException if the pair is not in the current plan
     * @throws IllegalStateException if the game was cancelled
     */
    @Transactional
    public SettlementRecord markSettled(UUID gameId, UUID fromUserId, UUID toUserId, PaymentMethod method) {
        if (method == null) {
            throw new IllegalArgumentException("Payment method is required");
        }
        CorrelationContext.putGameId(gameId);
        try {
            Game game = gamePersistenceService.lock(gameId);
            requireNotCancelled(game);

            SettlementTransfer transfer = computePlan(ledgerService.getLedger(game)).stream()
                .filter(t -> t.isPair(fromUserId, toUserId))
                .findFirst()
                .orElseThrow(() -> new TransferNotFoundException(gameId, fromUserId, toUserId));

            SettlementRecord record = statusStore.markSettled(
                gameId, fromUserId, toUserId, transfer.getAmount(), method);

            outboxService.saveGameEvent(SettlementMarkedEvent.from(record));
            metrics.recordSettlementMarked(method.name());

            log.info("Settlement marked: from={}, to={}, amount={}, method={}",
                fromUserId, toUserId, record.getAmount(), method);
            return record;
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    /**
     * Puts a transfer back to unpaid. Resetting an unpaid transfer is a no-op.
     *
     * @return true if a record was removed
     * @throws TransferNotFoundException if the pair is neither planned nor recorded
     */
    @Transactional
    public boolean reset(UUID gameId, UUID fromUserId, UUID toUserId) {
        CorrelationContext.putGameId(gameId);
        try {
            Game game = gamePersistenceService.lock(gameId);

            boolean removed = statusStore.reset(gameId, fromUserId, toUserId);
            if (!removed) {
                boolean planned = computePlan(ledgerService.getLedger(game)).stream()
                    .anyMatch(t -> t.isPair(fromUserId, toUserId));
                if (!planned) {
                    throw new TransferNotFoundException(gameId, fromUserId, toUserId);
                }
                log.debug("Reset of unpaid transfer {} -> {} ignored", fromUserId, toUserId);
                return false;
            }

            outboxService.saveGameEvent(SettlementResetEvent.of(
                gameId, fromUserId, toUserId, SettlementResetEvent.Reason.USER_RESET));
            metrics.incrementSettlementsReset();

            log.info("Settlement reset: from={}, to={}", fromUserId, toUserId);
            return true;
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    /**
     * Deletes every record the current plan no longer accounts for.
     *
     * Runs inside the transaction that changed the game's transactions, after
     * the change and under the same lock, so no reader ever sees the new
     * transactions next to records written against the old ones.
     *
     * @return the purged records
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<SettlementRecord> purgeStaleRecords(Game game) {
        UUID gameId = game.getId();
        List<SettlementRecord> records = statusStore.listSettled(gameId);
        if (records.isEmpty()) {
            return List.of();
        }

        List<SettlementTransfer> plan = computePlan(ledgerService.getLedger(game));
        List<SettlementRecord> orphaned = SettlementReconciler.findOrphaned(plan, records);
        for (SettlementRecord record : orphaned) {
            statusStore.reset(gameId, record.getFromUserId(), record.getToUserId());
            outboxService.saveGameEvent(SettlementResetEvent.of(
                gameId, record.getFromUserId(), record.getToUserId(), SettlementResetEvent.Reason.PLAN_CHANGED));
            log.warn("Purged stale settlement record: from={}, to={}, amount={}, method={}",
                record.getFromUserId(), record.getToUserId(), record.getAmount(), record.getPaymentMethod());
        }
        if (!orphaned.isEmpty()) {
            metrics.incrementSettlementsOrphaned(orphaned.size());
        }
        return orphaned;
    }

    /**
     * @throws InconsistentSettlementStateException if any stored record is orphaned
     */
    @Transactional(readOnly = true)
    public void verifyConsistency(UUID gameId) {
        Game game = gamePersistenceService.findById(gameId)
            .orElseThrow(() -> new GameNotFoundException(gameId));
        List<SettlementTransfer> plan = computePlan(ledgerService.getLedger(game));
        SettlementReconciler.verify(gameId, plan, statusStore.listSettled(gameId));
    }

    /**
     * Plans the transfers for a ledger snapshot, recording size and latency.
     */
    public List<SettlementTransfer> computePlan(GameLedger ledger) {
        List<SettlementTransfer> plan = metrics.timePlan(
            () -> SettlementPlanner.planSettlement(ledger.getBalances()));
        metrics.recordPlanSize(plan.size());
        return plan;
    }

    private void requireNotCancelled(Game game) {
        if (game.getStatus() == GameStatus.CANCELLED) {
            throw new IllegalStateException(String.format(
                "Cannot settle transfers of a game in %s status.", game.getStatus()));
        }
    }
}
