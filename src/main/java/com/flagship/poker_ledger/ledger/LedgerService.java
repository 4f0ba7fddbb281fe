package com.flagship.poker_ledger.ledger;

import com.flagship.poker_ledger.game.Game;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Materializes a game's transaction snapshot and hands it to the pure ledger.
 *
 * Balances are derived, not stored: every call recomputes from the current
 * rows. Callers that need the snapshot to stay fixed (closing, settlement
 * writes) hold the game lock around the call.
 */
@Service
@RequiredArgsConstructor
public class LedgerService {

    private final TransactionRepository transactionRepository;

    @Transactional(readOnly = true)
    public List<Transaction> getTransactions(UUID gameId) {
        return transactionRepository.findByGameIdOrderByOccurredAtAsc(gameId).stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public GameLedger getLedger(Game game) {
        return GameLedger.of(game.getId(), game.getParticipants(), getTransactions(game.getId()));
    }
}
