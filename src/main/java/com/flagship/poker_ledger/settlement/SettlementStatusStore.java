package com.flagship.poker_ledger.settlement;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Where paid/unpaid status of planned transfers lives.
 *
 * Keyed by (gameId, fromUserId, toUserId). There is at most one record per
 * key. The in-memory store upserts atomically on its own. The database store
 * relies on the caller holding the game row lock; without it, a racing insert
 * of the same pair fails on the unique constraint with a
 * DataIntegrityViolationException instead of overwriting.
 */
public interface SettlementStatusStore {

    /**
     * Upserts the record for the pair. Marking an already-settled pair
     * overwrites amount and method; it never creates a second record.
     */
    SettlementRecord markSettled(UUID gameId, UUID fromUserId, UUID toUserId,
                                 BigDecimal amount, PaymentMethod method);

    /**
     * Removes the record for the pair.
     *
     * @return true if a record was removed, false if there was none (not an error)
     */
    boolean reset(UUID gameId, UUID fromUserId, UUID toUserId);

    List<SettlementRecord> listSettled(UUID gameId);
}
