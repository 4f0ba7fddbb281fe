package com.flagship.poker_ledger.settlement;

import java.util.UUID;

/**
 * The referenced (from, to) pair is not part of the game's current plan.
 */
public class TransferNotFoundException extends RuntimeException {

    public TransferNotFoundException(UUID gameId, UUID fromUserId, UUID toUserId) {
        super(String.format("No settlement transfer %s -> %s in the current plan for game %s",
            fromUserId, toUserId, gameId));
    }
}
