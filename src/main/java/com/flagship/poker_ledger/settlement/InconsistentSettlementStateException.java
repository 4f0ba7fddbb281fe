package com.flagship.poker_ledger.settlement;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Stored settlement records no longer correspond to the current plan,
 * typically because a transaction was edited after they were written.
 */
public class InconsistentSettlementStateException extends RuntimeException {

    private final UUID gameId;
    private final List<SettlementRecord> orphaned;

    public InconsistentSettlementStateException(UUID gameId, List<SettlementRecord> orphaned) {
        super(String.format("Game %s has %d settlement record(s) not in the current plan: %s",
            gameId, orphaned.size(), orphaned.stream()
                .map(r -> r.getFromUserId() + "->" + r.getToUserId() + " " + r.getAmount().toPlainString())
                .collect(Collectors.joining(", "))));
        this.gameId = gameId;
        this.orphaned = List.copyOf(orphaned);
    }

    public UUID getGameId() {
        return gameId;
    }

    public List<SettlementRecord> getOrphaned() {
        return orphaned;
    }
}
