package com.flagship.poker_ledger.settlement;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a settlement record: the ordered (from, to) pair within a game.
 * (A, B) and (B, A) are different keys.
 */
@Value
public class SettlementKey {
    UUID gameId;
    UUID fromUserId;
    UUID toUserId;

    public static SettlementKey of(UUID gameId, UUID fromUserId, UUID toUserId) {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(fromUserId, "fromUserId");
        Objects.requireNonNull(toUserId, "toUserId");
        if (fromUserId.equals(toUserId)) {
            throw new IllegalArgumentException("A player cannot settle with themselves: " + fromUserId);
        }
        return new SettlementKey(gameId, fromUserId, toUserId);
    }
}
