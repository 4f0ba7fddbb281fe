package com.flagship.poker_ledger.game;

import com.flagship.poker_ledger.ledger.BalanceCheck;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Closing was refused because buy-ins and cash-outs differ by more than 0.01.
 * A business-rule rejection: the caller fixes transactions and retries.
 */
public class GameNotBalancedException extends RuntimeException {

    private final UUID gameId;
    private final BalanceCheck balanceCheck;

    public GameNotBalancedException(UUID gameId, BalanceCheck balanceCheck) {
        super(String.format("Cannot complete game %s: %s", gameId, balanceCheck.describe()));
        this.gameId = gameId;
        this.balanceCheck = balanceCheck;
    }

    public UUID getGameId() {
        return gameId;
    }

    public BalanceCheck getBalanceCheck() {
        return balanceCheck;
    }

    public BigDecimal getDiscrepancy() {
        return balanceCheck.getDiscrepancy();
    }
}
