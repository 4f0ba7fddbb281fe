package com.flagship.poker_ledger.ledger;

import java.math.BigDecimal;

/**
 * Direction of money relative to the game's pot.
 */
public enum TransactionType {
    /**
     * Player puts money into the pot (initial or additional buy-in).
     * Decreases the player's net.
     */
    BUYIN,

    /**
     * Player takes chips off the table for money.
     * Increases the player's net.
     */
    CASHOUT;

    /**
     * Contribution of an amount of this type to a player's net balance.
     */
    public BigDecimal signed(BigDecimal amount) {
        return this == BUYIN ? amount.negate() : amount;
    }
}
