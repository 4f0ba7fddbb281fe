package com.flagship.poker_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Derived per-player position in a game. Never persisted.
 *
 * net = totalCashout - totalBuyin; negative means the player owes money,
 * positive means the player is owed money.
 */
@Value
public class PlayerBalance {
    UUID userId;
    BigDecimal totalBuyin;
    BigDecimal totalCashout;
    List<Transaction> buyins;
    List<Transaction> cashouts;

    public BigDecimal getNet() {
        return totalCashout.subtract(totalBuyin);
    }

    public boolean isDebtor() {
        BigDecimal net = getNet();
        return net.signum() < 0 && !Money.isNegligible(net);
    }

    public boolean isCreditor() {
        BigDecimal net = getNet();
        return net.signum() > 0 && !Money.isNegligible(net);
    }
}
