package com.flagship.poker_ledger.ledger;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Decides whether a game's books balance and the game may therefore close.
 *
 * Rule: balanced iff |sum(buy-ins) - sum(cash-outs)| <= 0.01.
 */
public final class BalanceValidator {

    private BalanceValidator() {
    }

    public static BalanceCheck check(GameLedger ledger) {
        return check(ledger.getTotalBuyin(), ledger.getTotalCashout());
    }

    public static BalanceCheck check(Map<UUID, PlayerBalance> balances) {
        BigDecimal totalBuyin = Money.ZERO;
        BigDecimal totalCashout = Money.ZERO;
        for (PlayerBalance balance : balances.values()) {
            totalBuyin = totalBuyin.add(balance.getTotalBuyin());
            totalCashout = totalCashout.add(balance.getTotalCashout());
        }
        return check(totalBuyin, totalCashout);
    }

    public static BalanceCheck check(BigDecimal totalBuyin, BigDecimal totalCashout) {
        BigDecimal buyin = Money.normalize(totalBuyin);
        BigDecimal cashout = Money.normalize(totalCashout);
        BigDecimal discrepancy = buyin.subtract(cashout);
        return new BalanceCheck(buyin, cashout, discrepancy, Money.withinTolerance(buyin, cashout));
    }

    public static boolean isBalanced(Map<UUID, PlayerBalance> balances) {
        return check(balances).isBalanced();
    }
}
