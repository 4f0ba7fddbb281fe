package com.flagship.poker_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of the closing gate.
 *
 * discrepancy = totalBuyin - totalCashout. Positive means chips are still
 * unaccounted for on the table, negative means more was cashed out than
 * bought in.
 */
@Value
public class BalanceCheck {
    BigDecimal totalBuyin;
    BigDecimal totalCashout;
    BigDecimal discrepancy;
    boolean balanced;

    /**
     * Human-readable summary, suitable for showing instead of forcing closure.
     */
    public String describe() {
        if (balanced) {
            return String.format("Books balanced: buy-ins %s, cash-outs %s",
                totalBuyin.toPlainString(), totalCashout.toPlainString());
        }
        String direction = discrepancy.signum() > 0
            ? "buy-ins exceed cash-outs"
            : "cash-outs exceed buy-ins";
        return String.format("Books out of balance by %s (%s): buy-ins %s, cash-outs %s",
            discrepancy.abs().toPlainString(), direction,
            totalBuyin.toPlainString(), totalCashout.toPlainString());
    }
}
