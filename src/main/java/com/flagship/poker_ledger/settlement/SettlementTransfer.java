package com.flagship.poker_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A proposed payment from a net debtor to a net creditor.
 * Derived fresh from balances each time; only its paid status is persisted.
 */
@Value
public class SettlementTransfer {
    UUID fromUserId;
    UUID toUserId;
    BigDecimal amount;

    public boolean isPair(UUID from, UUID to) {
        return fromUserId.equals(from) && toUserId.equals(to);
    }
}
