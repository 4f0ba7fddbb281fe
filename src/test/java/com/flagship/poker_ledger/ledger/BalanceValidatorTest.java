package com.flagship.poker_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BalanceValidatorTest {

    @Test
    @DisplayName("A one cent difference is within tolerance")
    void oneCentIsBalanced() {
        BalanceCheck check = BalanceValidator.check(new BigDecimal("300.00"), new BigDecimal("299.99"));

        assertTrue(check.isBalanced());
        assertEquals(new BigDecimal("0.01"), check.getDiscrepancy());
        assertTrue(check.describe().startsWith("Books balanced"));
    }

    @Test
    @DisplayName("Chips left on the table block closing and report the discrepancy")
    void buyinsExceedCashouts() {
        BalanceCheck check = BalanceValidator.check(new BigDecimal("300.00"), new BigDecimal("295.00"));

        assertFalse(check.isBalanced());
        assertEquals(new BigDecimal("5.00"), check.getDiscrepancy());
        assertTrue(check.describe().contains("buy-ins exceed cash-outs"), check.describe());
        assertTrue(check.describe().contains("5.00"), check.describe());
    }

    @Test
    @DisplayName("Cashing out more than was bought in is a negative discrepancy")
    void cashoutsExceedBuyins() {
        BalanceCheck check = BalanceValidator.check(new BigDecimal("300.00"), new BigDecimal("300.02"));

        assertFalse(check.isBalanced());
        assertEquals(new BigDecimal("-0.02"), check.getDiscrepancy());
        assertTrue(check.describe().contains("cash-outs exceed buy-ins"), check.describe());
    }

    @Test
    @DisplayName("An empty game is balanced")
    void emptyIsBalanced() {
        GameLedger ledger = GameLedger.of(UUID.randomUUID(), Set.of(), List.of());
        assertTrue(BalanceValidator.check(ledger).isBalanced());
        assertTrue(BalanceValidator.isBalanced(ledger.getBalances()));
    }

    @Test
    @DisplayName("Checking a ledger and its balances gives the same answer")
    void ledgerAndBalancesAgree() {
        UUID game = UUID.randomUUID();
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        GameLedger ledger = GameLedger.of(game, Set.of(alice, bob), List.of(
            Transaction.buyIn(game, alice, new BigDecimal("100.00"), null),
            Transaction.buyIn(game, bob, new BigDecimal("100.00"), null),
            Transaction.cashOut(game, alice, new BigDecimal("180.00"), null)
        ));

        BalanceCheck fromLedger = BalanceValidator.check(ledger);
        BalanceCheck fromBalances = BalanceValidator.check(ledger.getBalances());

        assertEquals(fromLedger, fromBalances);
        assertEquals(new BigDecimal("20.00"), fromLedger.getDiscrepancy());
        assertFalse(fromLedger.isBalanced());
    }
}
