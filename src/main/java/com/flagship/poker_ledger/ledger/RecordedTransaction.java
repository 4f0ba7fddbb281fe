package com.flagship.poker_ledger.ledger;

import lombok.Value;

/**
 * Result of an idempotent record call: the transaction, and whether this call
 * created it or replayed an earlier one.
 */
@Value
public class RecordedTransaction {
    Transaction transaction;
    boolean created;

    public static RecordedTransaction created(Transaction transaction) {
        return new RecordedTransaction(transaction, true);
    }

    public static RecordedTransaction replayed(Transaction transaction) {
        return new RecordedTransaction(transaction, false);
    }
}
