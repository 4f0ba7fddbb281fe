package com.flagship.poker_ledger.ledger;

import java.util.UUID;

public class TransactionNotFoundException extends RuntimeException {

    public TransactionNotFoundException(UUID gameId, UUID transactionId) {
        super(String.format("Transaction %s not found in game %s", transactionId, gameId));
    }
}
