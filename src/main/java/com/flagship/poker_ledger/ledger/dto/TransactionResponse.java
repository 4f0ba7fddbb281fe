package com.flagship.poker_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.poker_ledger.ledger.Transaction;
import com.flagship.poker_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("game_id")
    UUID gameId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("notes")
    String notes;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .gameId(transaction.getGameId())
            .userId(transaction.getUserId())
            .type(transaction.getType())
            .amount(transaction.getAmount())
            .timestamp(transaction.getTimestamp())
            .notes(transaction.getNotes())
            .build();
    }
}
