package com.flagship.poker_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.poker_ledger.settlement.PaymentMethod;
import com.flagship.poker_ledger.settlement.SettlementRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementRecordResponse {

    @JsonProperty("game_id")
    UUID gameId;

    @JsonProperty("from_user_id")
    UUID fromUserId;

    @JsonProperty("to_user_id")
    UUID toUserId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("settled_at")
    Instant settledAt;

    public static SettlementRecordResponse from(SettlementRecord record) {
        return SettlementRecordResponse.builder()
            .gameId(record.getGameId())
            .fromUserId(record.getFromUserId())
            .toUserId(record.getToUserId())
            .amount(record.getAmount())
            .paymentMethod(record.getPaymentMethod())
            .settledAt(record.getSettledAt())
            .build();
    }
}
