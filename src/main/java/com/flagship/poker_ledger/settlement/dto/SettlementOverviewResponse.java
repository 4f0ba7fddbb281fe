package com.flagship.poker_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.poker_ledger.settlement.PaymentMethod;
import com.flagship.poker_ledger.settlement.SettlementOverview;
import com.flagship.poker_ledger.settlement.SettlementStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SettlementOverviewResponse {

    @JsonProperty("game_id")
    UUID gameId;

    /**
     * "No settlements needed" when every net is negligible, otherwise null.
     */
    @JsonProperty("message")
    String message;

    @JsonProperty("all_settled")
    boolean allSettled;

    @JsonProperty("outstanding_amount")
    BigDecimal outstandingAmount;

    @JsonProperty("transfers")
    List<TransferLine> transfers;

    @JsonProperty("orphaned")
    List<SettlementRecordResponse> orphaned;

    @Value
    public static class TransferLine {
        @JsonProperty("from_user_id")
        UUID fromUserId;

        @JsonProperty("to_user_id")
        UUID toUserId;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("status")
        SettlementStatus.State status;

        @JsonProperty("payment_method")
        PaymentMethod paymentMethod;

        @JsonProperty("settled_at")
        Instant settledAt;

        static TransferLine from(SettlementOverview.Line line) {
            SettlementStatus status = line.getStatus();
            return new TransferLine(
                line.getTransfer().getFromUserId(),
                line.getTransfer().getToUserId(),
                line.getTransfer().getAmount(),
                status.getState(),
                status.getPaymentMethod().orElse(null),
                status.getSettledAt().orElse(null)
            );
        }
    }

    public static SettlementOverviewResponse from(SettlementOverview overview) {
        return SettlementOverviewResponse.builder()
            .gameId(overview.getGameId())
            .message(overview.isNoSettlementsNeeded() ? SettlementOverview.NO_SETTLEMENTS_NEEDED : null)
            .allSettled(overview.isAllSettled())
            .outstandingAmount(overview.getOutstandingAmount())
            .transfers(overview.getLines().stream().map(TransferLine::from).toList())
            .orphaned(overview.getOrphaned().stream().map(SettlementRecordResponse::from).toList())
            .build();
    }
}
