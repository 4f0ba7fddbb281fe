package com.flagship.poker_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.poker_ledger.ledger.BalanceCheck;
import com.flagship.poker_ledger.ledger.BalanceValidator;
import com.flagship.poker_ledger.ledger.GameLedger;
import com.flagship.poker_ledger.ledger.PlayerBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Per-player balances plus the closing check, so a client can show the
 * discrepancy before trying to complete the game.
 */
@Value
@Builder
public class BalancesResponse {

    @JsonProperty("game_id")
    UUID gameId;

    @JsonProperty("total_buyin")
    BigDecimal totalBuyin;

    @JsonProperty("total_cashout")
    BigDecimal totalCashout;

    @JsonProperty("discrepancy")
    BigDecimal discrepancy;

    @JsonProperty("balanced")
    boolean balanced;

    @JsonProperty("summary")
    String summary;

    @JsonProperty("players")
    List<PlayerLine> players;

    @Value
    public static class PlayerLine {
        @JsonProperty("user_id")
        UUID userId;

        @JsonProperty("total_buyin")
        BigDecimal totalBuyin;

        @JsonProperty("total_cashout")
        BigDecimal totalCashout;

        @JsonProperty("net")
        BigDecimal net;

        static PlayerLine from(PlayerBalance balance) {
            return new PlayerLine(balance.getUserId(), balance.getTotalBuyin(),
                balance.getTotalCashout(), balance.getNet());
        }
    }

    public static BalancesResponse from(GameLedger ledger) {
        BalanceCheck check = BalanceValidator.check(ledger);
        return BalancesResponse.builder()
            .gameId(ledger.getGameId())
            .totalBuyin(check.getTotalBuyin())
            .totalCashout(check.getTotalCashout())
            .discrepancy(check.getDiscrepancy())
            .balanced(check.isBalanced())
            .summary(check.describe())
            .players(ledger.getBalances().values().stream().map(PlayerLine::from).toList())
            .build();
    }
}
