package com.flagship.poker_ledger.game.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.poker_ledger.game.Game;
import com.flagship.poker_ledger.game.GameStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Value
@Builder
public class GameResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("buyin_amount")
    BigDecimal buyinAmount;

    @JsonProperty("status")
    GameStatus status;

    @JsonProperty("participants")
    Set<UUID> participants;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static GameResponse from(Game game) {
        return GameResponse.builder()
            .id(game.getId())
            .name(game.getName())
            .currency(game.getCurrency().name())
            .buyinAmount(game.getBuyinAmount())
            .status(game.getStatus())
            .participants(game.getParticipants())
            .createdAt(game.getCreatedAt())
            .updatedAt(game.getUpdatedAt())
            .build();
    }
}
