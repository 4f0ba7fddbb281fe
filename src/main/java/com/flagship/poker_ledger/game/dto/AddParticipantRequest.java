package com.flagship.poker_ledger.game.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddParticipantRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    private UUID userId;
}
