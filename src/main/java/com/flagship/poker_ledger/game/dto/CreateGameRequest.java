package com.flagship.poker_ledger.game.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateGameRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name cannot exceed 100 characters")
    @JsonProperty("name")
    private String name;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    private String currency;

    @NotNull(message = "Buy-in amount is required")
    @DecimalMin(value = "0.01", message = "Buy-in amount must be at least 0.01")
    @DecimalMax(value = "10000.00", message = "Buy-in amount cannot exceed 10000.00")
    @Digits(integer = 5, fraction = 2, message = "Buy-in amount must have at most 2 decimal places")
    @JsonProperty("buyin_amount")
    private BigDecimal buyinAmount;

    @Size(max = 50, message = "A game cannot have more than 50 players")
    @JsonProperty("participants")
    private Set<UUID> participants = new LinkedHashSet<>();
}
