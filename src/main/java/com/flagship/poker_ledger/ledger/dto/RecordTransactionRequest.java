package com.flagship.poker_ledger.ledger.dto;

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
import java.time.Instant;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordTransactionRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    private UUID userId;

    @NotBlank(message = "Type is required")
    @Pattern(regexp = "(?i)^(BUYIN|CASHOUT)$", message = "Type must be BUYIN or CASHOUT")
    @JsonProperty("type")
    private String type;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    @DecimalMax(value = "10000.00", message = "Amount cannot exceed 10000.00")
    @Digits(integer = 5, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    private BigDecimal amount;

    /**
     * Optional; defaults to the time the request is processed.
     */
    @JsonProperty("timestamp")
    private Instant timestamp;

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    @JsonProperty("notes")
    private String notes;
}
