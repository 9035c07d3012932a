package com.extrophi.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for transferring tokens between users.
 */
@Value
public class TransferTokensRequest {

    @NotNull(message = "From user ID is required")
    @JsonProperty("from_user_id")
    UUID fromUserId;

    @NotNull(message = "To user ID is required")
    @JsonProperty("to_user_id")
    UUID toUserId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("attribution_id")
    UUID attributionId;

    @JsonProperty("metadata")
    Map<String, String> metadata;
}
