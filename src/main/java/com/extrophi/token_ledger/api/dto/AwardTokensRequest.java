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
 * Request DTO for awarding tokens.
 *
 * Amount range and precision are checked by the ledger, not here, so that
 * the caller gets the ledger's INVALID_AMOUNT error.
 */
@Value
public class AwardTokensRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("content_ref")
    UUID contentRef;

    @JsonProperty("metadata")
    Map<String, String> metadata;
}
