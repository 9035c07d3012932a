package com.extrophi.token_ledger.api.dto;

import com.extrophi.token_ledger.ledger.AwardResult;
import com.extrophi.token_ledger.ledger.TokenAmounts;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AwardTokensResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("new_balance")
    String newBalance;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AwardTokensResponse from(AwardResult result) {
        return AwardTokensResponse.builder()
            .userId(result.getAccountId())
            .amount(TokenAmounts.format(result.getAmount()))
            .newBalance(TokenAmounts.format(result.getNewBalance()))
            .reason(result.getReason())
            .transactionId(result.getTransactionId())
            .createdAt(result.getCreatedAt())
            .build();
    }
}
