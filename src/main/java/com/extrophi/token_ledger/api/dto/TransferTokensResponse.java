package com.extrophi.token_ledger.api.dto;

import com.extrophi.token_ledger.ledger.TokenAmounts;
import com.extrophi.token_ledger.ledger.TransferResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransferTokensResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("from_user_id")
    UUID fromUserId;

    @JsonProperty("to_user_id")
    UUID toUserId;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("from_balance")
    String fromBalance;

    @JsonProperty("to_balance")
    String toBalance;

    @JsonProperty("transaction_type")
    String transactionType;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransferTokensResponse from(TransferResult result) {
        return TransferTokensResponse.builder()
            .transactionId(result.getTransactionId())
            .fromUserId(result.getFromAccountId())
            .toUserId(result.getToAccountId())
            .amount(TokenAmounts.format(result.getAmount()))
            .fromBalance(TokenAmounts.format(result.getFromBalance()))
            .toBalance(TokenAmounts.format(result.getToBalance()))
            .transactionType(result.getKind().getDbValue())
            .reason(result.getReason())
            .createdAt(result.getCreatedAt())
            .build();
    }
}
