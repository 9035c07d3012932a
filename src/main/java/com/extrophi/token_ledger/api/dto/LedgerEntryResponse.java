package com.extrophi.token_ledger.api.dto;

import com.extrophi.token_ledger.ledger.LedgerEntry;
import com.extrophi.token_ledger.ledger.TokenAmounts;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One ledger row as seen by API clients.
 */
@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_user_id")
    UUID fromUserId;

    @JsonProperty("to_user_id")
    UUID toUserId;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("transaction_type")
    String transactionType;

    @JsonProperty("attribution_id")
    UUID attributionId;

    @JsonProperty("content_ref")
    UUID contentRef;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("from_balance_after")
    String fromBalanceAfter;

    @JsonProperty("to_balance_after")
    String toBalanceAfter;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .fromUserId(entry.getFromAccountId())
            .toUserId(entry.getToAccountId())
            .amount(TokenAmounts.format(entry.getAmount()))
            .transactionType(entry.getKind().getDbValue())
            .attributionId(entry.getAttributionId())
            .contentRef(entry.getContentId())
            .reason(entry.getReason())
            .fromBalanceAfter(TokenAmounts.format(entry.getFromBalanceAfter()))
            .toBalanceAfter(TokenAmounts.format(entry.getToBalanceAfter()))
            .metadata(entry.getMetadata())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
