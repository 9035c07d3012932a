package com.extrophi.token_ledger.api.dto;

import com.extrophi.token_ledger.ledger.TokenAmounts;
import com.extrophi.token_ledger.ledger.TransactionKind;
import com.extrophi.token_ledger.reporting.TokenStats;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class TokenStatsResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("balance")
    String balance;

    @JsonProperty("total_earned")
    String totalEarned;

    @JsonProperty("total_spent")
    String totalSpent;

    @JsonProperty("net_change")
    String netChange;

    @JsonProperty("transaction_counts")
    Map<String, Long> transactionCounts;

    public static TokenStatsResponse from(TokenStats stats) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (TransactionKind kind : TransactionKind.values()) {
            counts.put(kind.getDbValue(), stats.getTransactionCounts().getOrDefault(kind, 0L));
        }
        counts.put("total", stats.getTotalTransactions());

        return TokenStatsResponse.builder()
            .userId(stats.getAccountId())
            .balance(TokenAmounts.format(stats.getBalance()))
            .totalEarned(TokenAmounts.format(stats.getTotalEarned()))
            .totalSpent(TokenAmounts.format(stats.getTotalSpent()))
            .netChange(TokenAmounts.format(stats.getNetChange()))
            .transactionCounts(counts)
            .build();
    }
}
