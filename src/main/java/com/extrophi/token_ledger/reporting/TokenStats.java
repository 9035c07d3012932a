package com.extrophi.token_ledger.reporting;

import com.extrophi.token_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Point-in-time statistics of one account, all read from the same snapshot.
 *
 * netChange is totalEarned minus totalSpent and equals balance for any
 * account whose every balance change went through the ledger.
 */
@Value
@Builder
public class TokenStats {
    UUID accountId;
    BigDecimal balance;
    BigDecimal totalEarned;
    BigDecimal totalSpent;
    BigDecimal netChange;
    Map<TransactionKind, Long> transactionCounts;
    long totalTransactions;
}
