package com.extrophi.token_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a completed transfer. replayed is true when an idempotency key
 * matched an earlier transfer and nothing new was posted.
 */
@Value
public class TransferResult {
    UUID transactionId;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    BigDecimal fromBalance;
    BigDecimal toBalance;
    TransactionKind kind;
    UUID attributionId;
    String reason;
    Instant createdAt;
    boolean replayed;

    public static TransferResult from(LedgerEntry entry, boolean replayed) {
        return new TransferResult(
            entry.getId(),
            entry.getFromAccountId(),
            entry.getToAccountId(),
            entry.getAmount(),
            entry.getFromBalanceAfter(),
            entry.getToBalanceAfter(),
            entry.getKind(),
            entry.getAttributionId(),
            entry.getReason(),
            entry.getCreatedAt(),
            replayed
        );
    }
}
