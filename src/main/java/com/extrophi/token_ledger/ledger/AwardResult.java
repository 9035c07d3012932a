package com.extrophi.token_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a completed award.
 */
@Value
public class AwardResult {
    UUID transactionId;
    UUID accountId;
    BigDecimal amount;
    BigDecimal newBalance;
    UUID contentId;
    String reason;
    Instant createdAt;
    boolean replayed;

    public static AwardResult from(LedgerEntry entry, boolean replayed) {
        return new AwardResult(
            entry.getId(),
            entry.getToAccountId(),
            entry.getAmount(),
            entry.getToBalanceAfter(),
            entry.getContentId(),
            entry.getReason(),
            entry.getCreatedAt(),
            replayed
        );
    }
}
