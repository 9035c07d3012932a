package com.extrophi.token_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Describes why a ledger operation was refused or could not complete.
 *
 * Details carry machine-readable context, e.g. the available and required
 * amounts of an insufficient-balance failure.
 */
@Value
public class LedgerError {
    LedgerErrorKind kind;
    String message;
    Map<String, String> details;

    public static LedgerError invalidAmount(BigDecimal amount) {
        return new LedgerError(
            LedgerErrorKind.INVALID_AMOUNT,
            String.format("Amount must be positive with at most %d decimal places, got: %s",
                TokenAmounts.SCALE, amount == null ? "null" : amount.toPlainString()),
            Map.of("amount", amount == null ? "null" : amount.toPlainString())
        );
    }

    public static LedgerError balanceOverflow(UUID accountId, BigDecimal balance, BigDecimal amount) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("account_id", String.valueOf(accountId));
        details.put("balance", TokenAmounts.format(balance));
        details.put("amount", TokenAmounts.format(amount));
        return new LedgerError(
            LedgerErrorKind.INVALID_AMOUNT,
            String.format("Crediting %s would exceed the maximum balance of account %s",
                TokenAmounts.format(amount), accountId),
            details
        );
    }

    public static LedgerError invalidMetadata(String key) {
        return new LedgerError(
            LedgerErrorKind.INVALID_METADATA,
            "Metadata keys and values must not be null, offending key: " + key,
            Map.of("key", String.valueOf(key))
        );
    }

    public static LedgerError invalidIdempotencyKey(int length) {
        return new LedgerError(
            LedgerErrorKind.INVALID_IDEMPOTENCY_KEY,
            String.format("Idempotency key must be at most %d characters, got %d",
                IdempotencyService.MAX_KEY_LENGTH, length),
            Map.of("length", String.valueOf(length))
        );
    }

    public static LedgerError selfTransfer(UUID accountId) {
        return new LedgerError(
            LedgerErrorKind.SELF_TRANSFER,
            "Cannot transfer tokens to the same account",
            Map.of("account_id", String.valueOf(accountId))
        );
    }

    public static LedgerError accountNotFound(UUID accountId) {
        return new LedgerError(
            LedgerErrorKind.ACCOUNT_NOT_FOUND,
            "Account not found: " + accountId,
            Map.of("account_id", String.valueOf(accountId))
        );
    }

    public static LedgerError insufficientBalance(BigDecimal available, BigDecimal required) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("available", TokenAmounts.format(available));
        details.put("required", TokenAmounts.format(required));
        return new LedgerError(
            LedgerErrorKind.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance. Available: %s, Required: %s",
                TokenAmounts.format(available), TokenAmounts.format(required)),
            details
        );
    }

    public static LedgerError unknownAttributionKind(String kind) {
        return new LedgerError(
            LedgerErrorKind.UNKNOWN_ATTRIBUTION_KIND,
            "Unknown attribution kind: " + kind,
            Map.of("attribution_kind", String.valueOf(kind))
        );
    }

    public static LedgerError idempotencyKeyConflict(String idempotencyKey, UUID existingEntryId) {
        return new LedgerError(
            LedgerErrorKind.IDEMPOTENCY_KEY_CONFLICT,
            "Idempotency key was already used for a different operation: " + idempotencyKey,
            Map.of("idempotency_key", idempotencyKey, "transaction_id", String.valueOf(existingEntryId))
        );
    }

    public static LedgerError storageFault(String message) {
        return new LedgerError(
            LedgerErrorKind.STORAGE_FAULT,
            "Ledger storage unavailable: " + message,
            Map.of()
        );
    }
}
