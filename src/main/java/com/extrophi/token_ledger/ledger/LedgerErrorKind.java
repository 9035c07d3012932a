package com.extrophi.token_ledger.ledger;

/**
 * Failure taxonomy of ledger operations.
 */
public enum LedgerErrorKind {
    INVALID_AMOUNT,
    INVALID_METADATA,
    INVALID_IDEMPOTENCY_KEY,
    SELF_TRANSFER,
    ACCOUNT_NOT_FOUND,
    INSUFFICIENT_BALANCE,
    UNKNOWN_ATTRIBUTION_KIND,
    IDEMPOTENCY_KEY_CONFLICT,
    STORAGE_FAULT
}
