package com.extrophi.token_ledger.ledger;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a ledger operation: either a value or a {@link LedgerError}.
 *
 * Business refusals (bad amount, unknown account, insufficient balance) are
 * returned as failures rather than thrown, so callers must inspect the result.
 * {@link #orElseThrow()} converts a failure into a {@link LedgerException} at
 * boundaries that prefer exceptions.
 */
public final class LedgerResult<T> {

    private final T value;
    private final LedgerError error;

    private LedgerResult(T value, LedgerError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> LedgerResult<T> success(T value) {
        return new LedgerResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> LedgerResult<T> failure(LedgerError error) {
        return new LedgerResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present, operation failed: " + error.getMessage());
        }
        return value;
    }

    public LedgerError getError() {
        if (error == null) {
            throw new IllegalStateException("No error present, operation succeeded");
        }
        return error;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new LedgerException(error);
        }
        return value;
    }

    public <R> LedgerResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "LedgerResult.success(" + value + ")" : "LedgerResult.failure(" + error + ")";
    }
}
