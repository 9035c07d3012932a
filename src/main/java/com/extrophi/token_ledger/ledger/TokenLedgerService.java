package com.extrophi.token_ledger.ledger;

import com.extrophi.token_ledger.observability.CorrelationContext;
import com.extrophi.token_ledger.observability.TokenMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for awards and transfers.
 *
 * Wraps the posting engine with:
 * - idempotency keys (a repeated key returns the original outcome)
 * - conversion of storage failures into STORAGE_FAULT results
 * - metrics and MDC context for every operation
 *
 * Every method returns a {@link LedgerResult}; nothing here throws for a
 * business refusal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenLedgerService {

    private final LedgerPostingService postingService;
    private final IdempotencyService idempotencyService;
    private final TokenMetrics metrics;

    /**
     * Credits system-originated tokens to an account.
     */
    public LedgerResult<AwardResult> award(AwardCommand command) {
        long startTime = System.currentTimeMillis();
        AwardCommand normalized = hasText(command.getIdempotencyKey())
            ? command
            : command.toBuilder().idempotencyKey(null).build();
        CorrelationContext.putAccount(command.getToAccountId());

        try {
            LedgerResult<AwardResult> result = executeIdempotent(
                normalized.getIdempotencyKey(),
                () -> postingService.postAward(normalized),
                existing -> replayAward(existing, normalized),
                AwardResult::getTransactionId
            );

            if (result.isSuccess()) {
                AwardResult award = result.getValue();
                CorrelationContext.putTransaction(award.getTransactionId());
                log.info("Awarded {} to {}: newBalance={}, reason={}, replayed={}",
                        award.getAmount(), award.getAccountId(), award.getNewBalance(),
                        award.getReason(), award.isReplayed());
                metrics.recordAward(award.isReplayed() ? "replayed" : "success");
            } else {
                logFailure("Award", result.getError());
                metrics.recordAward(result.getError().getKind().name());
            }
            return result;

        } finally {
            metrics.recordLatency("award", System.currentTimeMillis() - startTime);
            CorrelationContext.clearPosting();
        }
    }

    /**
     * Moves tokens between accounts. An attribution id makes it an
     * attribution transfer.
     */
    public LedgerResult<TransferResult> transfer(TransferCommand command) {
        long startTime = System.currentTimeMillis();
        TransferCommand normalized = hasText(command.getIdempotencyKey())
            ? command
            : command.toBuilder().idempotencyKey(null).build();
        String kind = normalized.kind().getDbValue();
        CorrelationContext.putAccount(command.getFromAccountId());

        try {
            LedgerResult<TransferResult> result = executeIdempotent(
                normalized.getIdempotencyKey(),
                () -> postingService.postTransfer(normalized),
                existing -> replayTransfer(existing, normalized),
                TransferResult::getTransactionId
            );

            if (result.isSuccess()) {
                TransferResult transfer = result.getValue();
                CorrelationContext.putTransaction(transfer.getTransactionId());
                log.info("Transferred {} from {} to {}: kind={}, fromBalance={}, toBalance={}, replayed={}",
                        transfer.getAmount(), transfer.getFromAccountId(), transfer.getToAccountId(),
                        transfer.getKind(), transfer.getFromBalance(), transfer.getToBalance(),
                        transfer.isReplayed());
                metrics.recordTransfer(kind, transfer.isReplayed() ? "replayed" : "success");
            } else {
                logFailure("Transfer", result.getError());
                metrics.recordTransfer(kind, result.getError().getKind().name());
            }
            return result;

        } finally {
            metrics.recordLatency("transfer", System.currentTimeMillis() - startTime);
            CorrelationContext.clearPosting();
        }
    }

    /**
     * Runs a posting under an optional idempotency key.
     *
     * A concurrent duplicate that loses the race on the unique key is
     * answered with the winner's entry.
     */
    private <T> LedgerResult<T> executeIdempotent(String idempotencyKey,
                                                  Supplier<LedgerResult<T>> posting,
                                                  Function<LedgerEntry, LedgerResult<T>> replay,
                                                  Function<T, UUID> entryIdOf) {
        if (idempotencyKey != null && idempotencyKey.length() > IdempotencyService.MAX_KEY_LENGTH) {
            return LedgerResult.failure(LedgerError.invalidIdempotencyKey(idempotencyKey.length()));
        }
        try {
            if (idempotencyKey != null) {
                Optional<LedgerEntry> existing = idempotencyService.findExisting(idempotencyKey);
                if (existing.isPresent()) {
                    metrics.recordIdempotencyHit();
                    return replay.apply(existing.get());
                }
                metrics.recordIdempotencyMiss();
            }

            LedgerResult<T> result = posting.get();
            if (idempotencyKey != null && result.isSuccess()) {
                idempotencyService.remember(idempotencyKey, entryIdOf.apply(result.getValue()));
            }
            return result;

        } catch (DuplicateKeyException e) {
            if (idempotencyKey == null) {
                return storageFault(e);
            }
            log.info("Concurrent request with idempotency key {} lost the race, returning the original outcome",
                    idempotencyKey);
            try {
                return idempotencyService.findExisting(idempotencyKey)
                    .map(replay)
                    .orElseGet(() -> storageFault(e));
            } catch (DataAccessException lookupFailure) {
                return storageFault(lookupFailure);
            }

        } catch (DataAccessException e) {
            return storageFault(e);
        }
    }

    private LedgerResult<AwardResult> replayAward(LedgerEntry existing, AwardCommand command) {
        boolean matches = existing.getKind() == TransactionKind.EARN
            && existing.getToAccountId().equals(command.getToAccountId())
            && sameAmount(existing, command.getAmount());
        if (!matches) {
            return LedgerResult.failure(
                LedgerError.idempotencyKeyConflict(command.getIdempotencyKey(), existing.getId()));
        }
        return LedgerResult.success(AwardResult.from(existing, true));
    }

    private LedgerResult<TransferResult> replayTransfer(LedgerEntry existing, TransferCommand command) {
        boolean matches = existing.getKind() == command.kind()
            && existing.getToAccountId().equals(command.getToAccountId())
            && existing.getFromAccountId().equals(command.getFromAccountId())
            && sameAmount(existing, command.getAmount());
        if (!matches) {
            return LedgerResult.failure(
                LedgerError.idempotencyKeyConflict(command.getIdempotencyKey(), existing.getId()));
        }
        return LedgerResult.success(TransferResult.from(existing, true));
    }

    private boolean sameAmount(LedgerEntry existing, BigDecimal requested) {
        return requested != null && existing.getAmount().compareTo(requested) == 0;
    }

    private <T> LedgerResult<T> storageFault(DataAccessException e) {
        log.error("Ledger storage failure, transaction rolled back: {}", e.getMessage(), e);
        return LedgerResult.failure(LedgerError.storageFault(e.getMostSpecificCause().getMessage()));
    }

    private void logFailure(String operation, LedgerError error) {
        if (error.getKind() == LedgerErrorKind.STORAGE_FAULT) {
            return;
        }
        log.warn("{} rejected: kind={}, message={}", operation, error.getKind(), error.getMessage());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
