package com.extrophi.token_ledger.reporting;

import com.extrophi.token_ledger.ledger.AccountStore;
import com.extrophi.token_ledger.ledger.LedgerEntry;
import com.extrophi.token_ledger.ledger.LedgerError;
import com.extrophi.token_ledger.ledger.LedgerRepository;
import com.extrophi.token_ledger.ledger.LedgerResult;
import com.extrophi.token_ledger.ledger.TransactionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only views of the ledger: paginated history and account statistics.
 *
 * Statistics run several queries inside one REPEATABLE READ read-only
 * transaction so balance, totals and counts agree with each other even while
 * postings commit concurrently.
 */
@Service
@Slf4j
public class TokenReportingService {

    private final AccountStore accountStore;
    private final LedgerRepository ledgerRepository;
    private final TransactionTemplate snapshotTransaction;
    private final int maxHistoryLimit;

    public TokenReportingService(AccountStore accountStore,
                                 LedgerRepository ledgerRepository,
                                 PlatformTransactionManager transactionManager,
                                 @Value("${ledger.history.max-limit:500}") int maxHistoryLimit) {
        this.accountStore = accountStore;
        this.ledgerRepository = ledgerRepository;
        this.maxHistoryLimit = maxHistoryLimit;

        this.snapshotTransaction = new TransactionTemplate(transactionManager);
        this.snapshotTransaction.setReadOnly(true);
        this.snapshotTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
    }

    /**
     * Entries where the account is either party, newest first.
     *
     * @param kind optional filter, null for all kinds
     * @throws IllegalArgumentException if limit is outside 1..max or offset is negative
     */
    public LedgerResult<List<LedgerEntry>> history(UUID accountId, int limit, int offset, TransactionKind kind) {
        if (limit < 1 || limit > maxHistoryLimit) {
            throw new IllegalArgumentException(
                String.format("Limit must be between 1 and %d, got: %d", maxHistoryLimit, limit));
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative, got: " + offset);
        }

        try {
            if (!accountStore.exists(accountId)) {
                return LedgerResult.failure(LedgerError.accountNotFound(accountId));
            }
            return LedgerResult.success(ledgerRepository.history(accountId, limit, offset, kind));
        } catch (DataAccessException e) {
            log.error("History lookup failed for account {}: {}", accountId, e.getMessage());
            return LedgerResult.failure(LedgerError.storageFault(e.getMessage()));
        }
    }

    public LedgerResult<TokenStats> stats(UUID accountId) {
        try {
            Optional<TokenStats> stats = snapshotTransaction.execute(status -> readStats(accountId));
            return stats != null && stats.isPresent()
                ? LedgerResult.success(stats.get())
                : LedgerResult.failure(LedgerError.accountNotFound(accountId));
        } catch (DataAccessException e) {
            log.error("Stats lookup failed for account {}: {}", accountId, e.getMessage());
            return LedgerResult.failure(LedgerError.storageFault(e.getMessage()));
        }
    }

    private Optional<TokenStats> readStats(UUID accountId) {
        Optional<BigDecimal> balance = accountStore.findBalance(accountId);
        if (balance.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal totalEarned = ledgerRepository.totalEarned(accountId);
        BigDecimal totalSpent = ledgerRepository.totalSpent(accountId);
        Map<TransactionKind, Long> counts = ledgerRepository.countByKind(accountId);
        long total = counts.values().stream().mapToLong(Long::longValue).sum();

        return Optional.of(TokenStats.builder()
            .accountId(accountId)
            .balance(balance.get())
            .totalEarned(totalEarned)
            .totalSpent(totalSpent)
            .netChange(totalEarned.subtract(totalSpent))
            .transactionCounts(counts)
            .totalTransactions(total)
            .build());
    }
}
