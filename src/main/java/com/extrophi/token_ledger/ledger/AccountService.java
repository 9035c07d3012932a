package com.extrophi.token_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * Account lifecycle and balance lookups.
 *
 * Accounts are keyed by user id and start at zero. Creation is idempotent so
 * that replayed registration events are harmless.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountStore accountStore;
    private final Clock clock;

    /**
     * Opens an account with a zero balance. Does nothing if it already exists.
     *
     * @return true if a new account was created
     */
    public boolean createAccount(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID cannot be null");
        }
        boolean created = accountStore.insertIfAbsent(userId, clock.instant());
        if (created) {
            log.info("Opened token account for user {}", userId);
        } else {
            log.debug("Token account for user {} already exists", userId);
        }
        return created;
    }

    public boolean exists(UUID accountId) {
        return accountStore.exists(accountId);
    }

    public LedgerResult<BigDecimal> getBalance(UUID accountId) {
        try {
            return accountStore.findBalance(accountId)
                .map(LedgerResult::success)
                .orElseGet(() -> LedgerResult.failure(LedgerError.accountNotFound(accountId)));
        } catch (DataAccessException e) {
            log.error("Balance lookup failed for account {}: {}", accountId, e.getMessage());
            return LedgerResult.failure(LedgerError.storageFault(e.getMessage()));
        }
    }
}
