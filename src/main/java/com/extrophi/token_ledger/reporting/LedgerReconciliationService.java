package com.extrophi.token_ledger.reporting;

import com.extrophi.token_ledger.ledger.Account;
import com.extrophi.token_ledger.ledger.AccountStore;
import com.extrophi.token_ledger.ledger.LedgerRepository;
import com.extrophi.token_ledger.observability.TokenMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Checks that every stored balance equals credits minus debits over the
 * full ledger.
 *
 * A non-empty result means a balance changed outside the posting engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReconciliationService {

    private final AccountStore accountStore;
    private final LedgerRepository ledgerRepository;
    private final TokenMetrics metrics;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<BalanceDiscrepancy> reconcile() {
        Map<UUID, BigDecimal> positions = ledgerRepository.netPositions();
        List<BalanceDiscrepancy> discrepancies = new ArrayList<>();

        for (Account account : accountStore.findAll()) {
            BigDecimal ledgerBalance = positions.getOrDefault(account.getId(), BigDecimal.ZERO);
            if (account.getBalance().compareTo(ledgerBalance) != 0) {
                discrepancies.add(new BalanceDiscrepancy(account.getId(), account.getBalance(), ledgerBalance));
            }
        }

        for (BalanceDiscrepancy discrepancy : discrepancies) {
            log.error("Balance mismatch for account {}: stored={}, ledger={}",
                    discrepancy.getAccountId(), discrepancy.getStoredBalance(), discrepancy.getLedgerBalance());
        }
        metrics.setReconciliationDiscrepancies(discrepancies.size());
        log.info("Reconciliation finished: discrepancies={}", discrepancies.size());
        return discrepancies;
    }
}
