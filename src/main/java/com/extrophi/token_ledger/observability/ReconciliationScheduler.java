package com.extrophi.token_ledger.observability;

import com.extrophi.token_ledger.reporting.LedgerReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reconciles balances against the ledger and refreshes the
 * ledger.reconciliation.discrepancies gauge.
 */
@Component
@ConditionalOnProperty(name = "ledger.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final LedgerReconciliationService reconciliationService;

    @Scheduled(
        fixedDelayString = "${ledger.reconciliation.interval-ms:300000}",
        initialDelayString = "${ledger.reconciliation.interval-ms:300000}"
    )
    public void reconcile() {
        try {
            reconciliationService.reconcile();
        } catch (Exception e) {
            log.warn("Scheduled reconciliation failed: {}", e.getMessage());
        }
    }
}
