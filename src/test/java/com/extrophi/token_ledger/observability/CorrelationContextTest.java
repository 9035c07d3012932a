package com.extrophi.token_ledger.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("A well-formed caller id is kept")
    void keepsCallerId() {
        assertEquals("corr-123", CorrelationContext.resolve("corr-123"));
    }

    @Test
    @DisplayName("Missing, oversized or unsafe ids are replaced")
    void replacesUnusableIds() {
        assertEquals(12, CorrelationContext.resolve(null).length());
        assertEquals(12, CorrelationContext.resolve("").length());
        assertEquals(12, CorrelationContext.resolve("x".repeat(65)).length());
        assertNotEquals("bad id\n", CorrelationContext.resolve("bad id\n"));
    }

    @Test
    @DisplayName("Posting keys are cleared without dropping the correlation id")
    void clearPostingKeepsCorrelationId() {
        UUID accountId = UUID.randomUUID();
        UUID transactionId = UUID.randomUUID();

        CorrelationContext.begin("req-1");
        CorrelationContext.putAccount(accountId);
        CorrelationContext.putTransaction(transactionId);
        assertEquals(accountId.toString(), MDC.get(CorrelationContext.ACCOUNT_ID_KEY));
        assertEquals(transactionId.toString(), MDC.get(CorrelationContext.TRANSACTION_ID_KEY));

        CorrelationContext.clearPosting();
        assertNull(MDC.get(CorrelationContext.ACCOUNT_ID_KEY));
        assertNull(MDC.get(CorrelationContext.TRANSACTION_ID_KEY));
        assertEquals("req-1", MDC.get(CorrelationContext.CORRELATION_ID_KEY));

        CorrelationContext.end();
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_KEY));
    }
}
