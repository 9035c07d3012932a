package com.extrophi.token_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Logging context for one unit of work: an HTTP request or a consumed
 * content event.
 *
 * Everything lives in the SLF4J MDC so that the log pattern can print the
 * correlation id, the account being posted to and the resulting ledger
 * entry without passing them around.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final String CORRELATION_ID_KEY = "correlationId";
    static final String ACCOUNT_ID_KEY = "accountId";
    static final String TRANSACTION_ID_KEY = "transactionId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private CorrelationContext() {
    }

    /**
     * Uses a caller-supplied id when it is safe to print, otherwise a fresh one.
     */
    public static String resolve(String candidate) {
        if (candidate != null && ACCEPTED_ID.matcher(candidate).matches()) {
            return candidate;
        }
        return newCorrelationId();
    }

    public static void begin(String correlationId) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
    }

    public static void putAccount(Object accountId) {
        MDC.put(ACCOUNT_ID_KEY, String.valueOf(accountId));
    }

    public static void putTransaction(UUID transactionId) {
        MDC.put(TRANSACTION_ID_KEY, transactionId.toString());
    }

    /**
     * Drops the per-posting keys, leaving the correlation id in place.
     */
    public static void clearPosting() {
        MDC.remove(ACCOUNT_ID_KEY);
        MDC.remove(TRANSACTION_ID_KEY);
    }

    public static void end() {
        clearPosting();
        MDC.remove(CORRELATION_ID_KEY);
    }

    static String newCorrelationId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
