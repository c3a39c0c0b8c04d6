package com.flagship.mining_ledger.observability;

import java.util.UUID;

/**
 * Correlation header and MDC keys used across the service.
 *
 * The id comes from the {@code X-Correlation-ID} request header or is
 * generated, appears in every log line via MDC and is echoed back to the
 * client.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private CorrelationContext() {
    }

    /**
     * Short ids read better in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
