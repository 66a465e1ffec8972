package com.caradonti.finance_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used for ledger aggregates.
 *
 * The correlation id comes from the {@code X-Correlation-ID} header (or is
 * generated), is copied into every notification message, and shows up in all
 * log lines of the request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EVENT_ID_MDC_KEY = "eventId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";
    public static final String REGISTER_ID_MDC_KEY = "registerId";
    public static final String COUNT_ID_MDC_KEY = "countId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short ids read better in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Removes every aggregate key from the MDC.
     */
    public static void clearAggregateKeys() {
        MDC.remove(EVENT_ID_MDC_KEY);
        MDC.remove(ENTRY_ID_MDC_KEY);
        MDC.remove(REGISTER_ID_MDC_KEY);
        MDC.remove(COUNT_ID_MDC_KEY);
    }
}
