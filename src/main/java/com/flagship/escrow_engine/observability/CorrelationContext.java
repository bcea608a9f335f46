package com.flagship.escrow_engine.observability;

import java.util.UUID;

/**
 * Thread-local request context: correlation ID plus the caller's address and
 * user agent, which the audit trail records.
 *
 * The correlation ID flows through:
 * - HTTP requests (from header or generated)
 * - All log statements (via MDC)
 * - Audit entries
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CONTRACT_ID_MDC_KEY = "contractId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();
    private static final ThreadLocal<String> clientIp = new ThreadLocal<>();
    private static final ThreadLocal<String> userAgent = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
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

    public static void setClient(String ip, String agent) {
        clientIp.set(ip);
        userAgent.set(agent);
    }

    /**
     * @return the caller's address, or null outside an HTTP request
     */
    public static String getClientIp() {
        return clientIp.get();
    }

    public static String getUserAgent() {
        return userAgent.get();
    }

    /**
     * Clears the context. Called at the end of request processing.
     */
    public static void clear() {
        correlationId.remove();
        clientIp.remove();
        userAgent.remove();
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
