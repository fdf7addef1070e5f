package com.wtwr.observability;

/**
 * Immutable per-request correlation data, mirrored into the SLF4J MDC by
 * {@link CorrelationContextHolder} so every log line of the request carries it.
 *
 * @param correlationId id echoed to the caller in {@code X-Correlation-ID}; never blank
 * @param userId        subject of the authenticated caller, null until authentication succeeds
 * @param method        HTTP method of the request
 * @param path          request path
 */
public record CorrelationContext(String correlationId, String userId, String method, String path) {

    public static final String MDC_CORRELATION_ID = "correlationId";

    public static final String MDC_USER_ID = "userId";

    public static final String MDC_METHOD = "method";

    public static final String MDC_PATH = "path";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Returns a copy naming the authenticated caller. */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId, method, path);
    }
}
