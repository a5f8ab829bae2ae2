package com.warden.observability;

/**
 * Immutable per-request context carried into every log line through SLF4J MDC.
 *
 * @param correlationId unique ID for the request, taken from {@code X-Correlation-ID} when the
 *                      caller supplies one
 * @param clientAddress source address of the caller
 * @param userId        authenticated user, null until the request has been authorized
 */
public record CorrelationContext(
        String correlationId,
        String clientAddress,
        String userId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for client address. */
    public static final String MDC_CLIENT_ADDRESS = "clientAddress";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    public CorrelationContext withUserId(String authenticatedUserId) {
        return new CorrelationContext(correlationId, clientAddress, authenticatedUserId);
    }
}
