package com.atrium.observability;

import java.util.UUID;

/**
 * Immutable correlation context for one inbound request.
 * <p>
 * Established when the request enters the service, then enriched with the caller's
 * tenant and user once the bearer token has been resolved. The values are mirrored into
 * SLF4J MDC by {@link CorrelationContextHolder} and stamped into audit entries.
 *
 * @param correlationId unique ID for the request flow (propagated from X-Correlation-ID or generated)
 * @param tenantId      tenant of the resolved caller (null until authentication succeeds)
 * @param userId        resolved caller (null for unauthenticated entry points)
 * @param requestId     unique ID of this specific request
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Starts a context for a new request with a fresh request ID and no caller yet.
     */
    public static CorrelationContext forRequest(String correlationId) {
        return new CorrelationContext(correlationId, null, null, UUID.randomUUID().toString());
    }

    /**
     * Returns a copy carrying the resolved caller's tenant and user.
     */
    public CorrelationContext withCaller(long tenantId, long userId) {
        return new CorrelationContext(
                correlationId, Long.toString(tenantId), Long.toString(userId), requestId);
    }
}
