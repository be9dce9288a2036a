package com.grcplatform.observability;

/**
 * Immutable correlation context that flows with a single inbound request.
 * <p>
 * Established by the HTTP edge before authentication runs, then enriched with the tenant and
 * user once the caller has been authenticated. The values are pushed into SLF4J MDC by
 * {@link CorrelationContextHolder} and copied into every audit event raised on the request
 * thread, which is how audit records learn the caller's IP and user agent.
 *
 * @param correlationId unique ID for the business flow, propagated via {@code X-Correlation-ID}
 * @param tenantId      authenticated tenant (null until tenant resolution succeeds)
 * @param userId        authenticated local user id (null until authentication succeeds)
 * @param requestId     unique ID for this specific request
 * @param clientIp      remote address of the caller (nullable)
 * @param userAgent     {@code User-Agent} header of the caller (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId,
        String clientIp,
        String userAgent
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for client IP. */
    public static final String MDC_CLIENT_IP = "clientIp";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for an unauthenticated request.
     */
    public static CorrelationContext forRequest(
            String correlationId, String requestId, String clientIp, String userAgent) {
        return new CorrelationContext(correlationId, null, null, requestId, clientIp, userAgent);
    }

    /**
     * Returns a copy bound to the authenticated tenant and user.
     */
    public CorrelationContext withPrincipal(String tenantId, String userId) {
        return new CorrelationContext(correlationId, tenantId, userId, requestId, clientIp, userAgent);
    }
}
