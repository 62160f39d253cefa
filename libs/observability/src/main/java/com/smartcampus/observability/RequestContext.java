package com.smartcampus.observability;

/**
 * Immutable per-request context carried alongside every authorization call.
 * <p>
 * Established by the inbound HTTP filter, enriched once the caller's principal is known, and
 * mirrored into SLF4J MDC by {@link RequestContextHolder} so that every log line written while
 * handling the request names the school and the caller.
 *
 * @param correlationId unique ID for the request flow (echoed back in {@code X-Correlation-ID})
 * @param tenantId      school code of the caller (nullable until the principal is resolved,
 *                      and for super administrators)
 * @param principalId   authenticated user performing the action (nullable before resolution)
 * @param role          wire name of the caller's role, e.g. {@code teacher} (nullable)
 * @param clientAddress network address the request came from (nullable)
 * @param userAgent     the client's {@code User-Agent} header, cut to
 *                      {@link #MAX_USER_AGENT_LENGTH} characters (nullable)
 */
public record RequestContext(
        String correlationId,
        String tenantId,
        String principalId,
        String role,
        String clientAddress,
        String userAgent
) {

    /** Longest user agent kept; longer values are truncated. */
    public static final int MAX_USER_AGENT_LENGTH = 256;

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the caller's school code. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the caller's user ID. */
    public static final String MDC_PRINCIPAL_ID = "principalId";

    /** MDC key for the caller's role. */
    public static final String MDC_ROLE = "role";

    public RequestContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        if (userAgent != null && userAgent.length() > MAX_USER_AGENT_LENGTH) {
            userAgent = userAgent.substring(0, MAX_USER_AGENT_LENGTH);
        }
    }

    /**
     * Creates a context that only knows its correlation ID.
     */
    public static RequestContext anonymous(String correlationId) {
        return new RequestContext(correlationId, null, null, null, null, null);
    }

    /**
     * Returns a copy of this context that records where the request came from.
     */
    public RequestContext withClient(String clientAddress, String userAgent) {
        return new RequestContext(correlationId, tenantId, principalId, role, clientAddress, userAgent);
    }

    /**
     * Returns a copy of this context bound to the given caller.
     */
    public RequestContext withPrincipal(String tenantId, String principalId, String role) {
        return new RequestContext(correlationId, tenantId, principalId, role, clientAddress, userAgent);
    }
}
