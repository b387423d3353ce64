package com.hrsearch.observability;

/**
 * Immutable correlation context that flows with a single search request.
 * <p>
 * The HTTP layer establishes a {@code CorrelationContext} as soon as a request arrives; the
 * organization is attached once the request parameters are bound. Values are mirrored into
 * SLF4J MDC by {@link CorrelationContextHolder} so every log line carries them.
 *
 * @param correlationId  unique ID for the request flow, echoed back to the caller
 * @param organizationId organization (tenant) being searched, null until known
 * @param clientKey      rate-limit bucket of the caller (IP or header value), null until known
 * @param requestId      unique ID of this request (one correlation may span several requests)
 */
public record CorrelationContext(
        String correlationId,
        String organizationId,
        String clientKey,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for organization ID. */
    public static final String MDC_ORGANIZATION_ID = "organizationId";

    /** MDC key for client key. */
    public static final String MDC_CLIENT_KEY = "clientKey";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context that only carries a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /** Returns a copy bound to the given organization and client key. */
    public CorrelationContext forRequest(String organizationId, String clientKey) {
        return new CorrelationContext(correlationId, organizationId, clientKey, requestId);
    }
}
