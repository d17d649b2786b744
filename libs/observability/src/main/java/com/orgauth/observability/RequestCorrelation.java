package com.orgauth.observability;

/**
 * Identifiers attached to every log line written while a request is handled.
 *
 * <p>The request id is established before authentication; user and tenant are added once the
 * access gate has verified a token, and stay null for exempt or rejected requests.
 *
 * @param requestId unique id of this request (never blank)
 * @param userId authenticated user, nullable
 * @param tenantId tenant of the authenticated user, nullable
 */
public record RequestCorrelation(String requestId, String userId, String tenantId) {

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_TENANT_ID = "tenantId";

    public RequestCorrelation {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
    }

    public static RequestCorrelation forRequest(String requestId) {
        return new RequestCorrelation(requestId, null, null);
    }

    /** Copy of this correlation carrying the authenticated identity. */
    public RequestCorrelation withIdentity(String userId, String tenantId) {
        return new RequestCorrelation(requestId, userId, tenantId);
    }
}
