package com.orgauth.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link RequestCorrelation} bridged into the SLF4J MDC.
 *
 * <p>Setting a correlation populates the MDC keys so that every log statement on this thread
 * carries them; clearing removes them again. Servlet filters must clear in a {@code finally}
 * block because container threads are pooled.
 */
public final class RequestCorrelationHolder {

    private static final ThreadLocal<RequestCorrelation> CURRENT = new ThreadLocal<>();

    private RequestCorrelationHolder() {
        // utility class
    }

    public static void set(RequestCorrelation correlation) {
        if (correlation == null) {
            throw new IllegalArgumentException("correlation must not be null");
        }
        CURRENT.set(correlation);
        putOrRemove(RequestCorrelation.MDC_REQUEST_ID, correlation.requestId());
        putOrRemove(RequestCorrelation.MDC_USER_ID, correlation.userId());
        putOrRemove(RequestCorrelation.MDC_TENANT_ID, correlation.tenantId());
    }

    public static Optional<RequestCorrelation> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Adds the authenticated identity to the current correlation. Does nothing when no
     * correlation has been established on this thread.
     */
    public static void attachIdentity(String userId, String tenantId) {
        get().ifPresent(current -> set(current.withIdentity(userId, tenantId)));
    }

    public static void clear() {
        CURRENT.remove();
        MDC.remove(RequestCorrelation.MDC_REQUEST_ID);
        MDC.remove(RequestCorrelation.MDC_USER_ID);
        MDC.remove(RequestCorrelation.MDC_TENANT_ID);
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
