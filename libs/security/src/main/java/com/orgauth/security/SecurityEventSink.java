package com.orgauth.security;

/**
 * Receiver of security events (logging, metrics, alerting).
 *
 * <p>Implementations must not block. Core components deliver through {@link
 * SecurityEvents#emit}, so a failing sink never fails the request that produced the event.
 */
@FunctionalInterface
public interface SecurityEventSink {

    void record(SecurityEvent event);

    /** A sink that discards every event. */
    static SecurityEventSink noop() {
        return event -> {};
    }
}
