package com.orgauth.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fire-and-forget delivery of {@link SecurityEvent}s. */
public final class SecurityEvents {

    private static final Logger log = LoggerFactory.getLogger(SecurityEvents.class);

    private SecurityEvents() {
        // utility class
    }

    /** Delivers {@code event} to {@code sink}; a sink failure is logged and does not propagate. */
    public static void emit(SecurityEventSink sink, SecurityEvent event) {
        try {
            sink.record(event);
        } catch (RuntimeException e) {
            log.warn("Security event sink failed for {} event", event.type(), e);
        }
    }
}
