package com.orgauth.authservice.infrastructure.logging;

import com.orgauth.observability.SecurityMetrics;
import com.orgauth.observability.SensitiveDataRedactor;
import com.orgauth.security.SecurityEvent;
import com.orgauth.security.SecurityEventSink;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes security events to the {@code orgauth.security} logger and counts them.
 *
 * <p>Attributes pass through the {@link SensitiveDataRedactor} first. Failure events are logged at
 * WARN, everything else at INFO.
 */
public class LoggingSecurityEventSink implements SecurityEventSink {

    static final String LOGGER_NAME = "orgauth.security";

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    private final SensitiveDataRedactor redactor;
    private final SecurityMetrics metrics;

    public LoggingSecurityEventSink(SensitiveDataRedactor redactor, SecurityMetrics metrics) {
        this.redactor = redactor;
        this.metrics = metrics;
    }

    @Override
    public void record(SecurityEvent event) {
        Map<String, Object> attributes = redactor.redact(event.attributes());
        String reason = event.reason() == null ? null : event.reason().name();
        if (event.type().isFailure()) {
            log.warn("security_event type={} reason={} attributes={}", event.type(), reason, attributes);
        } else {
            log.info("security_event type={} attributes={}", event.type(), attributes);
        }
        metrics.increment(event.type().name(), reason);
    }
}
