package com.orgauth.security;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured security event.
 *
 * @param type what happened
 * @param reason the error code behind a failure event, or null for success events
 * @param timestamp when it happened
 * @param attributes additional key/value detail; null values are dropped
 */
public record SecurityEvent(
        SecurityEventType type, AuthErrorCode reason, Instant timestamp, Map<String, String> attributes) {

    public SecurityEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static SecurityEvent of(SecurityEventType type, String... keyValues) {
        return new SecurityEvent(type, null, Instant.now(), attributes(keyValues));
    }

    public static SecurityEvent failure(
            SecurityEventType type, AuthErrorCode reason, String... keyValues) {
        return new SecurityEvent(type, reason, Instant.now(), attributes(keyValues));
    }

    /**
     * Builds an attribute map from alternating keys and values, skipping pairs whose value is null.
     */
    static Map<String, String> attributes(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("attributes must be key/value pairs");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return Collections.unmodifiableMap(map);
    }
}
