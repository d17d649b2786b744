package com.orgauth.security;

import java.util.Arrays;

/**
 * Request path pattern used by the exemption list and the route-role table.
 *
 * <p>Segments match literally, {@code *} matches exactly one segment, and a trailing {@code **}
 * matches any remainder including none. {@code /actuator/health/**} therefore matches both
 * {@code /actuator/health} and {@code /actuator/health/liveness}.
 *
 * @param pattern the pattern text, starting with {@code /}
 */
public record PathPattern(String pattern) {

    private static final String ANY_SEGMENT = "*";
    private static final String ANY_REMAINDER = "**";

    public PathPattern {
        if (pattern == null || !pattern.startsWith("/")) {
            throw new IllegalArgumentException("Path pattern must start with '/': " + pattern);
        }
        String[] segments = segments(pattern);
        for (int i = 0; i < segments.length - 1; i++) {
            if (ANY_REMAINDER.equals(segments[i])) {
                throw new IllegalArgumentException("'**' is only allowed as the last segment: " + pattern);
            }
        }
    }

    public static PathPattern of(String pattern) {
        return new PathPattern(pattern);
    }

    public boolean matches(String path) {
        if (path == null) {
            return false;
        }
        String[] expected = segments(pattern);
        String[] actual = segments(path);
        for (int i = 0; i < expected.length; i++) {
            if (ANY_REMAINDER.equals(expected[i])) {
                return true;
            }
            if (i >= actual.length) {
                return false;
            }
            if (!ANY_SEGMENT.equals(expected[i]) && !expected[i].equals(actual[i])) {
                return false;
            }
        }
        return expected.length == actual.length;
    }

    private static String[] segments(String path) {
        return Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toArray(String[]::new);
    }
}
