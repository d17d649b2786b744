package com.orgauth.security;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization header values.
 * <p>
 * The scheme prefix must be exactly {@code "Bearer "} (case and single space included). The
 * remainder must be a non-empty token without whitespace.
 * <p>
 * WHY a utility class: the access gate and any other transport adapter must agree on what a
 * well-formed header is, so the parsing lives in one place.
 */
public final class BearerTokenExtractor {

    public static final String BEARER_PREFIX = "Bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing or malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length());
        if (token.isEmpty() || token.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
