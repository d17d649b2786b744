package com.orgauth.security;

import java.util.Map;
import java.util.Set;

/**
 * The identity-bearing part of an issued token.
 *
 * <p>Timestamps are not part of this record; they are stamped by {@link TokenCodec#issue} and
 * reported back through {@link VerifiedToken}.
 *
 * @param subject local user identifier ({@code sub})
 * @param tenantId owning tenant identifier ({@code tenant_id})
 * @param email user's email address ({@code email})
 * @param roles role names held within the tenant ({@code roles}, order irrelevant)
 * @param extensions additional claims; keys must not collide with the reserved claim names and
 *     values must be JSON-serializable
 */
public record TokenClaims(
        String subject,
        String tenantId,
        String email,
        Set<String> roles,
        Map<String, Object> extensions) {

    public TokenClaims {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    public TokenClaims(String subject, String tenantId, String email, Set<String> roles) {
        this(subject, tenantId, email, roles, Map.of());
    }
}
