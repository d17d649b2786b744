package com.orgauth.security;

import java.util.Set;

/**
 * Verified identity attached to a request after the access gate has accepted its token.
 *
 * <p>Immutable and safe to share across threads handling the same request.
 *
 * @param userId local user identifier (token {@code sub})
 * @param tenantId tenant the user belongs to; every data access is scoped to it
 * @param email user's email address
 * @param roles role names held within the tenant
 */
public record IdentityContext(String userId, String tenantId, String email, Set<String> roles) {

    public IdentityContext {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
