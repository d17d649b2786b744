package com.orgauth.authservice.domain.identity;

import java.util.Set;

/**
 * Outcome of resolving an external identity to a local user.
 *
 * @param user the local user
 * @param roles roles held in the user's tenant, never empty
 * @param provisioning how the user came to exist
 */
public record ResolvedIdentity(User user, Set<String> roles, Provisioning provisioning) {

    public enum Provisioning {
        /** The user already existed. */
        EXISTING,
        /** The user was created together with a new tenant. */
        FOUNDED_TENANT,
        /** The user was created and joined an existing tenant. */
        JOINED_TENANT
    }

    public ResolvedIdentity {
        roles = Set.copyOf(roles);
    }

    public String tenantId() {
        return user.tenantId();
    }
}
