package com.orgauth.authservice.domain.identity;

import java.util.Set;

/**
 * A user together with its tenant and the roles it holds there, as written by the store.
 */
public record Membership(Tenant tenant, User user, Set<String> roles) {

    public Membership {
        roles = Set.copyOf(roles);
    }
}
