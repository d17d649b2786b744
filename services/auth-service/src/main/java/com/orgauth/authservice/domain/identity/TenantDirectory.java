package com.orgauth.authservice.domain.identity;

import com.orgauth.security.IdentityContext;
import com.orgauth.security.TenantIsolationEnforcer;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tenant-scoped reads for authenticated callers. Every method checks that the requested tenant
 * is the caller's own before touching the store.
 */
public class TenantDirectory {

    /** A user of a tenant with the roles it holds there. */
    public record Member(User user, Set<String> roles) {}

    private final IdentityStore store;

    public TenantDirectory(IdentityStore store) {
        this.store = store;
    }

    public Optional<Tenant> tenant(IdentityContext caller, String tenantId) {
        TenantIsolationEnforcer.enforce(caller, tenantId);
        return store.findTenant(tenantId);
    }

    public List<Member> members(IdentityContext caller, String tenantId) {
        TenantIsolationEnforcer.enforce(caller, tenantId);
        return store.listUsers(tenantId).stream()
                .map(user -> new Member(user, store.getRoles(user.id(), tenantId)))
                .toList();
    }
}
