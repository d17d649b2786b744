package com.orgauth.authservice.domain.identity;

import java.util.Optional;

/** Every new user founds a tenant. */
public final class PerSignupTenantPolicy implements TenantResolutionPolicy {

    @Override
    public Optional<String> tenantKey(ExternalIdentity identity) {
        return Optional.empty();
    }
}
