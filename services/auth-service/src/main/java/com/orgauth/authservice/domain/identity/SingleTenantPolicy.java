package com.orgauth.authservice.domain.identity;

import java.util.Optional;

/** All users share one tenant identified by a fixed key. */
public final class SingleTenantPolicy implements TenantResolutionPolicy {

    private final String tenantKey;

    public SingleTenantPolicy(String tenantKey) {
        if (tenantKey == null || tenantKey.isBlank()) {
            throw new IllegalArgumentException("SINGLE tenancy requires a fixed tenant key");
        }
        this.tenantKey = tenantKey;
    }

    @Override
    public Optional<String> tenantKey(ExternalIdentity identity) {
        return Optional.of(tenantKey);
    }
}
