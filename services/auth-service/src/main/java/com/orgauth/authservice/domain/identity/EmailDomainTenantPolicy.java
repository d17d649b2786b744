package com.orgauth.authservice.domain.identity;

import java.util.Optional;

/** Users sharing an email domain share a tenant. */
public final class EmailDomainTenantPolicy implements TenantResolutionPolicy {

    static final String KEY_PREFIX = "domain:";

    @Override
    public Optional<String> tenantKey(ExternalIdentity identity) {
        String domain = identity.emailDomain();
        return domain.isEmpty() ? Optional.empty() : Optional.of(KEY_PREFIX + domain);
    }
}
