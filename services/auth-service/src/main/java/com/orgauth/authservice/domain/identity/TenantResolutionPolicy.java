package com.orgauth.authservice.domain.identity;

import java.util.Optional;

/**
 * Decides which tenant a first-time user lands in.
 *
 * <p>An empty key means the user founds a tenant of their own. A present key names a shared
 * tenant: the first user to arrive creates it and becomes owner, later users join it as members.
 */
@FunctionalInterface
public interface TenantResolutionPolicy {

    Optional<String> tenantKey(ExternalIdentity identity);
}
