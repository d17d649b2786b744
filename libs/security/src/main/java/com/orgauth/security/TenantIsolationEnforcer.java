package com.orgauth.security;

/**
 * Compares the caller's tenant with the tenant that owns a resource.
 * <p>
 * WHY a utility class: every tenant-scoped read performs the same comparison before touching
 * data, and a mismatch must fail with {@link TenantMismatchException} rather than an empty result.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @param identity the authenticated caller
     * @param resourceTenantId tenant owning the resource being accessed
     * @throws TenantMismatchException if the tenants differ
     */
    public static void enforce(IdentityContext identity, String resourceTenantId) {
        String callerTenantId = identity.tenantId();
        if (!callerTenantId.equals(resourceTenantId)) {
            throw new TenantMismatchException(callerTenantId, resourceTenantId);
        }
    }
}
