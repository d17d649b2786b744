package com.orgauth.security;

/**
 * Thrown when a caller reaches for a resource of a tenant other than its own.
 */
public class TenantMismatchException extends RuntimeException {

    private final String callerTenantId;
    private final String resourceTenantId;

    public TenantMismatchException(String callerTenantId, String resourceTenantId) {
        super("Tenant mismatch: caller tenant '%s' cannot access resource of tenant '%s'"
                .formatted(callerTenantId, resourceTenantId));
        this.callerTenantId = callerTenantId;
        this.resourceTenantId = resourceTenantId;
    }

    public String callerTenantId() {
        return callerTenantId;
    }

    public String resourceTenantId() {
        return resourceTenantId;
    }
}
