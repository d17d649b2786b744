package com.orgauth.authservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orgauth.authservice.domain.identity.Tenant;
import java.time.Instant;

public record TenantResponse(
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("created_at") Instant createdAt) {

    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(tenant.id(), tenant.createdAt());
    }
}
