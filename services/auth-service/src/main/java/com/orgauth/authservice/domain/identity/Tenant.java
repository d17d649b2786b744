package com.orgauth.authservice.domain.identity;

import java.time.Instant;

/**
 * An isolated organization. Its id never changes after creation.
 *
 * @param id opaque generated id
 * @param tenantKey resolution key assigned by the tenant policy (email domain, fixed key), or
 *     null for tenants founded by a single signup
 * @param createdAt creation time
 */
public record Tenant(String id, String tenantKey, Instant createdAt) {}
