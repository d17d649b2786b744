package com.orgauth.authservice.domain.identity;

import java.time.Instant;

/**
 * Local identity bound one-to-one to an external subject. A user never moves between tenants.
 */
public record User(
        String id,
        String tenantId,
        String externalSubject,
        String email,
        String displayName,
        Instant createdAt) {}
