package com.orgauth.authservice.domain.identity;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence port for tenants, users and role assignments.
 *
 * <p>Implementations guarantee uniqueness of external subject, email and tenant key, and perform
 * each write method atomically: either every row is written or none is. Uniqueness violations
 * surface as {@link DuplicateIdentityException}; any other storage failure as an
 * {@link com.orgauth.security.AuthException} with code {@code STORE_UNAVAILABLE}.
 */
public interface IdentityStore {

    Optional<User> findUserByExternalSubject(String externalSubject);

    /**
     * Creates a tenant, its first user and that user's role in one transaction.
     *
     * @param identity the external identity of the founding user
     * @param tenantKey resolution key for the new tenant, or null
     * @param ownerRole role granted to the founding user
     * @throws DuplicateIdentityException if subject, email or tenant key is taken
     */
    Membership createTenantAndOwner(ExternalIdentity identity, String tenantKey, String ownerRole);

    /**
     * Adds a new user with {@code role} to an existing tenant in one transaction.
     *
     * @throws DuplicateIdentityException if subject or email is taken
     */
    Membership addMember(String tenantId, ExternalIdentity identity, String role);

    Set<String> getRoles(String userId, String tenantId);

    Optional<Tenant> findTenant(String tenantId);

    Optional<Tenant> findTenantByKey(String tenantKey);

    /** Users of a tenant ordered by creation time. */
    List<User> listUsers(String tenantId);
}
