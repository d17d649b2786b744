package com.orgauth.authservice.infrastructure.persistence;

import com.orgauth.authservice.domain.identity.DuplicateIdentityException;
import com.orgauth.authservice.domain.identity.ExternalIdentity;
import com.orgauth.authservice.domain.identity.IdentityStore;
import com.orgauth.authservice.domain.identity.Membership;
import com.orgauth.authservice.domain.identity.Tenant;
import com.orgauth.authservice.domain.identity.User;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Process-local {@link IdentityStore} with the same uniqueness rules as the database schema.
 * Every method holds the store's monitor, so each write is atomic.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private final Map<String, Tenant> tenants = new LinkedHashMap<>();
    private final Map<String, User> users = new LinkedHashMap<>();
    private final Map<String, Set<String>> roles = new HashMap<>();
    private final Clock clock;

    public InMemoryIdentityStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<User> findUserByExternalSubject(String externalSubject) {
        return users.values().stream()
                .filter(u -> u.externalSubject().equals(externalSubject))
                .findFirst();
    }

    @Override
    public synchronized Membership createTenantAndOwner(
            ExternalIdentity identity, String tenantKey, String ownerRole) {
        checkUserUnique(identity);
        if (tenantKey != null && findTenantByKey(tenantKey).isPresent()) {
            throw new DuplicateIdentityException("Tenant key already exists: " + tenantKey);
        }
        Instant now = clock.instant();
        Tenant tenant = new Tenant(UUID.randomUUID().toString(), tenantKey, now);
        tenants.put(tenant.id(), tenant);
        User user = insertUser(tenant.id(), identity, ownerRole, now);
        return new Membership(tenant, user, Set.of(ownerRole));
    }

    @Override
    public synchronized Membership addMember(String tenantId, ExternalIdentity identity, String role) {
        Tenant tenant = tenants.get(tenantId);
        if (tenant == null) {
            throw new IllegalArgumentException("Unknown tenant " + tenantId);
        }
        checkUserUnique(identity);
        User user = insertUser(tenantId, identity, role, clock.instant());
        return new Membership(tenant, user, Set.of(role));
    }

    @Override
    public synchronized Set<String> getRoles(String userId, String tenantId) {
        return Set.copyOf(roles.getOrDefault(roleKey(userId, tenantId), Set.of()));
    }

    @Override
    public synchronized Optional<Tenant> findTenant(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public synchronized Optional<Tenant> findTenantByKey(String tenantKey) {
        return tenants.values().stream()
                .filter(t -> tenantKey.equals(t.tenantKey()))
                .findFirst();
    }

    @Override
    public synchronized List<User> listUsers(String tenantId) {
        List<User> result = new ArrayList<>();
        for (User user : users.values()) {
            if (user.tenantId().equals(tenantId)) {
                result.add(user);
            }
        }
        result.sort(Comparator.comparing(User::createdAt));
        return result;
    }

    public synchronized int tenantCount() {
        return tenants.size();
    }

    public synchronized int userCount() {
        return users.size();
    }

    private void checkUserUnique(ExternalIdentity identity) {
        for (User user : users.values()) {
            if (user.externalSubject().equals(identity.subject())) {
                throw new DuplicateIdentityException("External subject already bound");
            }
            if (user.email().equals(identity.email())) {
                throw new DuplicateIdentityException("Email already bound to another user");
            }
        }
    }

    private User insertUser(String tenantId, ExternalIdentity identity, String role, Instant now) {
        User user = new User(
                UUID.randomUUID().toString(), tenantId, identity.subject(),
                identity.email(), identity.displayName(), now);
        users.put(user.id(), user);
        roles.put(roleKey(user.id(), tenantId), Set.of(role));
        return user;
    }

    private static String roleKey(String userId, String tenantId) {
        return userId + "/" + tenantId;
    }
}
