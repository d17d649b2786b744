package com.orgauth.authservice.domain.identity;

import com.orgauth.authservice.domain.identity.ResolvedIdentity.Provisioning;
import com.orgauth.security.AuthErrorCode;
import com.orgauth.security.AuthException;
import com.orgauth.security.SecurityEvent;
import com.orgauth.security.SecurityEventSink;
import com.orgauth.security.SecurityEventType;
import com.orgauth.security.SecurityEvents;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-login find-or-create of the local tenant and user for an external identity.
 *
 * <p>Returning users are looked up and their roles loaded; nothing is written. Unseen subjects
 * are provisioned according to the {@link TenantResolutionPolicy}.
 *
 * <p>Concurrent first logins for the same subject are serialized by the store's uniqueness
 * constraint. The losing call sees a {@link DuplicateIdentityException} and re-reads the user the
 * winner created. A race on a keyed tenant is resolved the same way: the loser joins the tenant
 * that now exists.
 */
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final IdentityStore store;
    private final TenantResolutionPolicy policy;
    private final String ownerRole;
    private final String memberRole;
    private final SecurityEventSink events;

    public IdentityResolver(
            IdentityStore store,
            TenantResolutionPolicy policy,
            String ownerRole,
            String memberRole,
            SecurityEventSink events) {
        this.store = store;
        this.policy = policy;
        this.ownerRole = ownerRole;
        this.memberRole = memberRole;
        this.events = events;
    }

    /**
     * @throws AuthException {@code IDENTITY_CONFLICT} if the email is bound to another subject,
     *     {@code STORE_UNAVAILABLE} if the store fails
     */
    public ResolvedIdentity resolve(ExternalIdentity identity) {
        Optional<ResolvedIdentity> existing = findExisting(identity.subject());
        if (existing.isPresent()) {
            return existing.get();
        }

        Optional<String> tenantKey = policy.tenantKey(identity);
        ResolvedIdentity provisioned;
        try {
            provisioned = provision(identity, tenantKey);
        } catch (DuplicateIdentityException first) {
            log.debug("Provisioning raced with a concurrent write: {}", first.getMessage());
            provisioned = recover(identity, tenantKey, first);
        }

        if (provisioned.provisioning() != Provisioning.EXISTING) {
            SecurityEvents.emit(
                    events,
                    SecurityEvent.of(
                            SecurityEventType.IDENTITY_PROVISIONED,
                            "userId", provisioned.user().id(),
                            "tenantId", provisioned.tenantId(),
                            "provisioning", provisioned.provisioning().name()));
        }
        return provisioned;
    }

    private ResolvedIdentity provision(ExternalIdentity identity, Optional<String> tenantKey) {
        if (tenantKey.isEmpty()) {
            return founded(store.createTenantAndOwner(identity, null, ownerRole));
        }
        Optional<Tenant> tenant = store.findTenantByKey(tenantKey.get());
        if (tenant.isPresent()) {
            return joined(store.addMember(tenant.get().id(), identity, memberRole));
        }
        return founded(store.createTenantAndOwner(identity, tenantKey.get(), ownerRole));
    }

    private ResolvedIdentity recover(
            ExternalIdentity identity, Optional<String> tenantKey, DuplicateIdentityException cause) {
        Optional<ResolvedIdentity> winner = findExisting(identity.subject());
        if (winner.isPresent()) {
            return winner.get();
        }
        Optional<Tenant> tenant = tenantKey.flatMap(store::findTenantByKey);
        if (tenant.isPresent()) {
            try {
                return joined(store.addMember(tenant.get().id(), identity, memberRole));
            } catch (DuplicateIdentityException again) {
                Optional<ResolvedIdentity> lateWinner = findExisting(identity.subject());
                if (lateWinner.isPresent()) {
                    return lateWinner.get();
                }
                throw conflict(again);
            }
        }
        throw conflict(cause);
    }

    private Optional<ResolvedIdentity> findExisting(String subject) {
        return store.findUserByExternalSubject(subject)
                .map(user -> new ResolvedIdentity(
                        user, store.getRoles(user.id(), user.tenantId()), Provisioning.EXISTING))
                .map(this::requireRoles);
    }

    private ResolvedIdentity requireRoles(ResolvedIdentity resolved) {
        if (resolved.roles().isEmpty()) {
            throw new AuthException(
                    AuthErrorCode.INTERNAL_ERROR,
                    "User " + resolved.user().id() + " holds no role in tenant " + resolved.tenantId());
        }
        return resolved;
    }

    private static ResolvedIdentity founded(Membership membership) {
        return new ResolvedIdentity(membership.user(), membership.roles(), Provisioning.FOUNDED_TENANT);
    }

    private static ResolvedIdentity joined(Membership membership) {
        return new ResolvedIdentity(membership.user(), membership.roles(), Provisioning.JOINED_TENANT);
    }

    private static AuthException conflict(DuplicateIdentityException cause) {
        return new AuthException(
                AuthErrorCode.IDENTITY_CONFLICT,
                "External identity conflicts with an existing user: " + cause.getMessage(),
                cause);
    }
}
