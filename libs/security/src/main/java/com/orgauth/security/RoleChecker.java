package com.orgauth.security;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Role-based authorization check.
 * <p>
 * A request passes when the identity holds at least one of the required roles. An empty
 * requirement means any authenticated identity suffices.
 * <p>
 * WHY no hierarchy: roles come from the token as plain names and are compared for equality,
 * so a route that admits several roles lists each of them.
 */
public final class RoleChecker {

    private final SecurityEventSink events;

    public RoleChecker(SecurityEventSink events) {
        this.events = events;
    }

    /**
     * Permits or denies an operation.
     *
     * @throws AuthException {@link AuthErrorCode#INSUFFICIENT_ROLE} when denied
     */
    public void authorize(IdentityContext identity, Set<String> requiredRoles) {
        if (hasAnyRole(identity, requiredRoles)) {
            return;
        }
        String held = String.join(",", new TreeSet<>(identity.roles()));
        String required = String.join(",", new TreeSet<>(requiredRoles));
        SecurityEvents.emit(
                events,
                SecurityEvent.failure(
                        SecurityEventType.ACCESS_DENIED,
                        AuthErrorCode.INSUFFICIENT_ROLE,
                        "userId", identity.userId(),
                        "tenantId", identity.tenantId(),
                        "heldRoles", held,
                        "requiredRoles", required));
        throw new AuthException(
                AuthErrorCode.INSUFFICIENT_ROLE,
                "Roles [%s] do not satisfy any of [%s]".formatted(held, required));
    }

    /** True when {@code required} is empty or shares at least one role with the identity. */
    public static boolean hasAnyRole(IdentityContext identity, Collection<String> required) {
        if (required == null || required.isEmpty()) {
            return true;
        }
        return required.stream().anyMatch(identity::hasRole);
    }
}
