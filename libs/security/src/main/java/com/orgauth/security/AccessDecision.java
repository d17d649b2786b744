package com.orgauth.security;

import java.util.Optional;

/**
 * Outcome of {@link AccessGate#authenticate(String, String)}.
 *
 * @param outcome what the gate decided
 * @param identity verified identity, present only for {@link Outcome#AUTHENTICATED}
 * @param reason rejection reason, present only for {@link Outcome#REJECTED}
 */
public record AccessDecision(Outcome outcome, IdentityContext identity, AuthErrorCode reason) {

    public enum Outcome {
        /** Path is exempt; the request proceeds without an identity. */
        EXEMPT,
        /** Token verified; the request proceeds with an identity. */
        AUTHENTICATED,
        /** The request must be refused as unauthenticated. */
        REJECTED
    }

    public static AccessDecision exempt() {
        return new AccessDecision(Outcome.EXEMPT, null, null);
    }

    public static AccessDecision authenticated(IdentityContext identity) {
        return new AccessDecision(Outcome.AUTHENTICATED, identity, null);
    }

    public static AccessDecision rejected(AuthErrorCode reason) {
        return new AccessDecision(Outcome.REJECTED, null, reason);
    }

    public boolean allowed() {
        return outcome != Outcome.REJECTED;
    }

    public Optional<IdentityContext> identityIfPresent() {
        return Optional.ofNullable(identity);
    }
}
