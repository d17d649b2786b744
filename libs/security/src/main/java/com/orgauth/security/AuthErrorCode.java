package com.orgauth.security;

/**
 * Error taxonomy for token issuance, verification, login and authorization.
 *
 * <p>None of these codes is retried inside the core. {@link #STORE_UNAVAILABLE} and {@link
 * #UPSTREAM_AUTH_ERROR} may be transient; retrying them is the caller's decision.
 */
public enum AuthErrorCode {

    /** The token cannot be split or decoded into the expected structure. */
    MALFORMED(FailureCategory.UNAUTHENTICATED),

    /** The token signature does not match its content (tampered or wrong key). */
    INVALID_SIGNATURE(FailureCategory.UNAUTHENTICATED),

    /** The token's expiry has elapsed. */
    EXPIRED(FailureCategory.UNAUTHENTICATED),

    /** The Authorization header is absent or does not use the {@code Bearer } scheme. */
    MISSING_OR_MALFORMED_HEADER(FailureCategory.UNAUTHENTICATED),

    /** None of the caller's roles is among the roles the operation requires. */
    INSUFFICIENT_ROLE(FailureCategory.FORBIDDEN),

    /** The anti-forgery state (or nonce) presented on callback does not match the stored one. */
    STATE_MISMATCH(FailureCategory.LOGIN_REJECTED),

    /** The identity provider did not return subject, email and display name. */
    INCOMPLETE_IDENTITY(FailureCategory.LOGIN_REJECTED),

    /** A new external subject presents an email that already belongs to another user. */
    IDENTITY_CONFLICT(FailureCategory.LOGIN_REJECTED),

    /** Communication with the identity provider failed. */
    UPSTREAM_AUTH_ERROR(FailureCategory.UPSTREAM_FAILURE),

    /** The identity store could not complete the operation. */
    STORE_UNAVAILABLE(FailureCategory.UNAVAILABLE),

    /** Randomness, configuration or invariant failure. */
    INTERNAL_ERROR(FailureCategory.INTERNAL);

    private final FailureCategory category;

    AuthErrorCode(FailureCategory category) {
        this.category = category;
    }

    public FailureCategory category() {
        return category;
    }
}
