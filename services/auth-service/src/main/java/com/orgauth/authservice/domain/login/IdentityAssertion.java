package com.orgauth.authservice.domain.login;

import com.orgauth.authservice.domain.identity.ExternalIdentity;

/**
 * Identity data returned by the provider's code exchange. Any field may be missing.
 *
 * @param subject the provider's user id ({@code sub})
 * @param email email address
 * @param displayName display name ({@code name})
 * @param nonce nonce echoed in the ID token
 */
public record IdentityAssertion(String subject, String email, String displayName, String nonce) {

    public boolean isComplete() {
        return hasText(subject) && hasText(email) && hasText(displayName);
    }

    /** @throws IllegalArgumentException if the assertion is incomplete */
    public ExternalIdentity toExternalIdentity() {
        return new ExternalIdentity(subject, email, displayName);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
