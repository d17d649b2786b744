package com.orgauth.authservice.domain.identity;

import java.util.Locale;

/**
 * A complete identity asserted by the external identity provider.
 *
 * @param subject the provider's stable user identifier
 * @param email email address
 * @param displayName human-readable name
 */
public record ExternalIdentity(String subject, String email, String displayName) {

    public ExternalIdentity {
        requireText(subject, "subject");
        requireText(email, "email");
        requireText(displayName, "displayName");
    }

    /** Lower-cased part after the last {@code @}, or empty when the address has none. */
    public String emailDomain() {
        int at = email.lastIndexOf('@');
        return at < 0 ? "" : email.substring(at + 1).toLowerCase(Locale.ROOT);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
