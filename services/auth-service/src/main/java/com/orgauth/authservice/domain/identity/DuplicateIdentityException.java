package com.orgauth.authservice.domain.identity;

/**
 * Raised by an {@link IdentityStore} when a write would break a uniqueness rule: external subject,
 * email or tenant key. Nothing was written when this is thrown.
 */
public class DuplicateIdentityException extends RuntimeException {

    public DuplicateIdentityException(String message) {
        super(message);
    }

    public DuplicateIdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}
