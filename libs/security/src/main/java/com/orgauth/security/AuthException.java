package com.orgauth.security;

/**
 * Terminal failure of an authentication, login or authorization step.
 *
 * <p>The message is for logs only. Anything facing a client must be derived from {@link
 * #category()}.
 */
public class AuthException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthException(AuthErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AuthException(AuthErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AuthErrorCode code() {
        return code;
    }

    public FailureCategory category() {
        return code.category();
    }
}
