package com.orgauth.security;

/** Verifies a compact token string and returns its claims. */
public interface TokenVerifier {

    /**
     * Verifies signature first, then expiry.
     *
     * @param token compact token, without any scheme prefix
     * @return the verified claims
     * @throws AuthException with {@link AuthErrorCode#MALFORMED}, {@link
     *     AuthErrorCode#INVALID_SIGNATURE} or {@link AuthErrorCode#EXPIRED}
     */
    VerifiedToken verify(String token);
}
