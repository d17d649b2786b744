package com.orgauth.security;

import java.time.Instant;

/**
 * Result of a successful {@link TokenVerifier#verify(String)}.
 *
 * @param claims the decoded claim set
 * @param issuedAt {@code iat}, second precision
 * @param expiresAt {@code exp}, second precision, strictly after {@code issuedAt}
 */
public record VerifiedToken(TokenClaims claims, Instant issuedAt, Instant expiresAt) {

    /** Projects the verified claims onto the per-request identity. */
    public IdentityContext toIdentityContext() {
        return new IdentityContext(
                claims.subject(), claims.tenantId(), claims.email(), claims.roles());
    }
}
