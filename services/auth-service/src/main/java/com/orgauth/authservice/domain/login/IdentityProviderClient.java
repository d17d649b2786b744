package com.orgauth.authservice.domain.login;

import java.net.URI;

/**
 * The external OAuth 2.0 / OpenID Connect provider.
 *
 * <p>Implementations bound every network call with a timeout and do not retry.
 */
public interface IdentityProviderClient {

    /** Authorization endpoint URL carrying {@code state} and {@code nonce}. */
    URI buildAuthorizationUrl(String state, String nonce);

    /**
     * Exchanges an authorization code for the user's identity.
     *
     * @throws com.orgauth.security.AuthException {@code UPSTREAM_AUTH_ERROR} on network failure,
     *     a non-2xx answer or an unreadable response
     */
    IdentityAssertion exchangeCode(String code);
}
