package com.orgauth.authservice.domain.login;

import java.net.URI;
import java.time.Duration;

/**
 * Result of starting a login: where to send the browser, and the key under which the
 * anti-forgery state was stored.
 *
 * @param attemptKey opaque key the client presents again on callback
 * @param authorizationUrl provider URL to redirect to
 * @param expiresIn how long the attempt stays valid
 */
public record LoginInitiation(String attemptKey, URI authorizationUrl, Duration expiresIn) {}
