package com.orgauth.authservice.domain.login;

import com.orgauth.authservice.domain.identity.IdentityResolver;
import com.orgauth.authservice.domain.identity.ResolvedIdentity;
import com.orgauth.security.AuthErrorCode;
import com.orgauth.security.AuthException;
import com.orgauth.security.SecurityEvent;
import com.orgauth.security.SecurityEventSink;
import com.orgauth.security.SecurityEventType;
import com.orgauth.security.SecurityEvents;
import com.orgauth.security.TokenClaims;
import com.orgauth.security.TokenCodec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The OAuth login round trip: redirect with anti-forgery state, then callback, identity
 * resolution and token issuance.
 *
 * <p>A login attempt moves from idle to awaiting callback on {@link #initiateLogin()}, and from
 * there to resolved (a token) or failed (an {@link AuthException}). Nothing is retried; a failed
 * attempt starts again from {@link #initiateLogin()}.
 *
 * <p>The callback checks the state before anything else. On a mismatch, including a missing or
 * already consumed stored state, neither the provider nor the identity store is contacted.
 */
public class LoginHandshake {

    private static final Logger log = LoggerFactory.getLogger(LoginHandshake.class);

    static final int RANDOM_BYTES = 32;

    private final IdentityProviderClient identityProvider;
    private final IdentityResolver identityResolver;
    private final TokenCodec tokenCodec;
    private final LoginStateStore stateStore;
    private final Duration stateTtl;
    private final SecureRandom random;
    private final Clock clock;
    private final SecurityEventSink events;

    public LoginHandshake(
            IdentityProviderClient identityProvider,
            IdentityResolver identityResolver,
            TokenCodec tokenCodec,
            LoginStateStore stateStore,
            Duration stateTtl,
            SecureRandom random,
            Clock clock,
            SecurityEventSink events) {
        this.identityProvider = identityProvider;
        this.identityResolver = identityResolver;
        this.tokenCodec = tokenCodec;
        this.stateStore = stateStore;
        this.stateTtl = stateTtl;
        this.random = random;
        this.clock = clock;
        this.events = events;
    }

    /**
     * Generates state and nonce, stores them under a fresh attempt key and builds the provider
     * redirect.
     *
     * @throws AuthException {@code INTERNAL_ERROR} if secure randomness is unavailable
     */
    public LoginInitiation initiateLogin() {
        String state = randomValue();
        String nonce = randomValue();
        String attemptKey = randomValue();
        stateStore.put(attemptKey, new LoginState(state, nonce, clock.instant()), stateTtl);
        log.debug("Login attempt started");
        return new LoginInitiation(
                attemptKey, identityProvider.buildAuthorizationUrl(state, nonce), stateTtl);
    }

    /**
     * Consumes the stored state of {@code attemptKey} and completes the callback. The stored
     * state is gone afterwards whether or not the callback succeeds.
     */
    public IssuedToken completeLogin(String attemptKey, String presentedState, String code) {
        LoginState stored = attemptKey == null ? null : stateStore.take(attemptKey).orElse(null);
        return handleCallback(presentedState, code, stored);
    }

    /**
     * Validates the callback and issues a token.
     *
     * @param presentedState state from the callback query
     * @param code authorization code from the callback query
     * @param stored state stored at initiation, or null if none was found
     * @throws AuthException {@code STATE_MISMATCH}, {@code INCOMPLETE_IDENTITY},
     *     {@code IDENTITY_CONFLICT}, {@code UPSTREAM_AUTH_ERROR}, {@code STORE_UNAVAILABLE}
     */
    public IssuedToken handleCallback(String presentedState, String code, LoginState stored) {
        if (stored == null || !constantTimeEquals(presentedState, stored.state())) {
            SecurityEvents.emit(
                    events,
                    SecurityEvent.failure(
                            SecurityEventType.STATE_MISMATCH,
                            AuthErrorCode.STATE_MISMATCH,
                            "storedState", stored == null ? "absent" : "present",
                            "presentedState", presentedState == null ? "absent" : "present"));
            throw new AuthException(AuthErrorCode.STATE_MISMATCH, "Login state does not match");
        }

        try {
            IssuedToken token = exchangeAndIssue(code, stored);
            SecurityEvents.emit(
                    events,
                    SecurityEvent.of(
                            SecurityEventType.LOGIN_SUCCEEDED,
                            "userId", token.userId(),
                            "tenantId", token.tenantId()));
            return token;
        } catch (AuthException e) {
            SecurityEvents.emit(
                    events,
                    SecurityEvent.failure(
                            SecurityEventType.LOGIN_FAILED, e.code(), "detail", e.getMessage()));
            throw e;
        }
    }

    private IssuedToken exchangeAndIssue(String code, LoginState stored) {
        if (code == null || code.isBlank()) {
            throw new AuthException(
                    AuthErrorCode.INCOMPLETE_IDENTITY, "Callback carried no authorization code");
        }

        IdentityAssertion assertion = identityProvider.exchangeCode(code);
        if (!constantTimeEquals(assertion.nonce(), stored.nonce())) {
            throw new AuthException(AuthErrorCode.STATE_MISMATCH, "ID token nonce does not match");
        }
        if (!assertion.isComplete()) {
            throw new AuthException(
                    AuthErrorCode.INCOMPLETE_IDENTITY,
                    "Provider identity lacks subject, email or name");
        }

        ResolvedIdentity resolved = identityResolver.resolve(assertion.toExternalIdentity());
        var claims = new TokenClaims(
                resolved.user().id(), resolved.tenantId(), resolved.user().email(), resolved.roles());
        String token = tokenCodec.issue(claims);
        log.info("Issued token for user {} in tenant {}", resolved.user().id(), resolved.tenantId());
        return new IssuedToken(
                token, tokenCodec.defaultTtl(), resolved.user().id(), resolved.tenantId());
    }

    private String randomValue() {
        byte[] bytes = new byte[RANDOM_BYTES];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException e) {
            throw new AuthException(AuthErrorCode.INTERNAL_ERROR, "Secure random source failed", e);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static boolean constantTimeEquals(String presented, String expected) {
        if (presented == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
