package com.orgauth.security;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per-request authentication enforcement.
 *
 * <p>{@link #authenticate} runs three stages in a fixed order:
 *
 * <ol>
 *   <li>exemption: an exempt path returns {@link AccessDecision#exempt()} before the header is
 *       looked at, so nothing is ever decoded for it
 *   <li>header: the value must be {@code "Bearer <token>"}
 *   <li>verification: the token goes to the {@link TokenVerifier}; any failure becomes a
 *       rejection carrying the verifier's reason
 * </ol>
 *
 * <p>Every rejection is reported to the {@link SecurityEventSink} with its distinct reason. The
 * gate never re-issues or modifies tokens.
 */
public final class AccessGate {

    private final TokenVerifier verifier;
    private final List<PathPattern> exemptPaths;
    private final SecurityEventSink events;

    public AccessGate(TokenVerifier verifier, Collection<String> exemptPaths, SecurityEventSink events) {
        this.verifier = verifier;
        this.exemptPaths = exemptPaths.stream().map(PathPattern::of).toList();
        this.events = events;
    }

    /**
     * @param authorizationHeader raw Authorization header value, may be null
     * @param requestPath request path without context path
     */
    public AccessDecision authenticate(String authorizationHeader, String requestPath) {
        if (isExempt(requestPath)) {
            return AccessDecision.exempt();
        }

        Optional<String> token = BearerTokenExtractor.extract(authorizationHeader);
        if (token.isEmpty()) {
            return reject(AuthErrorCode.MISSING_OR_MALFORMED_HEADER, requestPath, null);
        }

        try {
            VerifiedToken verified = verifier.verify(token.get());
            return AccessDecision.authenticated(verified.toIdentityContext());
        } catch (AuthException e) {
            return reject(e.code(), requestPath, e.getMessage());
        }
    }

    public boolean isExempt(String requestPath) {
        return exemptPaths.stream().anyMatch(p -> p.matches(requestPath));
    }

    private AccessDecision reject(AuthErrorCode reason, String path, String detail) {
        SecurityEvents.emit(
                events,
                SecurityEvent.failure(
                        SecurityEventType.TOKEN_REJECTED, reason, "path", path, "detail", detail));
        return AccessDecision.rejected(reason);
    }
}
