package com.orgauth.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import javax.crypto.SecretKey;

/**
 * Issues and verifies HMAC-signed compact tokens ({@code header.payload.signature}, each segment
 * base64url).
 *
 * <p>Payload keys: {@code sub}, {@code tenant_id}, {@code email}, {@code roles}, {@code iat},
 * {@code exp}, plus any extension claims. Timestamps have second precision. Signature comparison
 * is constant-time inside JJWT. Verification checks the signature before the expiry, and pins the
 * header algorithm to the configured one.
 *
 * <p>Stateless and thread-safe: output depends only on the inputs, the clock and the configured
 * key.
 */
public final class TokenCodec implements TokenVerifier {

    public static final String CLAIM_SUBJECT = "sub";
    public static final String CLAIM_TENANT_ID = "tenant_id";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_ISSUED_AT = "iat";
    public static final String CLAIM_EXPIRES_AT = "exp";

    private static final Duration MINIMUM_TTL = Duration.ofSeconds(1);

    private final MacAlgorithm algorithm;
    private final SecretKey key;
    private final Duration defaultTtl;
    private final Clock clock;
    private final JwtParser parser;

    public TokenCodec(TokenSigningConfig config) {
        this(config, Clock.systemUTC());
    }

    public TokenCodec(TokenSigningConfig config, Clock clock) {
        this.algorithm = macAlgorithm(config.algorithm());
        this.key = Keys.hmacShaKeyFor(config.keyBytes());
        this.defaultTtl = config.defaultTtl();
        this.clock = clock;
        this.parser =
                Jwts.parser()
                        .verifyWith(key)
                        .clock(() -> Date.from(clock.instant()))
                        .build();
    }

    /** Issues a token with the configured default TTL. */
    public String issue(TokenClaims claims) {
        return issue(claims, defaultTtl);
    }

    /**
     * Stamps {@code iat = now} and {@code exp = now + ttl}, then signs the claim set.
     *
     * @throws AuthException {@link AuthErrorCode#INTERNAL_ERROR} if the TTL is below one second or
     *     the claims are invalid
     */
    public String issue(TokenClaims claims, Duration ttl) {
        if (ttl == null || ttl.compareTo(MINIMUM_TTL) < 0) {
            throw new AuthException(
                    AuthErrorCode.INTERNAL_ERROR, "Token TTL must be at least one second: " + ttl);
        }
        SecurityValidationResult validation = ClaimSetValidator.validate(claims);
        if (!validation.valid()) {
            throw new AuthException(
                    AuthErrorCode.INTERNAL_ERROR, "Refusing to issue token: " + validation.describe());
        }

        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl).truncatedTo(ChronoUnit.SECONDS);

        return Jwts.builder()
                .header()
                .type("JWT")
                .and()
                .claims(claims.extensions())
                .subject(claims.subject())
                .claim(CLAIM_TENANT_ID, claims.tenantId())
                .claim(CLAIM_EMAIL, claims.email())
                .claim(CLAIM_ROLES, new ArrayList<>(new TreeSet<>(claims.roles())))
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(key, algorithm)
                .compact();
    }

    /** Lifetime applied by {@link #issue(TokenClaims)}. */
    public Duration defaultTtl() {
        return defaultTtl;
    }

    @Override
    public VerifiedToken verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthErrorCode.MALFORMED, "Token is empty");
        }

        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorCode.EXPIRED, "Token expired", e);
        } catch (io.jsonwebtoken.security.SecurityException e) {
            throw new AuthException(
                    AuthErrorCode.INVALID_SIGNATURE, "Token signature verification failed", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.MALFORMED, "Token could not be parsed", e);
        }

        String headerAlgorithm = jws.getHeader().getAlgorithm();
        if (!algorithm.getId().equals(headerAlgorithm)) {
            throw new AuthException(
                    AuthErrorCode.INVALID_SIGNATURE,
                    "Token signed with %s, expected %s".formatted(headerAlgorithm, algorithm.getId()));
        }

        return decode(jws.getPayload());
    }

    private VerifiedToken decode(Claims payload) {
        try {
            String subject = payload.getSubject();
            String tenantId = payload.get(CLAIM_TENANT_ID, String.class);
            String email = payload.get(CLAIM_EMAIL, String.class);
            Date issuedAt = payload.getIssuedAt();
            Date expiresAt = payload.getExpiration();
            if (subject == null || tenantId == null || email == null
                    || issuedAt == null || expiresAt == null) {
                throw new AuthException(AuthErrorCode.MALFORMED, "Token is missing required claims");
            }

            Map<String, Object> extensions = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : payload.entrySet()) {
                if (!ClaimSetValidator.RESERVED_CLAIMS.contains(entry.getKey())
                        && entry.getValue() != null) {
                    extensions.put(entry.getKey(), entry.getValue());
                }
            }

            var claims = new TokenClaims(subject, tenantId, email, readRoles(payload), extensions);
            return new VerifiedToken(claims, issuedAt.toInstant(), expiresAt.toInstant());
        } catch (JwtException e) {
            throw new AuthException(AuthErrorCode.MALFORMED, "Token claims have unexpected types", e);
        }
    }

    private static Set<String> readRoles(Claims payload) {
        Object raw = payload.get(CLAIM_ROLES);
        if (!(raw instanceof Collection<?> values)) {
            throw new AuthException(AuthErrorCode.MALFORMED, "Token roles claim is not a list");
        }
        Set<String> roles = new HashSet<>();
        for (Object value : values) {
            if (!(value instanceof String role)) {
                throw new AuthException(AuthErrorCode.MALFORMED, "Token roles claim holds a non-string");
            }
            roles.add(role);
        }
        return roles;
    }

    private static MacAlgorithm macAlgorithm(String name) {
        return switch (name) {
            case "HS256" -> Jwts.SIG.HS256;
            case "HS384" -> Jwts.SIG.HS384;
            case "HS512" -> Jwts.SIG.HS512;
            default -> throw new IllegalArgumentException("Unsupported token algorithm: " + name);
        };
    }
}
