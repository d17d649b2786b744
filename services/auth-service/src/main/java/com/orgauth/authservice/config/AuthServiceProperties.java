package com.orgauth.authservice.config;

import com.orgauth.authservice.domain.identity.TenantPolicyType;
import com.orgauth.security.PathPattern;
import com.orgauth.security.RouteRolePolicy;
import com.orgauth.security.TokenSigningConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the auth service, bound from {@code orgauth.auth.*}.
 *
 * <p>Binding fails, and the application does not start, when the signing secret is missing or
 * shorter than the algorithm requires.
 *
 * <pre>
 * orgauth:
 *   auth:
 *     token:
 *       secret: ${ORGAUTH_TOKEN_SECRET}
 *       ttl: 7d
 *     tenancy:
 *       policy: EMAIL_DOMAIN
 *     route-roles:
 *       - path: /secure/tenants/&#42;/users
 *         roles: [owner]
 * </pre>
 *
 * @param token signing settings
 * @param exemptPaths path patterns that bypass the access gate
 * @param loginStateTtl how long a started login stays valid
 * @param loginStateMaxEntries upper bound on pending login attempts held in memory
 * @param loginCookieSecure whether the login-attempt cookie is marked Secure
 * @param tenancy tenant resolution and role names
 * @param storage identity store backend
 * @param routeRoles per-route role requirements, first match wins
 * @param rateLimit per-client limit on the login routes
 */
@ConfigurationProperties(prefix = "orgauth.auth")
@Validated
public record AuthServiceProperties(
        @Valid @NotNull Token token,
        List<String> exemptPaths,
        Duration loginStateTtl,
        long loginStateMaxEntries,
        boolean loginCookieSecure,
        @Valid Tenancy tenancy,
        StorageType storage,
        @Valid List<RouteRole> routeRoles,
        @Valid RateLimit rateLimit) {

    public static final List<String> DEFAULT_EXEMPT_PATHS = List.of(
            "/auth/login",
            "/auth/callback",
            "/actuator/health/**",
            "/actuator/info",
            "/actuator/prometheus",
            "/favicon.ico",
            "/error");

    public enum StorageType {
        JDBC,
        MEMORY
    }

    public AuthServiceProperties {
        if (exemptPaths == null || exemptPaths.isEmpty()) {
            exemptPaths = DEFAULT_EXEMPT_PATHS;
        }
        exemptPaths.forEach(PathPattern::of);
        if (loginStateTtl == null || loginStateTtl.isZero() || loginStateTtl.isNegative()) {
            loginStateTtl = Duration.ofMinutes(10);
        }
        if (loginStateMaxEntries <= 0) {
            loginStateMaxEntries = 100_000;
        }
        if (tenancy == null) {
            tenancy = new Tenancy(null, null, null, null);
        }
        if (storage == null) {
            storage = StorageType.JDBC;
        }
        if (routeRoles == null) {
            routeRoles = List.of();
        }
        if (rateLimit == null) {
            rateLimit = new RateLimit(null, 0, null, 0);
        }
    }

    public RouteRolePolicy routeRolePolicy() {
        return new RouteRolePolicy(routeRoles.stream().map(RouteRole::toRule).toList());
    }

    /**
     * @param secret shared HMAC secret, at least 32 bytes. Required.
     * @param algorithm HS256 (default), HS384 or HS512
     * @param ttl token lifetime, default 7 days
     */
    public record Token(@NotBlank String secret, String algorithm, Duration ttl) {

        public Token {
            if (algorithm == null || algorithm.isBlank()) {
                algorithm = "HS256";
            }
            if (ttl == null) {
                ttl = Duration.ofDays(7);
            }
            if (secret == null || secret.isBlank()) {
                throw new IllegalArgumentException("orgauth.auth.token.secret must be set");
            }
            new TokenSigningConfig(algorithm, secret, ttl);
        }

        public TokenSigningConfig toSigningConfig() {
            return new TokenSigningConfig(algorithm, secret, ttl);
        }

        @Override
        public String toString() {
            return "Token[algorithm=%s, secret=[REDACTED], ttl=%s]".formatted(algorithm, ttl);
        }
    }

    /**
     * @param policy how first-time users are placed into tenants, default PER_SIGNUP
     * @param fixedTenantKey tenant key used by the SINGLE policy
     * @param ownerRole role of a tenant's founding user, default {@code owner}
     * @param memberRole role of users joining an existing tenant, default {@code member}
     */
    public record Tenancy(
            TenantPolicyType policy, String fixedTenantKey, String ownerRole, String memberRole) {

        public Tenancy {
            if (policy == null) {
                policy = TenantPolicyType.PER_SIGNUP;
            }
            if (ownerRole == null || ownerRole.isBlank()) {
                ownerRole = "owner";
            }
            if (memberRole == null || memberRole.isBlank()) {
                memberRole = "member";
            }
            if (policy == TenantPolicyType.SINGLE && (fixedTenantKey == null || fixedTenantKey.isBlank())) {
                throw new IllegalArgumentException(
                        "orgauth.auth.tenancy.fixed-tenant-key is required for SINGLE tenancy");
            }
        }
    }

    /**
     * @param method HTTP method, or empty for all
     * @param path path pattern
     * @param roles roles of which the caller needs at least one
     */
    public record RouteRole(String method, @NotBlank String path, List<String> roles) {

        RouteRolePolicy.RouteRule toRule() {
            return new RouteRolePolicy.RouteRule(
                    method, PathPattern.of(path), roles == null ? Set.of() : Set.copyOf(roles));
        }
    }

    /**
     * Limit on {@code /auth/login} and {@code /auth/callback}, counted per route and client address.
     *
     * @param enabled default true
     * @param requestsPerPeriod requests a client may make per period, default 10
     * @param period refresh period of the allowance, default one minute
     * @param maxTrackedClients upper bound on client addresses tracked at once, default 100000
     */
    public record RateLimit(Boolean enabled, int requestsPerPeriod, Duration period, long maxTrackedClients) {

        public RateLimit {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (requestsPerPeriod <= 0) {
                requestsPerPeriod = 10;
            }
            if (period == null || period.isZero() || period.isNegative()) {
                period = Duration.ofMinutes(1);
            }
            if (maxTrackedClients <= 0) {
                maxTrackedClients = 100_000;
            }
        }
    }
}
