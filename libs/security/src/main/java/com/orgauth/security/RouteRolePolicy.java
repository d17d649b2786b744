package com.orgauth.security;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative table of per-route role requirements, checked by a single generic dispatcher.
 *
 * <p>Rules are evaluated in declaration order and the first match wins. A route without a
 * matching rule requires no particular role.
 */
public final class RouteRolePolicy {

    /**
     * @param method HTTP method, or null for any method
     * @param path path pattern
     * @param requiredRoles roles of which the caller needs at least one
     */
    public record RouteRule(String method, PathPattern path, Set<String> requiredRoles) {

        public RouteRule {
            method = method == null || method.isBlank() ? null : method.toUpperCase(Locale.ROOT);
            if (path == null) {
                throw new IllegalArgumentException("path must not be null");
            }
            requiredRoles = requiredRoles == null ? Set.of() : Set.copyOf(requiredRoles);
        }

        boolean matches(String requestMethod, String requestPath) {
            boolean methodMatches =
                    method == null || (requestMethod != null && method.equalsIgnoreCase(requestMethod));
            return methodMatches && path.matches(requestPath);
        }
    }

    private final List<RouteRule> rules;

    public RouteRolePolicy(List<RouteRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RouteRolePolicy empty() {
        return new RouteRolePolicy(List.of());
    }

    /** Required roles of the first matching rule, or empty when no rule matches. */
    public Optional<Set<String>> requiredRoles(String method, String path) {
        return rules.stream()
                .filter(rule -> rule.matches(method, path))
                .findFirst()
                .map(RouteRule::requiredRoles);
    }

    public List<RouteRule> rules() {
        return rules;
    }
}
