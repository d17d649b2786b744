package com.orgauth.authservice.infrastructure.web;

import com.orgauth.security.RoleChecker;
import com.orgauth.security.RouteRolePolicy;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import java.util.Set;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Checks the {@link RouteRolePolicy} table before a handler runs. Routes without a matching rule
 * pass through; routes with one require an authenticated identity holding one of its roles.
 *
 * <p>Rules are matched against {@link RequestPaths#lookupPath}, the path the handler was
 * selected by.
 */
public class RouteAuthorizationInterceptor implements HandlerInterceptor {

    private final RouteRolePolicy policy;
    private final RoleChecker roleChecker;

    public RouteAuthorizationInterceptor(RouteRolePolicy policy, RoleChecker roleChecker) {
        this.policy = policy;
        this.roleChecker = roleChecker;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String path = RequestPaths.lookupPath(request);
        Optional<Set<String>> required = policy.requiredRoles(request.getMethod(), path);
        if (required.isPresent()) {
            var identity = IdentityContextArgumentResolver.current(new ServletRequestAttributes(request));
            roleChecker.authorize(identity, required.get());
        }
        return true;
    }
}
