package com.orgauth.authservice.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgauth.authservice.infrastructure.ratelimit.ClientRateLimiter;
import com.orgauth.security.SecurityEvent;
import com.orgauth.security.SecurityEventSink;
import com.orgauth.security.SecurityEventType;
import com.orgauth.security.SecurityEvents;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Limits how often one client address may hit the login routes.
 *
 * <p>Allowances are counted separately for each route. A client over its allowance gets a 429
 * problem body with a {@code Retry-After} header and the request goes no further.
 */
public class LoginRateLimitFilter extends OncePerRequestFilter {

    static final Set<String> LIMITED_PATHS = Set.of("/auth/login", "/auth/callback");

    private final ClientRateLimiter limiter;
    private final SecurityEventSink events;
    private final ObjectMapper objectMapper;

    public LoginRateLimitFilter(ClientRateLimiter limiter, SecurityEventSink events, ObjectMapper objectMapper) {
        this.limiter = limiter;
        this.events = events;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return CorsUtils.isPreFlightRequest(request) || !LIMITED_PATHS.contains(RequestPaths.lookupPath(request));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = RequestPaths.lookupPath(request);
        String client = request.getRemoteAddr();
        if (limiter.tryAcquire(path + "|" + client)) {
            filterChain.doFilter(request, response);
            return;
        }

        SecurityEvents.emit(
                events, SecurityEvent.of(SecurityEventType.RATE_LIMITED, "path", path, "clientAddress", client));
        ProblemDetail problem = Problems.tooManyRequests();
        response.setStatus(problem.getStatus());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(limiter.retryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
