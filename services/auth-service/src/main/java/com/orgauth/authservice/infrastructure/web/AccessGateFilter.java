package com.orgauth.authservice.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgauth.observability.RequestCorrelationHolder;
import com.orgauth.security.AccessDecision;
import com.orgauth.security.AccessGate;
import com.orgauth.security.FailureCategory;
import com.orgauth.security.IdentityContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet adapter for {@link AccessGate}.
 *
 * <p>Authenticated requests continue with the {@link IdentityContext} stored under
 * {@link #IDENTITY_ATTRIBUTE}. Rejected requests end here with a generic 401 problem body; the
 * rejection reason has already been reported by the gate. CORS preflight requests carry no
 * credentials and are left to the CORS handling.
 */
public class AccessGateFilter extends OncePerRequestFilter {

    public static final String IDENTITY_ATTRIBUTE = AccessGateFilter.class.getName() + ".IDENTITY";

    private final AccessGate accessGate;
    private final ObjectMapper objectMapper;

    public AccessGateFilter(AccessGate accessGate, ObjectMapper objectMapper) {
        this.accessGate = accessGate;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return CorsUtils.isPreFlightRequest(request);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = RequestPaths.lookupPath(request);
        AccessDecision decision =
                accessGate.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION), path);

        switch (decision.outcome()) {
            case EXEMPT -> filterChain.doFilter(request, response);
            case AUTHENTICATED -> {
                IdentityContext identity = decision.identity();
                request.setAttribute(IDENTITY_ATTRIBUTE, identity);
                RequestCorrelationHolder.attachIdentity(identity.userId(), identity.tenantId());
                filterChain.doFilter(request, response);
            }
            case REJECTED -> writeUnauthorized(response);
        }
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        ProblemDetail problem = Problems.forCategory(FailureCategory.UNAUTHENTICATED);
        response.setStatus(problem.getStatus());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
