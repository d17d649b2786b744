package com.orgauth.authservice.infrastructure.web;

import com.orgauth.observability.RequestCorrelation;
import com.orgauth.observability.RequestCorrelationHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Establishes the request id for every HTTP request.
 *
 * <p>A well-formed incoming {@value #REQUEST_ID_HEADER} is kept, anything else is replaced by a
 * random UUID. The id goes into the MDC for the duration of the request and is echoed in the
 * response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || !ACCEPTED_ID.matcher(requestId).matches()) {
            requestId = UUID.randomUUID().toString();
        }

        RequestCorrelationHolder.set(RequestCorrelation.forRequest(requestId));
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestCorrelationHolder.clear();
        }
    }
}
