package com.orgauth.authservice.infrastructure.web;

import com.orgauth.observability.RequestCorrelationHolder;
import com.orgauth.security.FailureCategory;
import java.net.URI;
import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * RFC 7807 bodies for failure categories.
 *
 * <p>Clients see only the category: its status, a fixed title and a fixed detail. Error codes
 * and exception messages stay in the logs. Every body carries a timestamp and the request id.
 */
public final class Problems {

    static final String TYPE_BASE = "https://orgauth.dev/errors/";

    private Problems() {
        // utility class
    }

    public static HttpStatus status(FailureCategory category) {
        return switch (category) {
            case UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case LOGIN_REJECTED -> HttpStatus.BAD_REQUEST;
            case UPSTREAM_FAILURE -> HttpStatus.BAD_GATEWAY;
            case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public static ProblemDetail forCategory(FailureCategory category) {
        return switch (category) {
            case UNAUTHENTICATED -> build(category, "unauthorized", "Unauthorized",
                    "Authentication is required to access this resource");
            case FORBIDDEN -> build(category, "forbidden", "Forbidden",
                    "You do not have permission to access this resource");
            case LOGIN_REJECTED -> build(category, "login-failed", "Login Failed",
                    "The login could not be completed. Please start again");
            case UPSTREAM_FAILURE -> build(category, "upstream", "Bad Gateway",
                    "The identity provider could not be reached");
            case UNAVAILABLE -> build(category, "unavailable", "Service Unavailable",
                    "The service is temporarily unavailable");
            case INTERNAL -> build(category, "internal", "Internal Server Error",
                    "An unexpected error occurred");
        };
    }

    /** Body for a client that exceeded its request allowance. */
    public static ProblemDetail tooManyRequests() {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please wait before trying again");
        problem.setTitle("Too Many Requests");
        problem.setType(URI.create(TYPE_BASE + "rate-limited"));
        return enrich(problem);
    }

    /** Adds timestamp and request id to a problem built elsewhere. */
    public static ProblemDetail enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        RequestCorrelationHolder.get()
                .ifPresent(correlation -> problem.setProperty("requestId", correlation.requestId()));
        return problem;
    }

    private static ProblemDetail build(FailureCategory category, String slug, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status(category), detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + slug));
        return enrich(problem);
    }
}
