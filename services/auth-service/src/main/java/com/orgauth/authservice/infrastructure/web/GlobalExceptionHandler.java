package com.orgauth.authservice.infrastructure.web;

import com.orgauth.security.AuthException;
import com.orgauth.security.FailureCategory;
import com.orgauth.security.SecurityEvent;
import com.orgauth.security.SecurityEventSink;
import com.orgauth.security.SecurityEventType;
import com.orgauth.security.SecurityEvents;
import com.orgauth.security.TenantMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>{@link AuthException}s are mapped by {@link FailureCategory} only, so every login rejection
 * (state mismatch, incomplete identity, identity conflict) produces the same body. The error code
 * is logged, never returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final SecurityEventSink events;

    public GlobalExceptionHandler(SecurityEventSink events) {
        this.events = events;
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemDetail> handleAuth(AuthException ex) {
        FailureCategory category = ex.category();
        switch (category) {
            case UNAUTHENTICATED, FORBIDDEN, LOGIN_REJECTED ->
                    log.info("Request refused: {} ({})", ex.code(), ex.getMessage());
            case UPSTREAM_FAILURE, UNAVAILABLE ->
                    log.warn("Dependency failure: {} ({})", ex.code(), ex.getMessage(), ex);
            case INTERNAL -> log.error("Internal failure: {}", ex.getMessage(), ex);
        }
        ResponseEntity.BodyBuilder response = ResponseEntity.status(Problems.status(category));
        if (category == FailureCategory.UNAUTHENTICATED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return response.body(Problems.forCategory(category));
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTenantMismatch(TenantMismatchException ex) {
        SecurityEvents.emit(
                events,
                SecurityEvent.of(
                        SecurityEventType.TENANT_MISMATCH,
                        "callerTenantId", ex.callerTenantId(),
                        "resourceTenantId", ex.resourceTenantId()));
        log.warn("Cross-tenant access refused: {}", ex.getMessage());
        return ResponseEntity.status(Problems.status(FailureCategory.FORBIDDEN))
                .body(Problems.forCategory(FailureCategory.FORBIDDEN));
    }

    /** Framework errors (404, 405, bad parameters) keep their own status; anything else is a 500. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse error) {
            log.debug("Request failed: {}", ex.getMessage());
            return ResponseEntity.status(error.getStatusCode())
                    .headers(error.getHeaders())
                    .body(Problems.enrich(error.getBody()));
        }
        log.error("Internal server error", ex);
        return ResponseEntity.status(Problems.status(FailureCategory.INTERNAL))
                .body(Problems.forCategory(FailureCategory.INTERNAL));
    }
}
