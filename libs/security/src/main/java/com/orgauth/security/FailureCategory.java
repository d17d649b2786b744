package com.orgauth.security;

/**
 * Caller-visible class of an authentication or authorization failure.
 *
 * <p>Every {@link AuthErrorCode} belongs to exactly one category. Transport layers map categories,
 * never individual codes, onto their response shape so that the precise reason stays in the logs.
 */
public enum FailureCategory {

    /** The caller is not authenticated (HTTP 401). */
    UNAUTHENTICATED,

    /** The caller is authenticated but lacks a required role (HTTP 403). */
    FORBIDDEN,

    /** A login attempt was refused; all reasons look identical to the client (HTTP 400). */
    LOGIN_REJECTED,

    /** The external identity provider could not be reached or answered badly (HTTP 502). */
    UPSTREAM_FAILURE,

    /** The identity store is unavailable (HTTP 503). */
    UNAVAILABLE,

    /** Misconfiguration or a broken invariant inside the service (HTTP 500). */
    INTERNAL
}
