package com.orgauth.security;

/** Kinds of security-relevant events reported to a {@link SecurityEventSink}. */
public enum SecurityEventType {
    LOGIN_SUCCEEDED(false),
    LOGIN_FAILED(true),
    STATE_MISMATCH(true),
    IDENTITY_PROVISIONED(false),
    TOKEN_REJECTED(true),
    ACCESS_DENIED(true),
    TENANT_MISMATCH(true),
    RATE_LIMITED(true);

    private final boolean failure;

    SecurityEventType(boolean failure) {
        this.failure = failure;
    }

    /** True for events that record a refused or failed operation. */
    public boolean isFailure() {
        return failure;
    }
}
