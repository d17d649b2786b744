package com.orgauth.authservice.domain.identity;

/** Configurable tenant resolution strategies. */
public enum TenantPolicyType {
    PER_SIGNUP,
    EMAIL_DOMAIN,
    SINGLE;

    public TenantResolutionPolicy create(String fixedTenantKey) {
        return switch (this) {
            case PER_SIGNUP -> new PerSignupTenantPolicy();
            case EMAIL_DOMAIN -> new EmailDomainTenantPolicy();
            case SINGLE -> new SingleTenantPolicy(fixedTenantKey);
        };
    }
}
