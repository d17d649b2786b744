package com.orgauth.security;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks a {@link TokenClaims} before issuance and reports every problem at once.
 */
public final class ClaimSetValidator {

    /** Claim names written by the codec itself; extensions may not use them. */
    public static final Set<String> RESERVED_CLAIMS =
            Set.of(
                    TokenCodec.CLAIM_SUBJECT,
                    TokenCodec.CLAIM_TENANT_ID,
                    TokenCodec.CLAIM_EMAIL,
                    TokenCodec.CLAIM_ROLES,
                    TokenCodec.CLAIM_ISSUED_AT,
                    TokenCodec.CLAIM_EXPIRES_AT);

    private ClaimSetValidator() {
        // utility class
    }

    public static SecurityValidationResult validate(TokenClaims claims) {
        if (claims == null) {
            return SecurityValidationResult.fail(List.of("claims must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(claims.subject())) {
            errors.add("subject must not be null or blank");
        }
        if (isBlank(claims.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (isBlank(claims.email())) {
            errors.add("email must not be null or blank");
        }
        if (claims.roles().stream().anyMatch(ClaimSetValidator::isBlank)) {
            errors.add("role names must not be blank");
        }
        for (String key : claims.extensions().keySet()) {
            if (RESERVED_CLAIMS.contains(key)) {
                errors.add("extension claim '" + key + "' collides with a reserved claim");
            }
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
