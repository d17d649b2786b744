package com.orgauth.security;

import java.util.List;

/**
 * Outcome of validating a claim set before it is signed.
 *
 * @param valid whether all checks passed
 * @param errors validation messages, empty when valid
 */
public record SecurityValidationResult(boolean valid, List<String> errors) {

    public static SecurityValidationResult ok() {
        return new SecurityValidationResult(true, List.of());
    }

    public static SecurityValidationResult fail(List<String> errors) {
        return new SecurityValidationResult(false, List.copyOf(errors));
    }

    /** Joins the error messages for log and exception text. */
    public String describe() {
        return String.join("; ", errors);
    }
}
