package com.docgate.security;

import java.util.List;

/**
 * Result of {@link ClaimsValidator#validate(Claims)}.
 *
 * @param valid  whether the claims passed every check
 * @param errors messages for each failed check (empty if valid)
 */
public record ClaimsValidationResult(boolean valid, List<String> errors) {

    public static ClaimsValidationResult ok() {
        return new ClaimsValidationResult(true, List.of());
    }

    public static ClaimsValidationResult fail(List<String> errors) {
        return new ClaimsValidationResult(false, List.copyOf(errors));
    }
}
