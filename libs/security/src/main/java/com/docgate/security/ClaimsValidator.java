package com.docgate.security;

import com.docgate.model.DocumentKind;
import com.docgate.model.IdentifierMapper;
import com.docgate.model.error.MalformedIdentifierException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that verified claims carry what the gateway needs before any document is touched.
 * Returns every problem at once.
 */
public final class ClaimsValidator {

    private ClaimsValidator() {
        // utility class
    }

    public static ClaimsValidationResult validate(Claims claims) {
        List<String> errors = new ArrayList<>();
        if (claims.issuer() == null || claims.issuer().isBlank()) {
            errors.add("issuer must not be null or blank");
        }
        if (claims.tenantHint() != null) {
            try {
                IdentifierMapper.externalToInternal(DocumentKind.TENANT, claims.tenantHint());
            } catch (MalformedIdentifierException e) {
                errors.add("tenantHint is not a tenant id: " + claims.tenantHint());
            }
        }
        if (claims.email() != null && !claims.email().contains("@")) {
            errors.add("email is not an address: " + claims.email());
        }
        return errors.isEmpty() ? ClaimsValidationResult.ok() : ClaimsValidationResult.fail(errors);
    }
}
