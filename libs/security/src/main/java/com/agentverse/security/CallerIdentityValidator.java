package com.agentverse.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates that a {@link CallerIdentity} is well formed enough to make decisions on.
 * <p>
 * Returns all errors at once. Callers on the authorization path treat any error as a
 * denial.
 */
public final class CallerIdentityValidator {

    private CallerIdentityValidator() {
        // utility class
    }

    /**
     * Validates the identity.
     *
     * @param identity the identity to validate (may be null)
     * @return a result listing every problem found
     */
    public static IdentityValidationResult validate(CallerIdentity identity) {
        if (identity == null) {
            return IdentityValidationResult.fail(List.of("identity must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (isBlank(identity.subjectId())) {
            errors.add("subjectId must not be null or blank");
        } else if (!identity.subjectId().equals(identity.subjectId().strip())) {
            errors.add("subjectId must not have surrounding whitespace");
        }

        return errors.isEmpty() ? IdentityValidationResult.ok() : IdentityValidationResult.fail(errors);
    }

    /** Shorthand for {@code validate(identity).valid()}. */
    public static boolean isValid(CallerIdentity identity) {
        return validate(identity).valid();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
