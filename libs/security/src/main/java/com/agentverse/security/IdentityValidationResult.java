package com.agentverse.security;

import java.util.List;

/**
 * Result of validating a {@link CallerIdentity}.
 *
 * @param valid  whether the identity passed all checks
 * @param errors validation error messages (empty if valid)
 */
public record IdentityValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static IdentityValidationResult ok() {
        return new IdentityValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static IdentityValidationResult fail(List<String> errors) {
        return new IdentityValidationResult(false, List.copyOf(errors));
    }
}
