package com.agentverse.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps an already verified claim set to a {@link CallerIdentity}.
 * <p>
 * Claim names follow Entra ID access tokens: {@code oid} (falling back to {@code sub})
 * for the subject, {@code name}, {@code email} (falling back to
 * {@code preferred_username}) and {@code roles}.
 */
public final class CallerIdentityMapper {

    public static final String CLAIM_OBJECT_ID = "oid";
    public static final String CLAIM_SUBJECT = "sub";
    public static final String CLAIM_NAME = "name";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_PREFERRED_USERNAME = "preferred_username";
    public static final String CLAIM_ROLES = "roles";

    private CallerIdentityMapper() {
        // utility class
    }

    /**
     * Builds the identity for one request.
     *
     * @param claims         verified claims (may be null, yields an identity that fails validation)
     * @param superadminRole role claim value that grants superadmin
     * @return the caller identity
     */
    public static CallerIdentity fromClaims(Map<String, ?> claims, String superadminRole) {
        if (claims == null) {
            return new CallerIdentity(null, null, null, Set.of(), false);
        }
        String subjectId = firstNonBlank(claims.get(CLAIM_OBJECT_ID), claims.get(CLAIM_SUBJECT));
        String email = firstNonBlank(claims.get(CLAIM_EMAIL), claims.get(CLAIM_PREFERRED_USERNAME));
        String name = firstNonBlank(claims.get(CLAIM_NAME));
        Set<String> roles = roles(claims.get(CLAIM_ROLES));
        boolean superadmin = superadminRole != null && roles.contains(superadminRole);
        return new CallerIdentity(subjectId, name, email, roles, superadmin);
    }

    /**
     * Parses a comma-separated role list, as forwarded in a single header.
     */
    public static Set<String> parseRoles(String commaSeparated) {
        Set<String> roles = new LinkedHashSet<>();
        if (commaSeparated == null) {
            return roles;
        }
        for (String part : commaSeparated.split(",")) {
            String role = part.strip();
            if (!role.isEmpty()) {
                roles.add(role);
            }
        }
        return roles;
    }

    private static Set<String> roles(Object claim) {
        Set<String> roles = new LinkedHashSet<>();
        if (claim instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null && !value.toString().isBlank()) {
                    roles.add(value.toString().strip());
                }
            }
        } else if (claim instanceof String value) {
            roles.addAll(parseRoles(value));
        }
        return roles;
    }

    private static String firstNonBlank(Object... candidates) {
        for (Object candidate : candidates) {
            if (candidate != null && !candidate.toString().isBlank()) {
                return candidate.toString().strip();
            }
        }
        return null;
    }
}
