package com.agentverse.security;

import java.util.Set;

/**
 * Trusted identity of the caller for one request, built from claims that were verified
 * upstream.
 * <p>
 * Nothing here is persisted. In particular {@code superadmin} is recomputed from the
 * claims of every request and must never be cached.
 *
 * @param subjectId   identity-provider subject (object id) of the caller
 * @param displayName human-readable name from the {@code name} claim
 * @param email       email or preferred username
 * @param roles       every role claim carried by the token
 * @param superadmin  whether the configured superadmin role claim is present
 */
public record CallerIdentity(
        String subjectId,
        String displayName,
        String email,
        Set<String> roles,
        boolean superadmin
) {

    public CallerIdentity {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }
}
