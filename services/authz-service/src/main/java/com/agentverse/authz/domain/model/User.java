package com.agentverse.authz.domain.model;

import java.time.Instant;

/**
 * Local profile of an identity-provider subject, synced from claims. Holds no role data.
 */
public record User(
        String id,
        String displayName,
        String email,
        Instant createdAt,
        Instant updatedAt
) {

    /** A placeholder profile for a subject that was referenced before it ever signed in. */
    public static User stub(String id, Instant now) {
        return new User(id, "", "", now, now);
    }
}
