package com.agentverse.authz.domain.model;

import java.time.Instant;

/**
 * A tenant group. Owns memberships and references agents through {@link GroupAgent} links.
 */
public record Group(
        String id,
        String name,
        String description,
        Instant createdAt,
        Instant updatedAt
) {

    /** Returns a copy with the given name/description applied; null leaves a field unchanged. */
    public Group withChanges(String newName, String newDescription, Instant now) {
        return new Group(
                id,
                newName != null ? newName : name,
                newDescription != null ? newDescription : description,
                createdAt,
                now);
    }
}
