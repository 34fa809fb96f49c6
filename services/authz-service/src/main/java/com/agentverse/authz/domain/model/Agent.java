package com.agentverse.authz.domain.model;

import java.time.Instant;

/**
 * A registered agent. Referenced, never owned, by groups.
 *
 * @param externalId opaque id of the agent on its owning platform, unique
 */
public record Agent(
        String id,
        String externalId,
        String name,
        String createdBy,
        Instant createdAt
) {
}
