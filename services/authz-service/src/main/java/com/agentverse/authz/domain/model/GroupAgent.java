package com.agentverse.authz.domain.model;

import java.time.Instant;

/**
 * Link between a group and an agent. At most one link exists per (group, agent).
 */
public record GroupAgent(
        String groupId,
        String agentId,
        String addedBy,
        Instant createdAt
) {
}
