package com.agentverse.authz.domain.model;

import com.agentverse.security.GroupRole;

import java.time.Instant;

/**
 * A membership joined with the member's profile.
 */
public record MemberView(
        String subjectId,
        String displayName,
        String email,
        GroupRole role,
        Instant createdAt
) {
}
