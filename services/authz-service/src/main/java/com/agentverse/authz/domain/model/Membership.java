package com.agentverse.authz.domain.model;

import com.agentverse.security.GroupRole;

import java.time.Instant;

/**
 * Role of one subject in one group. At most one membership exists per (subject, group).
 */
public record Membership(
        String subjectId,
        String groupId,
        GroupRole role,
        Instant createdAt
) {

    public boolean isAdmin() {
        return role == GroupRole.ADMIN;
    }

    public Membership withRole(GroupRole newRole) {
        return new Membership(subjectId, groupId, newRole, createdAt);
    }
}
