package com.agentverse.authz.domain.model;

/**
 * A group with its member count, for superadmin listings.
 */
public record GroupSummary(Group group, int memberCount) {
}
