package com.agentverse.authz.domain.cache;

import com.agentverse.security.EffectiveRole;

import java.util.List;

/**
 * Cached answer of a permission check. Derived from memberships and links only; never
 * a source of truth.
 *
 * @param role        resolved role (ROLE and AGENT_ACTION checks)
 * @param allowed     decision (AGENT_ACTION checks), null otherwise
 * @param groupId     deciding group (AGENT_ACTION checks), null otherwise
 * @param resourceIds ids of agents or groups (aggregate checks), empty otherwise
 */
public record PermissionValue(
        EffectiveRole role,
        Boolean allowed,
        String groupId,
        List<String> resourceIds
) {

    public PermissionValue {
        resourceIds = resourceIds == null ? List.of() : List.copyOf(resourceIds);
    }

    public static PermissionValue ofRole(EffectiveRole role) {
        return new PermissionValue(role, null, null, List.of());
    }

    public static PermissionValue ofDecision(boolean allowed, EffectiveRole role, String groupId) {
        return new PermissionValue(role, allowed, groupId, List.of());
    }

    public static PermissionValue ofIds(List<String> ids) {
        return new PermissionValue(null, null, null, ids);
    }
}
