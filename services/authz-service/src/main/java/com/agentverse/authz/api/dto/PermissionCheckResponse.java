package com.agentverse.authz.api.dto;

import com.agentverse.authz.domain.authorization.Decision;

/**
 * Answer to "may user X perform action on agent Y".
 *
 * @param role role the user resolved to in the deciding group, {@code none} when denied
 * @param groupId deciding group; null for superadmins and denials without a group
 */
public record PermissionCheckResponse(boolean allowed, String role, boolean superadmin, String groupId,
                                      String reason) {

    public static PermissionCheckResponse from(Decision decision) {
        return new PermissionCheckResponse(decision.allowed(), decision.role().value(), decision.superadmin(),
                decision.groupId(), decision.reason());
    }
}
