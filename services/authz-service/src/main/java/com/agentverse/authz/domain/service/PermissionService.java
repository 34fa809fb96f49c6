package com.agentverse.authz.domain.service;

import com.agentverse.authz.domain.authorization.AuthorizationEngine;
import com.agentverse.authz.domain.authorization.Decision;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.EffectiveRole;

/**
 * Permission queries exposed to other platform services.
 */
public class PermissionService {

    private final AuthorizationEngine engine;

    public PermissionService(AuthorizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Whether the user may perform the action on the agent.
     *
     * @throws IllegalArgumentException if the action is unknown
     */
    public Decision check(CallerIdentity caller, String userId, String agentId, String action) {
        Action parsed = Action.fromString(action)
                .orElseThrow(() -> new IllegalArgumentException("Unknown action: " + action));
        return engine.checkPermission(caller, userId, parsed, agentId);
    }

    public EffectiveRole roleInGroup(CallerIdentity caller, String groupId) {
        return engine.effectiveRole(caller, groupId);
    }
}
