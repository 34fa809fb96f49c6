package com.agentverse.authz.domain.service;

import com.agentverse.authz.domain.authorization.AuthorizationEngine;
import com.agentverse.authz.domain.authorization.Decision;
import com.agentverse.authz.domain.authorization.ResourceRef;
import com.agentverse.authz.domain.error.AccessDeniedException;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.RoleChecker;

/** Turns engine denials into {@link AccessDeniedException} for the service layer. */
final class Authorizations {

    private Authorizations() {
        // utility class
    }

    static Decision requireGroupAction(AuthorizationEngine engine, CallerIdentity caller, Action action, String groupId) {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId must not be blank");
        }
        Decision decision = engine.authorize(caller, action, ResourceRef.group(groupId));
        if (!decision.allowed()) {
            throw new AccessDeniedException("Not allowed to " + action.value() + " in group " + groupId);
        }
        return decision;
    }

    static void requireSuperadmin(CallerIdentity caller) {
        if (!RoleChecker.isSuperadmin(caller)) {
            throw new AccessDeniedException("Superadmin role required");
        }
    }
}
