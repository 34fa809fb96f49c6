package com.agentverse.authz.domain.authorization;

import com.agentverse.security.EffectiveRole;

/**
 * Outcome of one authorization check.
 *
 * @param allowed    whether the action is permitted
 * @param role       role the subject resolved to in the deciding group
 * @param superadmin whether the decision came from the superadmin claim
 * @param groupId    group the decision was scoped to (null for superadmin or unresolved)
 * @param reason     short explanation, for logs and denial messages
 */
public record Decision(
        boolean allowed,
        EffectiveRole role,
        boolean superadmin,
        String groupId,
        String reason
) {

    public static Decision allow(EffectiveRole role, String groupId) {
        return new Decision(true, role, false, groupId, "granted by " + role.value() + " role");
    }

    public static Decision allowSuperadmin() {
        return new Decision(true, EffectiveRole.ADMIN, true, null, "superadmin");
    }

    public static Decision deny(String reason) {
        return new Decision(false, EffectiveRole.NONE, false, null, reason);
    }

    public static Decision deny(EffectiveRole role, String groupId, String reason) {
        return new Decision(false, role, false, groupId, reason);
    }

    /** Lower-case outcome, used as a metric tag. */
    public String outcome() {
        return allowed ? "allow" : "deny";
    }
}
