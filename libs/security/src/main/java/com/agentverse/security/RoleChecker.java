package com.agentverse.security;

/**
 * Role checks over a {@link CallerIdentity} and resolved group roles.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * True iff the caller carries the superadmin claim. A null identity is never a
     * superadmin.
     */
    public static boolean isSuperadmin(CallerIdentity identity) {
        return identity != null && identity.superadmin();
    }

    /**
     * Checks whether a resolved role meets the required minimum role.
     * <p>
     * Example: an {@link EffectiveRole#ADMIN} satisfies a {@link GroupRole#USER}
     * requirement, {@link EffectiveRole#NONE} satisfies nothing.
     */
    public static boolean hasRole(EffectiveRole actual, GroupRole required) {
        return actual != null && required != null && actual.satisfies(required);
    }

    /**
     * Checks whether the resolved role meets ANY of the required roles.
     */
    public static boolean hasAnyRole(EffectiveRole actual, GroupRole... required) {
        for (GroupRole role : required) {
            if (hasRole(actual, role)) {
                return true;
            }
        }
        return false;
    }
}
