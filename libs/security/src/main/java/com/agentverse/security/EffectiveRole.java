package com.agentverse.security;

import java.util.Locale;

/**
 * Role a subject resolves to with respect to one group: no membership, a user
 * membership or an admin membership.
 * <p>
 * Superadmins resolve to {@link #ADMIN} for every group without a membership row.
 */
public enum EffectiveRole {

    NONE,
    USER,
    ADMIN;

    /**
     * Checks whether this effective role meets the minimum role an action requires.
     * {@link #NONE} never satisfies anything.
     */
    public boolean satisfies(GroupRole required) {
        return switch (this) {
            case NONE -> false;
            case USER -> required == GroupRole.USER;
            case ADMIN -> true;
        };
    }

    /** Lower-case wire value, e.g. "admin". */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
