package com.agentverse.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Role a subject holds inside a single group, as stored on a membership row.
 * <p>
 * ADMIN implies USER. Superadmin is not a group role: it comes from identity claims
 * and is never stored (see {@link CallerIdentity#superadmin()}).
 */
public enum GroupRole {

    USER("user"),
    ADMIN("admin");

    private final String value;

    GroupRole(String value) {
        this.value = value;
    }

    /** The canonical wire value ("user" or "admin"). */
    public String value() {
        return value;
    }

    /**
     * Checks whether this role satisfies the given requirement, directly or through
     * the hierarchy.
     */
    public boolean implies(GroupRole required) {
        return this == required || (this == ADMIN && required == USER);
    }

    /** The effective role a member holding this role resolves to. */
    public EffectiveRole effective() {
        return this == ADMIN ? EffectiveRole.ADMIN : EffectiveRole.USER;
    }

    /**
     * Looks up a role by its wire value, case-insensitive.
     *
     * @param value the string to match
     * @return the matching role, or empty if not found
     */
    public static Optional<GroupRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (GroupRole role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
