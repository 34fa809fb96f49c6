package com.agentverse.authz.domain.policy;

import java.util.Locale;
import java.util.Optional;

/**
 * Actions a caller can request on a group or agent. The minimum role each one needs
 * comes from {@link ActionPolicy}, not from this enum.
 */
public enum Action {

    VIEW_GROUP("view-group"),
    READ_AGENT_VISIBILITY("read-agent-visibility"),
    ACCESS_AGENT("access-agent"),
    CREATE_AGENT("create-agent"),
    LIST_MEMBERS("list-members"),
    MANAGE_MEMBERS("manage-members"),
    MANAGE_AGENTS("manage-agents"),
    UPDATE_GROUP("update-group"),
    DELETE_GROUP("delete-group");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    /** Kebab-case name used in configuration and on the wire. */
    public String value() {
        return value;
    }

    /**
     * Looks up an action by its kebab-case value or enum name, case-insensitive.
     * The platform's short forms {@code access} and {@code create} are accepted too.
     */
    public static Optional<Action> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT).replace('_', '-');
        if (normalized.equals("access")) {
            return Optional.of(ACCESS_AGENT);
        }
        if (normalized.equals("create")) {
            return Optional.of(CREATE_AGENT);
        }
        for (Action action : values()) {
            if (action.value.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
