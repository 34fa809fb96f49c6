package com.agentverse.authz.domain.policy;

import com.agentverse.security.GroupRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Table mapping each {@link Action} to the minimum group role it requires.
 * <p>
 * Built from configuration on top of {@link #defaults()}. An action missing from the
 * table has no requirement that can be met, and is denied for everyone but superadmins.
 */
public final class ActionPolicy {

    private final Map<Action, GroupRole> requirements;

    private ActionPolicy(Map<Action, GroupRole> requirements) {
        this.requirements = Collections.unmodifiableMap(new EnumMap<>(requirements));
    }

    /** Reads, listing and agent use need {@code user}; every write needs {@code admin}. */
    public static ActionPolicy defaults() {
        Map<Action, GroupRole> table = new EnumMap<>(Action.class);
        table.put(Action.VIEW_GROUP, GroupRole.USER);
        table.put(Action.READ_AGENT_VISIBILITY, GroupRole.USER);
        table.put(Action.ACCESS_AGENT, GroupRole.USER);
        table.put(Action.CREATE_AGENT, GroupRole.ADMIN);
        table.put(Action.LIST_MEMBERS, GroupRole.ADMIN);
        table.put(Action.MANAGE_MEMBERS, GroupRole.ADMIN);
        table.put(Action.MANAGE_AGENTS, GroupRole.ADMIN);
        table.put(Action.UPDATE_GROUP, GroupRole.ADMIN);
        table.put(Action.DELETE_GROUP, GroupRole.ADMIN);
        return new ActionPolicy(table);
    }

    /**
     * Applies configured overrides on top of the defaults.
     *
     * @param overrides action value (e.g. {@code manage-members}) to role value (e.g. {@code admin})
     * @throws IllegalArgumentException on an unknown action or role, so bad config fails at startup
     */
    public static ActionPolicy fromConfig(Map<String, String> overrides) {
        Map<Action, GroupRole> table = new EnumMap<>(defaults().requirements);
        if (overrides != null) {
            overrides.forEach((actionValue, roleValue) -> {
                Action action = Action.fromString(actionValue)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown action in policy: " + actionValue));
                GroupRole role = GroupRole.fromString(roleValue)
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Unknown role '%s' for action '%s'".formatted(roleValue, actionValue)));
                table.put(action, role);
            });
        }
        return new ActionPolicy(table);
    }

    /** Builds a policy from an explicit table; actions left out are always denied. */
    public static ActionPolicy of(Map<Action, GroupRole> table) {
        return new ActionPolicy(table.isEmpty() ? new EnumMap<>(Action.class) : table);
    }

    /** The minimum role the action needs, or empty when the action is not in the table. */
    public Optional<GroupRole> requiredRole(Action action) {
        return Optional.ofNullable(requirements.get(action));
    }

    public Map<Action, GroupRole> asMap() {
        return requirements;
    }
}
