package com.agentverse.authz.domain.error;

/**
 * A group, agent, user or membership does not exist.
 */
public class NotFoundException extends AuthzException {

    public NotFoundException(String code, String message) {
        super(code, message);
    }

    public static NotFoundException group(String groupId) {
        return new NotFoundException("group_not_found", "Group not found: " + groupId);
    }

    public static NotFoundException agent(String agentId) {
        return new NotFoundException("agent_not_found", "Agent not found: " + agentId);
    }

    public static NotFoundException membership(String subjectId, String groupId) {
        return new NotFoundException("membership_not_found",
                "Membership not found: subject '%s' in group '%s'".formatted(subjectId, groupId));
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
