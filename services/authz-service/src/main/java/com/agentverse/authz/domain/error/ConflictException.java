package com.agentverse.authz.domain.error;

/**
 * The write would break a uniqueness or structural invariant and was rejected.
 */
public class ConflictException extends AuthzException {

    public ConflictException(String code, String message) {
        super(code, message);
    }

    public static ConflictException lastAdmin(String groupId) {
        return new ConflictException("last_admin",
                "Cannot remove or demote the last admin of group " + groupId);
    }

    public static ConflictException duplicateMembership(String subjectId, String groupId) {
        return new ConflictException("duplicate_membership",
                "Subject '%s' is already a member of group '%s'".formatted(subjectId, groupId));
    }

    public static ConflictException duplicateLink(String groupId, String agentId) {
        return new ConflictException("duplicate_assignment",
                "Agent '%s' is already linked to group '%s'".formatted(agentId, groupId));
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
