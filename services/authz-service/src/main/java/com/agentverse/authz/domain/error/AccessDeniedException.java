package com.agentverse.authz.domain.error;

/**
 * The caller is not allowed to perform the requested operation.
 */
public class AccessDeniedException extends AuthzException {

    public AccessDeniedException(String message) {
        super("forbidden", message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DENIED;
    }
}
