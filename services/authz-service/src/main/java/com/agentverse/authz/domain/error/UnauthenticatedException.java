package com.agentverse.authz.domain.error;

/**
 * The request carries no usable caller identity.
 */
public class UnauthenticatedException extends AuthzException {

    public UnauthenticatedException(String message) {
        super("unauthenticated", message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DENIED;
    }
}
