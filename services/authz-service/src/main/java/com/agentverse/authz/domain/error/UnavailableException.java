package com.agentverse.authz.domain.error;

/**
 * A dependency (store, cache, lock) timed out or could not be reached.
 */
public class UnavailableException extends AuthzException {

    public UnavailableException(String message) {
        super("unavailable", message);
    }

    public UnavailableException(String message, Throwable cause) {
        super("unavailable", message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNAVAILABLE;
    }
}
