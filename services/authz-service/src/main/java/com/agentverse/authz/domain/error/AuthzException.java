package com.agentverse.authz.domain.error;

/**
 * Root of the service's failure taxonomy.
 * <p>
 * Unchecked: every failure here is either surfaced verbatim to the caller (not found,
 * conflict, denied) or converted to a denial on the read path (unavailable). Nothing in
 * the core retries.
 */
public abstract class AuthzException extends RuntimeException {

    private final String code;

    protected AuthzException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AuthzException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Machine-readable reason, e.g. {@code last_admin}. */
    public String code() {
        return code;
    }

    public abstract ErrorKind kind();
}
