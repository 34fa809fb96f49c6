package com.agentverse.authz.domain.error;

/**
 * Distinguishable failure kinds surfaced by the store, the cache and the guard.
 */
public enum ErrorKind {
    /** Resource, group or membership absent. */
    NOT_FOUND,
    /** Invariant violation or duplicate. */
    CONFLICT,
    /** Dependency timed out or is unreachable. */
    UNAVAILABLE,
    /** Caller is not authorized. */
    DENIED
}
