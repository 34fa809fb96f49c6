package com.agentverse.security.testing;

import com.agentverse.security.CallerIdentity;

import java.util.Set;

/**
 * Factory for {@link CallerIdentity} instances in tests.
 * <p>
 * Lives in the main source set so other modules can use it from their test scope
 * through a regular Maven dependency.
 */
public final class TestCallerIdentityFactory {

    public static final String SUPERADMIN_ROLE = "agentverse-superadmin";

    private TestCallerIdentityFactory() {
        // utility class
    }

    /** A regular caller with no role claims. */
    public static CallerIdentity user(String subjectId) {
        return new CallerIdentity(subjectId, "Test " + subjectId, subjectId + "@agentverse.local",
                Set.of("agentverse-user"), false);
    }

    /** A caller carrying the superadmin claim. */
    public static CallerIdentity superadmin(String subjectId) {
        return new CallerIdentity(subjectId, "Admin " + subjectId, subjectId + "@agentverse.local",
                Set.of("agentverse-user", SUPERADMIN_ROLE), true);
    }

    /** An identity without a subject id, which every check must deny. */
    public static CallerIdentity malformed() {
        return new CallerIdentity(" ", null, null, Set.of(), false);
    }
}
