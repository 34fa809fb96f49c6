package com.agentverse.authz.domain.cache;

import java.util.Locale;

/**
 * Set of cache entries removed together.
 *
 * @param type SUBJECT removes every entry of a subject, GROUP and AGENT remove every entry scoped to that id
 */
public record InvalidationScope(ScopeType type, String id) {

    public static InvalidationScope subject(String subjectId) {
        return new InvalidationScope(ScopeType.SUBJECT, subjectId);
    }

    public static InvalidationScope group(String groupId) {
        return new InvalidationScope(ScopeType.GROUP, groupId);
    }

    public static InvalidationScope agent(String agentId) {
        return new InvalidationScope(ScopeType.AGENT, agentId);
    }

    /** Whether the key falls inside this scope. */
    public boolean covers(CacheKey key) {
        return switch (type) {
            case SUBJECT -> key.subjectId().equals(id);
            case GROUP, AGENT -> key.scopeType() == type && key.scopeId().equals(id);
        };
    }

    /** Name of the generation counter this scope bumps, e.g. {@code group:g-1}. */
    public String generationName() {
        return generationName(type, id);
    }

    public static String generationName(ScopeType type, String id) {
        return type.name().toLowerCase(Locale.ROOT) + ":" + CacheKey.escape(id);
    }
}
