package com.agentverse.authz.domain.cache;

import com.agentverse.authz.domain.policy.Action;

import java.util.Objects;

/**
 * Deterministic fingerprint of a permission check: (subject, scope, check kind).
 *
 * @param qualifier extra discriminator inside a kind (the action for {@link CheckKind#AGENT_ACTION}), or null
 */
public record CacheKey(
        String subjectId,
        ScopeType scopeType,
        String scopeId,
        CheckKind kind,
        String qualifier
) {

    /** Prefix of every rendered key. */
    public static final String PREFIX = "authz:v1";

    public CacheKey {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(scopeType, "scopeType");
        Objects.requireNonNull(scopeId, "scopeId");
        Objects.requireNonNull(kind, "kind");
    }

    public static CacheKey role(String subjectId, String groupId) {
        return new CacheKey(subjectId, ScopeType.GROUP, groupId, CheckKind.ROLE, null);
    }

    public static CacheKey agentAction(String subjectId, String agentId, Action action) {
        return new CacheKey(subjectId, ScopeType.AGENT, agentId, CheckKind.AGENT_ACTION, action.value());
    }

    public static CacheKey visibleAgents(String subjectId) {
        return new CacheKey(subjectId, ScopeType.SUBJECT, subjectId, CheckKind.VISIBLE_AGENTS, null);
    }

    public static CacheKey adminGroups(String subjectId) {
        return new CacheKey(subjectId, ScopeType.SUBJECT, subjectId, CheckKind.ADMIN_GROUPS, null);
    }

    /**
     * Renders the key as {@code authz:v1:<subject>:<scopeType>:<scopeId>:<kind>[:<qualifier>]}
     * with every free-form segment escaped.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(PREFIX)
                .append(':').append(escape(subjectId))
                .append(':').append(scopeType.name())
                .append(':').append(escape(scopeId))
                .append(':').append(kind.name());
        if (qualifier != null) {
            sb.append(':').append(escape(qualifier));
        }
        return sb.toString();
    }

    /**
     * Percent-encodes characters that are separators in rendered keys or wildcards in
     * glob patterns, so an id can never widen a pattern match.
     */
    public static String escape(String segment) {
        StringBuilder sb = new StringBuilder(segment.length());
        for (char c : segment.toCharArray()) {
            switch (c) {
                case '%' -> sb.append("%25");
                case ':' -> sb.append("%3A");
                case '*' -> sb.append("%2A");
                case '?' -> sb.append("%3F");
                case '[' -> sb.append("%5B");
                case ']' -> sb.append("%5D");
                case '\\' -> sb.append("%5C");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
