package com.agentverse.authz.domain.cache;

/**
 * What a cache entry is scoped to, besides its subject.
 */
public enum ScopeType {
    GROUP,
    AGENT,
    SUBJECT
}
