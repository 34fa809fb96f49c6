package com.agentverse.authz.domain.authorization;

/**
 * Kind of resource an authorization request targets.
 */
public enum ResourceType {
    GROUP,
    AGENT
}
