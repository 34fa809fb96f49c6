package com.agentverse.authz.domain.authorization;

/**
 * Reference to the resource an action targets.
 */
public record ResourceRef(ResourceType type, String id) {

    public static ResourceRef group(String groupId) {
        return new ResourceRef(ResourceType.GROUP, groupId);
    }

    public static ResourceRef agent(String agentId) {
        return new ResourceRef(ResourceType.AGENT, agentId);
    }

    boolean isWellFormed() {
        return type != null && id != null && !id.isBlank();
    }
}
