package com.agentverse.authz.api.dto;

/**
 * @param changed whether the call created or removed a link; false for a repeated call
 */
public record LinkResponse(String groupId, String agentId, boolean linked, boolean changed) {
}
