package com.agentverse.authz.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param externalId id of the agent on its owning platform
 * @param groupId group the new agent is linked to
 */
public record RegisterAgentRequest(
        @NotBlank @Size(max = 500) String externalId,
        @Size(max = 200) String name,
        @NotBlank String groupId) {
}
