package com.agentverse.authz.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param initialAdminId subject to make the group's first admin; optional
 */
public record CreateGroupRequest(
        @NotBlank @Size(max = 200) String name,
        @Size(max = 2000) String description,
        String initialAdminId) {
}
