package com.agentverse.authz.api.dto;

import jakarta.validation.constraints.Size;

/** Fields left null keep their current value. */
public record UpdateGroupRequest(@Size(min = 1, max = 200) String name, @Size(max = 2000) String description) {
}
