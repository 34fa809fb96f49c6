package com.agentverse.authz.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record RoleRequest(
        @NotBlank @Pattern(regexp = "(?i)admin|user", message = "must be 'admin' or 'user'") String role) {
}
