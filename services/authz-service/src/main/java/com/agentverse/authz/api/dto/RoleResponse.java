package com.agentverse.authz.api.dto;

public record RoleResponse(String groupId, String role, boolean superadmin) {
}
