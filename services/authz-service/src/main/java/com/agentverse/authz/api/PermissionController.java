package com.agentverse.authz.api;

import com.agentverse.authz.api.dto.PermissionCheckResponse;
import com.agentverse.authz.api.dto.RoleResponse;
import com.agentverse.authz.domain.service.PermissionService;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.RoleChecker;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Permission checks for other platform services. A denial is a normal {@code 200} answer
 * with {@code allowed=false}.
 */
@RestController
@RequestMapping("/api/v1/permissions")
public class PermissionController {

    private final PermissionService permissions;

    public PermissionController(PermissionService permissions) {
        this.permissions = permissions;
    }

    @GetMapping("/check")
    public PermissionCheckResponse check(
            CallerIdentity caller,
            @RequestParam String userId,
            @RequestParam String agentId,
            @RequestParam(defaultValue = "access-agent") String action) {
        return PermissionCheckResponse.from(permissions.check(caller, userId, agentId, action));
    }

    @GetMapping("/groups/{groupId}/role")
    public RoleResponse role(CallerIdentity caller, @PathVariable String groupId) {
        return new RoleResponse(groupId, permissions.roleInGroup(caller, groupId).value(),
                RoleChecker.isSuperadmin(caller));
    }
}
