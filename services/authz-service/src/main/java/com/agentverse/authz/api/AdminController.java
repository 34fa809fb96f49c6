package com.agentverse.authz.api;

import com.agentverse.authz.api.dto.AgentGroupsRequest;
import com.agentverse.authz.api.dto.AgentResponse;
import com.agentverse.authz.api.dto.GroupSummaryResponse;
import com.agentverse.authz.domain.service.AdminService;
import com.agentverse.security.CallerIdentity;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Superadmin views across all groups. */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final AdminService admin;

    public AdminController(AdminService admin) {
        this.admin = admin;
    }

    @GetMapping("/agents")
    public List<AgentResponse> agents(CallerIdentity caller) {
        return admin.listAgents(caller).stream().map(AgentResponse::from).toList();
    }

    @GetMapping("/groups")
    public List<GroupSummaryResponse> groups(CallerIdentity caller) {
        return admin.listGroups(caller).stream().map(GroupSummaryResponse::from).toList();
    }

    @PutMapping("/agents/{agentId}/groups")
    public AgentResponse replaceGroups(CallerIdentity caller, @PathVariable String agentId,
                                       @Valid @RequestBody AgentGroupsRequest request) {
        return AgentResponse.from(admin.replaceAgentGroups(caller, agentId, request.groupIds()));
    }
}
