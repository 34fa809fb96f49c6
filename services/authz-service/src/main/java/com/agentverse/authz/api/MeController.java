package com.agentverse.authz.api;

import com.agentverse.authz.api.dto.AgentResponse;
import com.agentverse.authz.api.dto.GroupResponse;
import com.agentverse.authz.domain.service.AgentService;
import com.agentverse.authz.domain.service.GroupService;
import com.agentverse.security.CallerIdentity;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Scoped views of the calling user. */
@RestController
@RequestMapping("/api/v1/me")
public class MeController {

    private final AgentService agents;
    private final GroupService groups;

    public MeController(AgentService agents, GroupService groups) {
        this.agents = agents;
        this.groups = groups;
    }

    @GetMapping("/agents")
    public List<AgentResponse> visibleAgents(CallerIdentity caller) {
        return agents.visibleAgents(caller).stream().map(AgentResponse::from).toList();
    }

    @GetMapping("/admin-groups")
    public List<GroupResponse> adminGroups(CallerIdentity caller) {
        return groups.adminGroups(caller).stream().map(GroupResponse::from).toList();
    }
}
