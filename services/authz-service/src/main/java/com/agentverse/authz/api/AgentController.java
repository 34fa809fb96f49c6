package com.agentverse.authz.api;

import com.agentverse.authz.api.dto.AgentResponse;
import com.agentverse.authz.api.dto.LinkResponse;
import com.agentverse.authz.api.dto.RegisterAgentRequest;
import com.agentverse.authz.domain.service.AgentService;
import com.agentverse.security.CallerIdentity;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Agent registration and group links. Linking and unlinking are idempotent, so clients may
 * retry them freely.
 */
@RestController
@RequestMapping("/api/v1")
public class AgentController {

    private final AgentService agents;

    public AgentController(AgentService agents) {
        this.agents = agents;
    }

    @PostMapping("/agents")
    @ResponseStatus(HttpStatus.CREATED)
    public AgentResponse register(CallerIdentity caller, @Valid @RequestBody RegisterAgentRequest request) {
        return AgentResponse.from(
                agents.registerAgent(caller, request.externalId(), request.name(), request.groupId()));
    }

    @GetMapping("/groups/{groupId}/agents")
    public List<AgentResponse> listInGroup(CallerIdentity caller, @PathVariable String groupId) {
        return agents.listAgentsInGroup(caller, groupId).stream().map(AgentResponse::from).toList();
    }

    @PutMapping("/groups/{groupId}/agents/{agentId}")
    public LinkResponse link(CallerIdentity caller, @PathVariable String groupId, @PathVariable String agentId) {
        boolean changed = agents.linkAgent(caller, groupId, agentId);
        return new LinkResponse(groupId, agentId, true, changed);
    }

    @DeleteMapping("/groups/{groupId}/agents/{agentId}")
    public LinkResponse unlink(CallerIdentity caller, @PathVariable String groupId, @PathVariable String agentId) {
        boolean changed = agents.unlinkAgent(caller, groupId, agentId);
        return new LinkResponse(groupId, agentId, false, changed);
    }
}
