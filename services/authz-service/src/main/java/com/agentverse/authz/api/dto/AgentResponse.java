package com.agentverse.authz.api.dto;

import com.agentverse.authz.domain.model.Agent;
import com.agentverse.authz.domain.model.AgentView;
import java.time.Instant;
import java.util.List;

public record AgentResponse(String id, String externalId, String name, String createdBy, Instant createdAt,
                            List<GroupRefResponse> groups) {

    public record GroupRefResponse(String id, String name) {
    }

    public static AgentResponse from(Agent agent) {
        return new AgentResponse(agent.id(), agent.externalId(), agent.name(), agent.createdBy(),
                agent.createdAt(), List.of());
    }

    public static AgentResponse from(AgentView view) {
        Agent agent = view.agent();
        return new AgentResponse(agent.id(), agent.externalId(), agent.name(), agent.createdBy(),
                agent.createdAt(),
                view.groups().stream().map(g -> new GroupRefResponse(g.groupId(), g.groupName())).toList());
    }
}
