package com.agentverse.authz.domain.service;

import com.agentverse.authz.domain.error.NotFoundException;
import com.agentverse.authz.domain.model.Agent;
import com.agentverse.authz.domain.model.AgentView;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.GroupAgent;
import com.agentverse.authz.domain.model.GroupSummary;
import com.agentverse.authz.domain.mutation.MutationGuard;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.security.CallerIdentity;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Platform-wide views and agent reassignment. Every operation requires superadmin.
 */
public class AdminService {

    private final ResourceStore store;
    private final MutationGuard guard;

    public AdminService(ResourceStore store, MutationGuard guard) {
        this.store = store;
        this.guard = guard;
    }

    public List<AgentView> listAgents(CallerIdentity caller) {
        Authorizations.requireSuperadmin(caller);
        Map<String, Group> groups = groupsById();
        Map<String, List<GroupAgent>> linksByAgent = store.listAllGroupAgents().stream()
                .collect(Collectors.groupingBy(GroupAgent::agentId));
        return store.listAgents().stream()
                .map(agent -> toView(agent, linksByAgent.getOrDefault(agent.id(), List.of()), groups))
                .toList();
    }

    public List<GroupSummary> listGroups(CallerIdentity caller) {
        Authorizations.requireSuperadmin(caller);
        Map<String, Integer> counts = store.countMembersByGroup();
        return store.listGroups().stream()
                .map(g -> new GroupSummary(g, counts.getOrDefault(g.id(), 0)))
                .toList();
    }

    /** Makes the agent's groups exactly {@code groupIds}. */
    public AgentView replaceAgentGroups(CallerIdentity caller, String agentId, Collection<String> groupIds) {
        Authorizations.requireSuperadmin(caller);
        List<GroupAgent> links = guard.replaceAgentGroups(caller, agentId, groupIds);
        Agent agent = store.findAgent(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
        return toView(agent, links, groupsById());
    }

    private Map<String, Group> groupsById() {
        return store.listGroups().stream().collect(Collectors.toMap(Group::id, Function.identity()));
    }

    private static AgentView toView(Agent agent, List<GroupAgent> links, Map<String, Group> groups) {
        return new AgentView(agent, links.stream()
                .map(link -> groups.get(link.groupId()))
                .filter(g -> g != null)
                .map(g -> new AgentView.GroupRef(g.id(), g.name()))
                .toList());
    }
}
