package com.agentverse.authz.domain.service;

import com.agentverse.authz.domain.authorization.AuthorizationEngine;
import com.agentverse.authz.domain.error.ConflictException;
import com.agentverse.authz.domain.error.NotFoundException;
import com.agentverse.authz.domain.model.Agent;
import com.agentverse.authz.domain.model.AgentView;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.GroupAgent;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.mutation.MutationGuard;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.RoleChecker;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agent registration, per-group listings and the caller's visible agents.
 */
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private final ResourceStore store;
    private final AuthorizationEngine engine;
    private final MutationGuard guard;
    private final Clock clock;

    public AgentService(ResourceStore store, AuthorizationEngine engine, MutationGuard guard, Clock clock) {
        this.store = store;
        this.engine = engine;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * Registers an agent and links it to the group. If the link cannot be made the agent is
     * deleted again.
     *
     * @throws ConflictException if an agent with the external id exists
     */
    public AgentView registerAgent(CallerIdentity caller, String externalId, String name, String groupId) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId must not be blank");
        }
        Authorizations.requireGroupAction(engine, caller, Action.CREATE_AGENT, groupId);
        Group group = store.findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));
        if (store.findAgentByExternalId(externalId).isPresent()) {
            throw new ConflictException("duplicate_agent", "Agent already registered: " + externalId);
        }
        Agent agent = store.insertAgent(new Agent(UUID.randomUUID().toString(), externalId,
                name != null ? name : "", caller.subjectId(), clock.instant()));
        try {
            guard.linkAgentToGroup(caller, groupId, agent.id());
        } catch (RuntimeException e) {
            log.warn("Linking new agent {} to group {} failed, removing it: {}", agent.id(), groupId, e.getMessage());
            store.deleteAgent(agent.id());
            throw e;
        }
        log.info("Registered agent {} ({}) in group {} by {}", agent.id(), externalId, groupId, caller.subjectId());
        return new AgentView(agent, List.of(new AgentView.GroupRef(group.id(), group.name())));
    }

    public List<Agent> listAgentsInGroup(CallerIdentity caller, String groupId) {
        Authorizations.requireGroupAction(engine, caller, Action.READ_AGENT_VISIBILITY, groupId);
        store.findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));
        List<String> ids = store.listGroupAgents(groupId).stream().map(GroupAgent::agentId).toList();
        return ids.isEmpty() ? List.of() : store.getAgents(ids);
    }

    /**
     * Agents the caller can see, each with the groups it is reachable through. Superadmins see
     * every agent with all of its groups.
     */
    public List<AgentView> visibleAgents(CallerIdentity caller) {
        List<Agent> agents = engine.visibleAgents(caller);
        if (agents.isEmpty()) {
            return List.of();
        }
        Set<String> memberOf = RoleChecker.isSuperadmin(caller)
                ? null
                : store.listMembershipsForSubject(caller.subjectId()).stream()
                        .map(Membership::groupId)
                        .collect(Collectors.toSet());
        Map<String, Group> groupsById = new HashMap<>();
        return agents.stream()
                .map(agent -> new AgentView(agent, store.listGroupsForAgent(agent.id()).stream()
                        .filter(link -> memberOf == null || memberOf.contains(link.groupId()))
                        .map(link -> groupsById.computeIfAbsent(link.groupId(),
                                id -> store.findGroup(id).orElse(null)))
                        .filter(g -> g != null)
                        .map(g -> new AgentView.GroupRef(g.id(), g.name()))
                        .toList()))
                .toList();
    }

    public boolean linkAgent(CallerIdentity caller, String groupId, String agentId) {
        return guard.linkAgentToGroup(caller, groupId, agentId);
    }

    public boolean unlinkAgent(CallerIdentity caller, String groupId, String agentId) {
        return guard.unlinkAgentFromGroup(caller, groupId, agentId);
    }
}
