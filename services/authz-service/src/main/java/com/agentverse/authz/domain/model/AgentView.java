package com.agentverse.authz.domain.model;

import java.util.List;

/**
 * An agent together with the groups it is reachable through.
 */
public record AgentView(Agent agent, List<GroupRef> groups) {

    /** Id and name of one group the agent is linked to. */
    public record GroupRef(String groupId, String groupName) {
    }
}
