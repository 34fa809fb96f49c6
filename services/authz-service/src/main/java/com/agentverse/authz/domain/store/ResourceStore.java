package com.agentverse.authz.domain.store;

import com.agentverse.authz.domain.model.Agent;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.GroupAgent;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.model.User;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD access to groups, memberships, agents, links and user profiles.
 * <p>
 * Every call either succeeds or throws
 * {@link com.agentverse.authz.domain.error.NotFoundException},
 * {@link com.agentverse.authz.domain.error.ConflictException} or
 * {@link com.agentverse.authz.domain.error.UnavailableException}. Lookups that may
 * legitimately find nothing return {@link Optional} instead of throwing.
 */
public interface ResourceStore {

    // groups

    Optional<Group> findGroup(String groupId);

    List<Group> listGroups();

    /** Returns the groups that exist among the ids, in id order. */
    List<Group> getGroups(Collection<String> groupIds);

    /** @throws com.agentverse.authz.domain.error.ConflictException if the id is taken */
    Group insertGroup(Group group);

    /** @throws com.agentverse.authz.domain.error.NotFoundException if the group is absent */
    Group updateGroup(Group group);

    /**
     * Deletes the group with all its memberships and agent links. Agents and users are
     * left untouched.
     *
     * @throws com.agentverse.authz.domain.error.NotFoundException if the group is absent
     */
    void deleteGroup(String groupId);

    // memberships

    Optional<Membership> getMembership(String subjectId, String groupId);

    List<Membership> listMemberships(String groupId);

    List<Membership> listMembershipsForSubject(String subjectId);

    int countAdmins(String groupId);

    /** Member count per group id, for groups with at least one member. */
    Map<String, Integer> countMembersByGroup();

    /** @throws com.agentverse.authz.domain.error.ConflictException if the (subject, group) pair exists */
    Membership insertMembership(Membership membership);

    /** Inserts or replaces the membership of the (subject, group) pair. */
    Membership upsertMembership(Membership membership);

    /** @throws com.agentverse.authz.domain.error.NotFoundException if the membership is absent */
    void deleteMembership(String subjectId, String groupId);

    // agents

    Optional<Agent> findAgent(String agentId);

    Optional<Agent> findAgentByExternalId(String externalId);

    List<Agent> listAgents();

    /** Returns the agents that exist among the ids, in id order. */
    List<Agent> getAgents(Collection<String> agentIds);

    /** @throws com.agentverse.authz.domain.error.ConflictException if the id or external id is taken */
    Agent insertAgent(Agent agent);

    /** Removes an agent and its links. Absent agents are ignored. */
    void deleteAgent(String agentId);

    // group-agent links

    Optional<GroupAgent> findGroupAgent(String groupId, String agentId);

    List<GroupAgent> listGroupAgents(String groupId);

    List<GroupAgent> listGroupsForAgent(String agentId);

    List<GroupAgent> listAllGroupAgents();

    /** @throws com.agentverse.authz.domain.error.ConflictException if the (group, agent) pair exists */
    GroupAgent insertGroupAgent(GroupAgent link);

    /** Inserts or replaces the link of the (group, agent) pair. */
    GroupAgent upsertGroupAgent(GroupAgent link);

    /** @throws com.agentverse.authz.domain.error.NotFoundException if the link is absent */
    void deleteGroupAgent(String groupId, String agentId);

    /** Removes every link of the agent; returns the removed links. */
    List<GroupAgent> deleteGroupAgentsForAgent(String agentId);

    // users

    Optional<User> findUser(String userId);

    List<User> getUsers(Collection<String> userIds);

    User upsertUser(User user);
}
