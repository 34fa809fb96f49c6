package com.agentverse.authz.infrastructure.store;

import com.agentverse.authz.domain.error.ConflictException;
import com.agentverse.authz.domain.error.NotFoundException;
import com.agentverse.authz.domain.model.Agent;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.GroupAgent;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.model.User;
import com.agentverse.authz.domain.store.ResourceStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Thread-safe in-memory {@link ResourceStore}.
 *
 * <p>Tables are sorted maps keyed by primary key; composite keys are {@code (left, right)}
 * pairs. Unique constraints (membership pair, link pair, agent external id) are enforced on
 * insert. Group deletion cascades to memberships and links.
 */
public class InMemoryResourceStore implements ResourceStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Group> groups = new TreeMap<>();
    private final Map<Pair, Membership> memberships = new TreeMap<>();
    private final Map<String, Agent> agents = new TreeMap<>();
    private final Map<String, String> agentIdsByExternalId = new HashMap<>();
    private final Map<Pair, GroupAgent> groupAgents = new TreeMap<>();
    private final Map<String, User> users = new TreeMap<>();

    /** (group, subject) for memberships, (group, agent) for links. */
    private record Pair(String left, String right) implements Comparable<Pair> {

        private Pair {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public int compareTo(Pair other) {
            int c = left.compareTo(other.left);
            return c != 0 ? c : right.compareTo(other.right);
        }
    }

    // groups

    @Override
    public Optional<Group> findGroup(String groupId) {
        return read(() -> Optional.ofNullable(groups.get(groupId)));
    }

    @Override
    public List<Group> listGroups() {
        return read(() -> List.copyOf(groups.values()));
    }

    @Override
    public List<Group> getGroups(Collection<String> groupIds) {
        return read(() -> select(groups, groupIds));
    }

    @Override
    public Group insertGroup(Group group) {
        return write(() -> {
            if (groups.containsKey(group.id())) {
                throw new ConflictException("duplicate_group", "Group already exists: " + group.id());
            }
            groups.put(group.id(), group);
            return group;
        });
    }

    @Override
    public Group updateGroup(Group group) {
        return write(() -> {
            if (!groups.containsKey(group.id())) {
                throw NotFoundException.group(group.id());
            }
            groups.put(group.id(), group);
            return group;
        });
    }

    @Override
    public void deleteGroup(String groupId) {
        write(() -> {
            if (groups.remove(groupId) == null) {
                throw NotFoundException.group(groupId);
            }
            memberships.keySet().removeIf(k -> k.left().equals(groupId));
            groupAgents.keySet().removeIf(k -> k.left().equals(groupId));
            return null;
        });
    }

    // memberships

    @Override
    public Optional<Membership> getMembership(String subjectId, String groupId) {
        return read(() -> Optional.ofNullable(memberships.get(new Pair(groupId, subjectId))));
    }

    @Override
    public List<Membership> listMemberships(String groupId) {
        return read(() -> memberships.values().stream()
                .filter(m -> m.groupId().equals(groupId))
                .toList());
    }

    @Override
    public List<Membership> listMembershipsForSubject(String subjectId) {
        return read(() -> memberships.values().stream()
                .filter(m -> m.subjectId().equals(subjectId))
                .toList());
    }

    @Override
    public int countAdmins(String groupId) {
        return read(() -> (int) memberships.values().stream()
                .filter(m -> m.groupId().equals(groupId) && m.isAdmin())
                .count());
    }

    @Override
    public Map<String, Integer> countMembersByGroup() {
        return read(() -> {
            Map<String, Integer> counts = new TreeMap<>();
            memberships.keySet().forEach(k -> counts.merge(k.left(), 1, Integer::sum));
            return counts;
        });
    }

    @Override
    public Membership insertMembership(Membership membership) {
        return write(() -> {
            requireGroup(membership.groupId());
            Pair key = new Pair(membership.groupId(), membership.subjectId());
            if (memberships.containsKey(key)) {
                throw ConflictException.duplicateMembership(membership.subjectId(), membership.groupId());
            }
            memberships.put(key, membership);
            return membership;
        });
    }

    @Override
    public Membership upsertMembership(Membership membership) {
        return write(() -> {
            requireGroup(membership.groupId());
            memberships.put(new Pair(membership.groupId(), membership.subjectId()), membership);
            return membership;
        });
    }

    @Override
    public void deleteMembership(String subjectId, String groupId) {
        write(() -> {
            if (memberships.remove(new Pair(groupId, subjectId)) == null) {
                throw NotFoundException.membership(subjectId, groupId);
            }
            return null;
        });
    }

    // agents

    @Override
    public Optional<Agent> findAgent(String agentId) {
        return read(() -> Optional.ofNullable(agents.get(agentId)));
    }

    @Override
    public Optional<Agent> findAgentByExternalId(String externalId) {
        return read(() -> Optional.ofNullable(agentIdsByExternalId.get(externalId)).map(agents::get));
    }

    @Override
    public List<Agent> listAgents() {
        return read(() -> List.copyOf(agents.values()));
    }

    @Override
    public List<Agent> getAgents(Collection<String> agentIds) {
        return read(() -> select(agents, agentIds));
    }

    @Override
    public Agent insertAgent(Agent agent) {
        return write(() -> {
            if (agents.containsKey(agent.id())) {
                throw new ConflictException("duplicate_agent", "Agent already exists: " + agent.id());
            }
            if (agentIdsByExternalId.containsKey(agent.externalId())) {
                throw new ConflictException("duplicate_agent", "Agent already registered: " + agent.externalId());
            }
            agents.put(agent.id(), agent);
            agentIdsByExternalId.put(agent.externalId(), agent.id());
            return agent;
        });
    }

    @Override
    public void deleteAgent(String agentId) {
        write(() -> {
            Agent removed = agents.remove(agentId);
            if (removed != null) {
                agentIdsByExternalId.remove(removed.externalId());
                groupAgents.keySet().removeIf(k -> k.right().equals(agentId));
            }
            return null;
        });
    }

    // group-agent links

    @Override
    public Optional<GroupAgent> findGroupAgent(String groupId, String agentId) {
        return read(() -> Optional.ofNullable(groupAgents.get(new Pair(groupId, agentId))));
    }

    @Override
    public List<GroupAgent> listGroupAgents(String groupId) {
        return read(() -> groupAgents.values().stream()
                .filter(l -> l.groupId().equals(groupId))
                .toList());
    }

    @Override
    public List<GroupAgent> listGroupsForAgent(String agentId) {
        return read(() -> groupAgents.values().stream()
                .filter(l -> l.agentId().equals(agentId))
                .toList());
    }

    @Override
    public List<GroupAgent> listAllGroupAgents() {
        return read(() -> List.copyOf(groupAgents.values()));
    }

    @Override
    public GroupAgent insertGroupAgent(GroupAgent link) {
        return write(() -> {
            requireLinkTargets(link);
            Pair key = new Pair(link.groupId(), link.agentId());
            if (groupAgents.containsKey(key)) {
                throw ConflictException.duplicateLink(link.groupId(), link.agentId());
            }
            groupAgents.put(key, link);
            return link;
        });
    }

    @Override
    public GroupAgent upsertGroupAgent(GroupAgent link) {
        return write(() -> {
            requireLinkTargets(link);
            groupAgents.put(new Pair(link.groupId(), link.agentId()), link);
            return link;
        });
    }

    @Override
    public void deleteGroupAgent(String groupId, String agentId) {
        write(() -> {
            if (groupAgents.remove(new Pair(groupId, agentId)) == null) {
                throw new NotFoundException("assignment_not_found",
                        "Agent '%s' is not linked to group '%s'".formatted(agentId, groupId));
            }
            return null;
        });
    }

    @Override
    public List<GroupAgent> deleteGroupAgentsForAgent(String agentId) {
        return write(() -> {
            List<GroupAgent> removed = new ArrayList<>();
            groupAgents.values().removeIf(l -> {
                if (l.agentId().equals(agentId)) {
                    removed.add(l);
                    return true;
                }
                return false;
            });
            return removed;
        });
    }

    // users

    @Override
    public Optional<User> findUser(String userId) {
        return read(() -> Optional.ofNullable(users.get(userId)));
    }

    @Override
    public List<User> getUsers(Collection<String> userIds) {
        return read(() -> select(users, userIds));
    }

    @Override
    public User upsertUser(User user) {
        return write(() -> {
            users.put(user.id(), user);
            return user;
        });
    }

    private void requireGroup(String groupId) {
        if (!groups.containsKey(groupId)) {
            throw NotFoundException.group(groupId);
        }
    }

    private void requireLinkTargets(GroupAgent link) {
        requireGroup(link.groupId());
        if (!agents.containsKey(link.agentId())) {
            throw NotFoundException.agent(link.agentId());
        }
    }

    private static <T> List<T> select(Map<String, T> table, Collection<String> ids) {
        List<T> result = new ArrayList<>();
        for (String id : new TreeSet<>(ids)) {
            T value = table.get(id);
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    private <T> T read(Supplier<T> body) {
        lock.readLock().lock();
        try {
            return body.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> body) {
        lock.writeLock().lock();
        try {
            return body.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
