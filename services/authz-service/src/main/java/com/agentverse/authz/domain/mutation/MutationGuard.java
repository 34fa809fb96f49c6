package com.agentverse.authz.domain.mutation;

import com.agentverse.authz.domain.authorization.AuthorizationEngine;
import com.agentverse.authz.domain.authorization.AuthorizationObserver;
import com.agentverse.authz.domain.authorization.Decision;
import com.agentverse.authz.domain.authorization.ResourceRef;
import com.agentverse.authz.domain.cache.InvalidationScope;
import com.agentverse.authz.domain.cache.PermissionCache;
import com.agentverse.authz.domain.error.AccessDeniedException;
import com.agentverse.authz.domain.error.AuthzException;
import com.agentverse.authz.domain.error.ConflictException;
import com.agentverse.authz.domain.error.NotFoundException;
import com.agentverse.authz.domain.error.UnavailableException;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.GroupAgent;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.model.User;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.GroupRole;
import com.agentverse.security.RoleChecker;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every write that can change an authorization outcome goes through here.
 *
 * <p>Each operation runs as: lock the affected groups, authorize the caller, validate, write to
 * the store, invalidate the affected cache scopes, unlock. A write is only reported as successful
 * once its invalidation is confirmed. When invalidation fails the write is undone and the caller
 * receives {@link UnavailableException}. A write that itself fails as unavailable may still
 * have been applied, so the affected scopes are invalidated before the failure is rethrown.
 *
 * <p>Invariants held under the group lock:
 *
 * <ul>
 *   <li>a group with at least one membership keeps at least one admin membership
 *   <li>one membership per (subject, group) and one link per (group, agent)
 * </ul>
 */
public class MutationGuard {

    private static final Logger log = LoggerFactory.getLogger(MutationGuard.class);

    private final ResourceStore store;
    private final PermissionCache cache;
    private final AuthorizationEngine engine;
    private final GroupLocks locks;
    private final Clock clock;
    private final AuthorizationObserver observer;

    public MutationGuard(
            ResourceStore store,
            PermissionCache cache,
            AuthorizationEngine engine,
            GroupLocks locks,
            Clock clock,
            AuthorizationObserver observer) {
        this.store = store;
        this.cache = cache;
        this.engine = engine;
        this.locks = locks;
        this.clock = clock;
        this.observer = observer != null ? observer : AuthorizationObserver.NOOP;
    }

    /**
     * Adds a member to the group. An unseen subject id gets a stub user profile.
     *
     * @throws AccessDeniedException unless the caller may manage members of the group
     * @throws NotFoundException if the group does not exist
     * @throws ConflictException if the membership exists, or a user-role member would be the
     *     group's first member
     */
    public Membership addMember(CallerIdentity caller, String groupId, String userId, GroupRole role) {
        requireText(userId, "userId");
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        return guarded("add_member", () -> {
            try (GroupLocks.Held held = locks.lock(groupId)) {
                requireAllowed(caller, Action.MANAGE_MEMBERS, groupId);
                requireGroup(groupId);
                if (store.getMembership(userId, groupId).isPresent()) {
                    throw ConflictException.duplicateMembership(userId, groupId);
                }
                if (role == GroupRole.USER && store.listMemberships(groupId).isEmpty()) {
                    log.warn("Rejected user-role first member {} for group {}", userId, groupId);
                    throw new ConflictException("first_member_must_be_admin",
                            "The first member of group " + groupId + " must be an admin");
                }
                Instant now = clock.instant();
                if (store.findUser(userId).isEmpty()) {
                    store.upsertUser(User.stub(userId, now));
                }
                Membership membership = new Membership(userId, groupId, role, now);
                Membership saved = commit("add_member",
                        () -> store.insertMembership(membership),
                        () -> store.deleteMembership(userId, groupId),
                        List.of(InvalidationScope.subject(userId)));
                log.info("Added {} to group {} as {} by {}", userId, groupId, role.value(), caller.subjectId());
                return saved;
            }
        });
    }

    /**
     * Changes a member's role. Demoting the group's last admin is rejected, including when the
     * admin is the group's only member. Setting the role a member already holds is a no-op.
     *
     * @throws NotFoundException if the group or membership does not exist
     * @throws ConflictException if the last admin would be demoted
     */
    public Membership updateMemberRole(CallerIdentity caller, String groupId, String userId, GroupRole newRole) {
        requireText(userId, "userId");
        if (newRole == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        return guarded("update_member_role", () -> {
            try (GroupLocks.Held held = locks.lock(groupId)) {
                requireAllowed(caller, Action.MANAGE_MEMBERS, groupId);
                requireGroup(groupId);
                Membership previous = store.getMembership(userId, groupId)
                        .orElseThrow(() -> NotFoundException.membership(userId, groupId));
                if (previous.role() == newRole) {
                    return previous;
                }
                if (previous.isAdmin() && store.countAdmins(groupId) <= 1) {
                    log.warn("Blocked demotion of last admin {} in group {}", userId, groupId);
                    throw ConflictException.lastAdmin(groupId);
                }
                Membership saved = commit("update_member_role",
                        () -> store.upsertMembership(previous.withRole(newRole)),
                        () -> store.upsertMembership(previous),
                        List.of(InvalidationScope.subject(userId)));
                log.info("Changed role of {} in group {} from {} to {} by {}",
                        userId, groupId, previous.role().value(), newRole.value(), caller.subjectId());
                return saved;
            }
        });
    }

    /**
     * Removes a member. Removing the last admin is rejected; only {@link #deleteGroup} removes
     * it, together with the group.
     *
     * @throws NotFoundException if the group or membership does not exist
     * @throws ConflictException if the member is the group's last admin
     */
    public void removeMember(CallerIdentity caller, String groupId, String userId) {
        requireText(userId, "userId");
        guarded("remove_member", () -> {
            try (GroupLocks.Held held = locks.lock(groupId)) {
                requireAllowed(caller, Action.MANAGE_MEMBERS, groupId);
                requireGroup(groupId);
                Membership previous = store.getMembership(userId, groupId)
                        .orElseThrow(() -> NotFoundException.membership(userId, groupId));
                if (previous.isAdmin() && store.countAdmins(groupId) <= 1) {
                    log.warn("Blocked removal of last admin {} from group {}", userId, groupId);
                    throw ConflictException.lastAdmin(groupId);
                }
                commit("remove_member",
                        () -> {
                            store.deleteMembership(userId, groupId);
                            return previous;
                        },
                        () -> store.upsertMembership(previous),
                        List.of(InvalidationScope.subject(userId)));
                log.info("Removed {} from group {} by {}", userId, groupId, caller.subjectId());
                return previous;
            }
        });
    }

    /**
     * Links an agent to a group. Linking an already linked pair succeeds without changes.
     *
     * @return true if a new link was created
     * @throws NotFoundException if the group or agent does not exist
     */
    public boolean linkAgentToGroup(CallerIdentity caller, String groupId, String agentId) {
        requireText(agentId, "agentId");
        return guarded("link_agent", () -> {
            try (GroupLocks.Held held = locks.lock(groupId)) {
                requireAllowed(caller, Action.MANAGE_AGENTS, groupId);
                requireGroup(groupId);
                store.findAgent(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
                if (store.findGroupAgent(groupId, agentId).isPresent()) {
                    return false;
                }
                GroupAgent link = new GroupAgent(groupId, agentId, caller.subjectId(), clock.instant());
                commit("link_agent",
                        () -> store.insertGroupAgent(link),
                        () -> store.deleteGroupAgent(groupId, agentId),
                        linkScopes(agentId, List.of(groupId)));
                log.info("Linked agent {} to group {} by {}", agentId, groupId, caller.subjectId());
                return true;
            }
        });
    }

    /**
     * Unlinks an agent from a group. Unlinking a pair that is not linked succeeds without changes.
     *
     * @return true if a link was removed
     */
    public boolean unlinkAgentFromGroup(CallerIdentity caller, String groupId, String agentId) {
        requireText(agentId, "agentId");
        return guarded("unlink_agent", () -> {
            try (GroupLocks.Held held = locks.lock(groupId)) {
                requireAllowed(caller, Action.MANAGE_AGENTS, groupId);
                Optional<GroupAgent> existing = store.findGroupAgent(groupId, agentId);
                if (existing.isEmpty()) {
                    return false;
                }
                GroupAgent previous = existing.get();
                commit("unlink_agent",
                        () -> {
                            store.deleteGroupAgent(groupId, agentId);
                            return previous;
                        },
                        () -> store.upsertGroupAgent(previous),
                        linkScopes(agentId, List.of(groupId)));
                log.info("Unlinked agent {} from group {} by {}", agentId, groupId, caller.subjectId());
                return true;
            }
        });
    }

    /**
     * Deletes a group with all its memberships and links. Agents and users are kept.
     *
     * @throws NotFoundException if the group does not exist
     */
    public void deleteGroup(CallerIdentity caller, String groupId) {
        guarded("delete_group", () -> {
            try (GroupLocks.Held held = locks.lock(groupId)) {
                requireAllowed(caller, Action.DELETE_GROUP, groupId);
                Group group = requireGroup(groupId);
                List<Membership> memberships = store.listMemberships(groupId);
                List<GroupAgent> links = store.listGroupAgents(groupId);

                List<InvalidationScope> scopes = new ArrayList<>();
                scopes.add(InvalidationScope.group(groupId));
                memberships.forEach(m -> scopes.add(InvalidationScope.subject(m.subjectId())));
                links.forEach(l -> scopes.add(InvalidationScope.agent(l.agentId())));

                commit("delete_group",
                        () -> {
                            store.deleteGroup(groupId);
                            return group;
                        },
                        () -> {
                            store.insertGroup(group);
                            memberships.forEach(store::upsertMembership);
                            links.forEach(store::upsertGroupAgent);
                        },
                        scopes);
                log.info("Deleted group {} ({} members, {} agents) by {}",
                        groupId, memberships.size(), links.size(), caller.subjectId());
                return group;
            }
        });
    }

    /**
     * Creates a group, optionally with its first admin. Superadmin only.
     *
     * @param initialAdminId subject to make the group's first admin, or null for an empty group
     * @throws ConflictException if the group id is taken
     */
    public Group createGroup(CallerIdentity caller, Group group, String initialAdminId) {
        return guarded("create_group", () -> {
            requireSuperadmin(caller, "create groups");
            try (GroupLocks.Held held = locks.lock(group.id())) {
                List<InvalidationScope> scopes = initialAdminId == null
                        ? List.of(InvalidationScope.group(group.id()))
                        : List.of(InvalidationScope.group(group.id()), InvalidationScope.subject(initialAdminId));
                Group saved = commit("create_group",
                        () -> {
                            Group inserted = store.insertGroup(group);
                            if (initialAdminId != null) {
                                try {
                                    if (store.findUser(initialAdminId).isEmpty()) {
                                        store.upsertUser(User.stub(initialAdminId, group.createdAt()));
                                    }
                                    store.insertMembership(
                                            new Membership(initialAdminId, group.id(), GroupRole.ADMIN, group.createdAt()));
                                } catch (RuntimeException e) {
                                    compensate("create_group", () -> store.deleteGroup(group.id()));
                                    throw e;
                                }
                            }
                            return inserted;
                        },
                        () -> store.deleteGroup(group.id()),
                        scopes);
                log.info("Created group {} ({}) by {}", saved.id(), saved.name(), caller.subjectId());
                return saved;
            }
        });
    }

    /**
     * Replaces the set of groups an agent is linked to. Superadmin only.
     *
     * @return the agent's links after the change
     * @throws NotFoundException if the agent or any of the groups does not exist
     */
    public List<GroupAgent> replaceAgentGroups(CallerIdentity caller, String agentId, Collection<String> groupIds) {
        requireText(agentId, "agentId");
        Set<String> target = new TreeSet<>(groupIds == null ? Set.of() : groupIds);
        return guarded("replace_agent_groups", () -> {
            requireSuperadmin(caller, "reassign agents");
            store.findAgent(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
            Set<String> affected = new TreeSet<>(target);
            store.listGroupsForAgent(agentId).forEach(l -> affected.add(l.groupId()));

            try (GroupLocks.Held held = locks.lockAll(affected)) {
                for (String groupId : target) {
                    requireGroup(groupId);
                }
                List<GroupAgent> before = store.listGroupsForAgent(agentId);
                Set<String> current = new TreeSet<>();
                before.forEach(l -> current.add(l.groupId()));
                if (!affected.containsAll(current)) {
                    throw new UnavailableException("Links of agent " + agentId + " changed concurrently, retry");
                }
                if (current.equals(target)) {
                    return before;
                }
                Instant now = clock.instant();
                commit("replace_agent_groups",
                        () -> {
                            try {
                                for (GroupAgent link : before) {
                                    if (!target.contains(link.groupId())) {
                                        store.deleteGroupAgent(link.groupId(), agentId);
                                    }
                                }
                                for (String groupId : target) {
                                    if (!current.contains(groupId)) {
                                        store.insertGroupAgent(new GroupAgent(groupId, agentId, caller.subjectId(), now));
                                    }
                                }
                            } catch (RuntimeException e) {
                                compensate("replace_agent_groups", () -> restoreLinks(agentId, before));
                                throw e;
                            }
                            return target;
                        },
                        () -> restoreLinks(agentId, before),
                        linkScopes(agentId, affected));
                log.info("Replaced groups of agent {}: {} -> {} by {}", agentId, current, target, caller.subjectId());
                return store.listGroupsForAgent(agentId);
            }
        });
    }

    private void restoreLinks(String agentId, List<GroupAgent> links) {
        store.deleteGroupAgentsForAgent(agentId);
        links.forEach(store::upsertGroupAgent);
    }

    /** Agent scope plus every member of the groups, whose visible-agent aggregates change. */
    private List<InvalidationScope> linkScopes(String agentId, Collection<String> groupIds) {
        Set<InvalidationScope> scopes = new LinkedHashSet<>();
        scopes.add(InvalidationScope.agent(agentId));
        for (String groupId : groupIds) {
            for (Membership membership : store.listMemberships(groupId)) {
                scopes.add(InvalidationScope.subject(membership.subjectId()));
            }
        }
        return new ArrayList<>(scopes);
    }

    private <T> T commit(String operation, Supplier<T> write, Runnable undo, Collection<InvalidationScope> scopes) {
        T result;
        try {
            result = write.get();
        } catch (UnavailableException e) {
            // the write may have been applied before it failed
            invalidateQuietly(operation, scopes);
            throw e;
        }
        try {
            for (InvalidationScope scope : scopes) {
                cache.invalidate(scope);
            }
        } catch (RuntimeException e) {
            log.error("Cache invalidation failed during {}, rolling back the store write", operation, e);
            compensate(operation, undo);
            throw new UnavailableException(
                    "Could not confirm cache invalidation for " + operation + "; the change was not applied", e);
        }
        return result;
    }

    private void invalidateQuietly(String operation, Collection<InvalidationScope> scopes) {
        for (InvalidationScope scope : scopes) {
            try {
                cache.invalidate(scope);
            } catch (RuntimeException e) {
                log.error("Cache invalidation of {} {} after failed {} also failed, entries expire by TTL",
                        scope.type(), scope.id(), operation, e);
            }
        }
    }

    private void compensate(String operation, Runnable undo) {
        try {
            undo.run();
        } catch (RuntimeException e) {
            log.error("Rollback of {} failed, store may hold the unconfirmed change until cache TTL expiry",
                    operation, e);
        }
    }

    private <T> T guarded(String operation, Supplier<T> body) {
        try {
            T result = body.get();
            observer.mutation(operation, "success");
            return result;
        } catch (AuthzException e) {
            observer.mutation(operation, e.kind().name().toLowerCase(Locale.ROOT));
            throw e;
        }
    }

    private void requireAllowed(CallerIdentity caller, Action action, String groupId) {
        requireText(groupId, "groupId");
        Decision decision = engine.authorize(caller, action, ResourceRef.group(groupId));
        if (!decision.allowed()) {
            log.warn("Denied {} on group {} for {}: {}",
                    action.value(), groupId, caller == null ? null : caller.subjectId(), decision.reason());
            throw new AccessDeniedException("Not allowed to " + action.value() + " in group " + groupId);
        }
    }

    private static void requireSuperadmin(CallerIdentity caller, String what) {
        if (!RoleChecker.isSuperadmin(caller)) {
            throw new AccessDeniedException("Only superadmins may " + what);
        }
    }

    private Group requireGroup(String groupId) {
        return store.findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
