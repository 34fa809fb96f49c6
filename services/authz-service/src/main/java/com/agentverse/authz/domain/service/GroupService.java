package com.agentverse.authz.domain.service;

import com.agentverse.authz.domain.authorization.AuthorizationEngine;
import com.agentverse.authz.domain.error.NotFoundException;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.mutation.MutationGuard;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.RoleChecker;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Group lifecycle: create, read, list, rename, delete.
 */
public class GroupService {

    private static final Logger log = LoggerFactory.getLogger(GroupService.class);

    private final ResourceStore store;
    private final AuthorizationEngine engine;
    private final MutationGuard guard;
    private final Clock clock;

    public GroupService(ResourceStore store, AuthorizationEngine engine, MutationGuard guard, Clock clock) {
        this.store = store;
        this.engine = engine;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * Creates a group. Superadmin only.
     *
     * @param initialAdminId subject made the first admin, or null
     */
    public Group createGroup(CallerIdentity caller, String name, String description, String initialAdminId) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Instant now = clock.instant();
        Group group = new Group(UUID.randomUUID().toString(), name.strip(),
                description != null ? description : "", now, now);
        String adminId = initialAdminId == null || initialAdminId.isBlank() ? null : initialAdminId.strip();
        return guard.createGroup(caller, group, adminId);
    }

    public Group getGroup(CallerIdentity caller, String groupId) {
        Authorizations.requireGroupAction(engine, caller, Action.VIEW_GROUP, groupId);
        return store.findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));
    }

    /** All groups for superadmins, otherwise the groups the caller is a member of. */
    public List<Group> listGroups(CallerIdentity caller) {
        if (RoleChecker.isSuperadmin(caller)) {
            return store.listGroups();
        }
        List<String> ids = store.listMembershipsForSubject(caller.subjectId()).stream()
                .map(Membership::groupId)
                .toList();
        return ids.isEmpty() ? List.of() : store.getGroups(ids);
    }

    /** Groups where the caller is admin; every group for superadmins. */
    public List<Group> adminGroups(CallerIdentity caller) {
        return engine.adminGroups(caller);
    }

    /** Applies the non-null fields. Name and description carry no authorization data. */
    public Group updateGroup(CallerIdentity caller, String groupId, String name, String description) {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Authorizations.requireGroupAction(engine, caller, Action.UPDATE_GROUP, groupId);
        Group current = store.findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));
        Group updated = store.updateGroup(
                current.withChanges(name != null ? name.strip() : null, description, clock.instant()));
        log.info("Updated group {} by {}", groupId, caller.subjectId());
        return updated;
    }

    public void deleteGroup(CallerIdentity caller, String groupId) {
        guard.deleteGroup(caller, groupId);
    }
}
