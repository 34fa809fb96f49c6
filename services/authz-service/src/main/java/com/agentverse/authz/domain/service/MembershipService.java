package com.agentverse.authz.domain.service;

import com.agentverse.authz.domain.authorization.AuthorizationEngine;
import com.agentverse.authz.domain.error.NotFoundException;
import com.agentverse.authz.domain.model.MemberView;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.model.User;
import com.agentverse.authz.domain.mutation.MutationGuard;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.GroupRole;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Group membership listing and changes. Changes go through the {@link MutationGuard}.
 */
public class MembershipService {

    private final ResourceStore store;
    private final AuthorizationEngine engine;
    private final MutationGuard guard;

    public MembershipService(ResourceStore store, AuthorizationEngine engine, MutationGuard guard) {
        this.store = store;
        this.engine = engine;
        this.guard = guard;
    }

    /** Members of the group joined with their profiles, admins first. */
    public List<MemberView> listMembers(CallerIdentity caller, String groupId) {
        Authorizations.requireGroupAction(engine, caller, Action.LIST_MEMBERS, groupId);
        store.findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));
        List<Membership> memberships = store.listMemberships(groupId);
        Map<String, User> users = store.getUsers(memberships.stream().map(Membership::subjectId).toList())
                .stream()
                .collect(Collectors.toMap(User::id, Function.identity()));
        return memberships.stream()
                .sorted(Comparator.comparing((Membership m) -> !m.isAdmin()).thenComparing(Membership::subjectId))
                .map(m -> {
                    User user = users.get(m.subjectId());
                    return new MemberView(m.subjectId(),
                            user != null ? user.displayName() : "",
                            user != null ? user.email() : "",
                            m.role(), m.createdAt());
                })
                .toList();
    }

    public Membership addMember(CallerIdentity caller, String groupId, String userId, GroupRole role) {
        return guard.addMember(caller, groupId, userId, role);
    }

    public Membership updateMemberRole(CallerIdentity caller, String groupId, String userId, GroupRole role) {
        return guard.updateMemberRole(caller, groupId, userId, role);
    }

    public void removeMember(CallerIdentity caller, String groupId, String userId) {
        guard.removeMember(caller, groupId, userId);
    }
}
