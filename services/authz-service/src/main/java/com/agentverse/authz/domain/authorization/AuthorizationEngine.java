package com.agentverse.authz.domain.authorization;

import com.agentverse.authz.domain.cache.CacheKey;
import com.agentverse.authz.domain.cache.CacheStamp;
import com.agentverse.authz.domain.cache.PermissionCache;
import com.agentverse.authz.domain.cache.PermissionValue;
import com.agentverse.authz.domain.error.AccessDeniedException;
import com.agentverse.authz.domain.error.AuthzException;
import com.agentverse.authz.domain.error.UnavailableException;
import com.agentverse.authz.domain.model.Agent;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.GroupAgent;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.authz.domain.policy.ActionPolicy;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.CallerIdentityValidator;
import com.agentverse.security.EffectiveRole;
import com.agentverse.security.GroupRole;
import com.agentverse.security.RoleChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Decides whether a caller may perform an action on a group or agent, and resolves the
 * caller's effective role per group.
 * <p>
 * Reads go cache first, then the {@link ResourceStore}; store results are written back
 * with the stamp taken before the read. The engine is fail-closed: a malformed
 * identity, a missing policy entry, an unknown resource or any dependency failure yields
 * a denial, never an allow. Each group is evaluated on its own; roles held in different
 * groups are never combined.
 * <p>
 * Superadmin status is read from the identity of every call and never cached.
 */
public class AuthorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    private final ResourceStore store;
    private final PermissionCache cache;
    private final ActionPolicy policy;
    private final Duration ttl;
    private final AuthorizationObserver observer;

    public AuthorizationEngine(ResourceStore store, PermissionCache cache, ActionPolicy policy,
                               Duration ttl, AuthorizationObserver observer) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.store = store;
        this.cache = cache;
        this.policy = policy;
        this.ttl = ttl;
        this.observer = observer != null ? observer : AuthorizationObserver.NOOP;
    }

    /** True iff the caller's claims assert superadmin. No store or cache access. */
    public boolean isSuperadmin(CallerIdentity identity) {
        return RoleChecker.isSuperadmin(identity);
    }

    /**
     * Role the subject holds in the group according to its membership row. Resolves to
     * {@link EffectiveRole#NONE} when the subject has no membership, the group does not
     * exist, or the store or cache cannot be reached.
     */
    public EffectiveRole roleInGroup(String subjectId, String groupId) {
        if (isBlank(subjectId) || isBlank(groupId)) {
            return EffectiveRole.NONE;
        }
        try {
            return resolveRole(subjectId, groupId);
        } catch (RuntimeException e) {
            log.warn("Role lookup failed for subject={} group={}, resolving to none: {}",
                    subjectId, groupId, e.getMessage());
            return EffectiveRole.NONE;
        }
    }

    /**
     * Effective role of the caller in the group: ADMIN for superadmins (computed, never
     * stored as a membership), otherwise {@link #roleInGroup}.
     */
    public EffectiveRole effectiveRole(CallerIdentity identity, String groupId) {
        if (!CallerIdentityValidator.isValid(identity)) {
            return EffectiveRole.NONE;
        }
        if (isSuperadmin(identity)) {
            return EffectiveRole.ADMIN;
        }
        return roleInGroup(identity.subjectId(), groupId);
    }

    /**
     * Decides whether the caller may perform the action on the resource.
     */
    public Decision authorize(CallerIdentity identity, Action action, ResourceRef resource) {
        long start = System.nanoTime();
        Decision decision;
        if (!CallerIdentityValidator.isValid(identity)) {
            decision = Decision.deny("malformed identity");
        } else if (isSuperadmin(identity)) {
            decision = Decision.allowSuperadmin();
        } else {
            decision = decide(identity.subjectId(), action, resource);
        }
        record(action, decision, start);
        return decision;
    }

    /**
     * Answers "may {@code subjectId} perform the action on the agent" on behalf of the
     * caller. Callers may ask about themselves; superadmins may ask about anyone. The
     * subject's own memberships decide; the caller's superadmin claim does not carry over
     * to the subject.
     */
    public Decision checkPermission(CallerIdentity caller, String subjectId, Action action, String agentId) {
        long start = System.nanoTime();
        Decision decision;
        if (!CallerIdentityValidator.isValid(caller)) {
            decision = Decision.deny("malformed identity");
        } else if (isBlank(subjectId)) {
            decision = Decision.deny("missing subject");
        } else if (subjectId.equals(caller.subjectId())) {
            decision = isSuperadmin(caller)
                    ? Decision.allowSuperadmin()
                    : decide(subjectId, action, ResourceRef.agent(agentId));
        } else if (isSuperadmin(caller)) {
            decision = decide(subjectId, action, ResourceRef.agent(agentId));
        } else {
            decision = Decision.deny("callers may only check their own permissions");
        }
        record(action, decision, start);
        return decision;
    }

    /**
     * Every agent the caller can see: all agents for superadmins, otherwise
     * {@link #visibleAgents(String)}.
     *
     * @throws UnavailableException if the store or cache cannot be reached
     */
    public List<Agent> visibleAgents(CallerIdentity identity) {
        requireValid(identity);
        if (isSuperadmin(identity)) {
            return store.listAgents();
        }
        return visibleAgents(identity.subjectId());
    }

    /**
     * Union of the agents linked to any group the subject is a member of, in any role.
     *
     * @throws UnavailableException if the store or cache cannot be reached
     */
    public List<Agent> visibleAgents(String subjectId) {
        CacheKey key = CacheKey.visibleAgents(subjectId);
        List<String> ids = cachedIds(key).orElseGet(() -> {
            CacheStamp stamp = cache.stamp(key);
            TreeSet<String> agentIds = new TreeSet<>();
            for (Membership membership : store.listMembershipsForSubject(subjectId)) {
                for (GroupAgent link : store.listGroupAgents(membership.groupId())) {
                    agentIds.add(link.agentId());
                }
            }
            List<String> resolved = new ArrayList<>(agentIds);
            cache.putIfUnchanged(key, PermissionValue.ofIds(resolved), ttl, stamp);
            return resolved;
        });
        return ids.isEmpty() ? List.of() : store.getAgents(ids);
    }

    /**
     * Groups where the caller is admin: all groups for superadmins, otherwise
     * {@link #adminGroups(String)}.
     *
     * @throws UnavailableException if the store or cache cannot be reached
     */
    public List<Group> adminGroups(CallerIdentity identity) {
        requireValid(identity);
        if (isSuperadmin(identity)) {
            return store.listGroups();
        }
        return adminGroups(identity.subjectId());
    }

    /**
     * Groups where the subject holds an admin membership.
     *
     * @throws UnavailableException if the store or cache cannot be reached
     */
    public List<Group> adminGroups(String subjectId) {
        CacheKey key = CacheKey.adminGroups(subjectId);
        List<String> ids = cachedIds(key).orElseGet(() -> {
            CacheStamp stamp = cache.stamp(key);
            List<String> groupIds = store.listMembershipsForSubject(subjectId).stream()
                    .filter(Membership::isAdmin)
                    .map(Membership::groupId)
                    .sorted()
                    .toList();
            cache.putIfUnchanged(key, PermissionValue.ofIds(groupIds), ttl, stamp);
            return groupIds;
        });
        return ids.isEmpty() ? List.of() : store.getGroups(ids);
    }

    public ActionPolicy policy() {
        return policy;
    }

    private Decision decide(String subjectId, Action action, ResourceRef resource) {
        Optional<GroupRole> required = policy.requiredRole(action);
        if (required.isEmpty()) {
            return Decision.deny("no policy for action " + (action == null ? "null" : action.value()));
        }
        if (resource == null || !resource.isWellFormed()) {
            return Decision.deny("malformed resource reference");
        }
        try {
            return switch (resource.type()) {
                case GROUP -> decideForGroup(subjectId, resource.id(), required.get());
                case AGENT -> decideForAgent(subjectId, resource.id(), action, required.get());
            };
        } catch (AuthzException e) {
            log.warn("Denying {} on {} {} for subject={}: {} ({})",
                    action.value(), resource.type(), resource.id(), subjectId, e.code(), e.getMessage());
            return Decision.deny(e.code());
        } catch (RuntimeException e) {
            log.error("Unexpected failure deciding {} on {} {} for subject={}, denying",
                    action.value(), resource.type(), resource.id(), subjectId, e);
            return Decision.deny("internal error");
        }
    }

    private Decision decideForGroup(String subjectId, String groupId, GroupRole required) {
        EffectiveRole role = resolveRole(subjectId, groupId);
        if (role.satisfies(required)) {
            return Decision.allow(role, groupId);
        }
        return Decision.deny(role, groupId, role == EffectiveRole.NONE
                ? "not a member of group"
                : "requires " + required.value() + " role");
    }

    private Decision decideForAgent(String subjectId, String agentId, Action action, GroupRole required) {
        CacheKey key = CacheKey.agentAction(subjectId, agentId, action);
        Optional<PermissionValue> cached = lookup(key);
        if (cached.isPresent() && cached.get().allowed() != null) {
            PermissionValue value = cached.get();
            return Boolean.TRUE.equals(value.allowed())
                    ? Decision.allow(value.role(), value.groupId())
                    : Decision.deny(value.role(), value.groupId(), "no group grants access to agent");
        }

        CacheStamp stamp = cache.stamp(key);
        List<GroupAgent> links = new ArrayList<>(store.listGroupsForAgent(agentId));
        links.sort(Comparator.comparing(GroupAgent::groupId));

        Decision decision = Decision.deny("no group grants access to agent");
        for (GroupAgent link : links) {
            EffectiveRole role = resolveRole(subjectId, link.groupId());
            if (role.satisfies(required) && (!decision.allowed() || role == EffectiveRole.ADMIN)) {
                decision = Decision.allow(role, link.groupId());
                if (role == EffectiveRole.ADMIN) {
                    break;
                }
            }
        }
        cache.putIfUnchanged(key,
                PermissionValue.ofDecision(decision.allowed(), decision.role(), decision.groupId()),
                ttl, stamp);
        return decision;
    }

    private EffectiveRole resolveRole(String subjectId, String groupId) {
        CacheKey key = CacheKey.role(subjectId, groupId);
        Optional<PermissionValue> cached = lookup(key);
        if (cached.isPresent() && cached.get().role() != null) {
            return cached.get().role();
        }
        CacheStamp stamp = cache.stamp(key);
        EffectiveRole role = store.getMembership(subjectId, groupId)
                .map(m -> m.role().effective())
                .orElse(EffectiveRole.NONE);
        cache.putIfUnchanged(key, PermissionValue.ofRole(role), ttl, stamp);
        return role;
    }

    private Optional<List<String>> cachedIds(CacheKey key) {
        return lookup(key).map(PermissionValue::resourceIds);
    }

    private Optional<PermissionValue> lookup(CacheKey key) {
        Optional<PermissionValue> value = cache.get(key);
        observer.cacheLookup(key.kind(), value.isPresent());
        return value;
    }

    private void record(Action action, Decision decision, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        observer.decision(action, decision, elapsed);
        if (log.isDebugEnabled()) {
            log.debug("Decision {} for action={} role={} group={} reason={}",
                    decision.outcome(), action == null ? null : action.value(),
                    decision.role().value(), decision.groupId(), decision.reason());
        }
    }

    private static void requireValid(CallerIdentity identity) {
        if (!CallerIdentityValidator.isValid(identity)) {
            throw new AccessDeniedException("malformed identity");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
