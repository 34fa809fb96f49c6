package com.agentverse.authz;

import com.agentverse.authz.domain.authorization.AuthorizationEngine;
import com.agentverse.authz.domain.authorization.AuthorizationObserver;
import com.agentverse.authz.domain.cache.PermissionCache;
import com.agentverse.authz.domain.model.Agent;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.GroupAgent;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.mutation.GroupLocks;
import com.agentverse.authz.domain.mutation.MutationGuard;
import com.agentverse.authz.domain.policy.ActionPolicy;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.authz.infrastructure.cache.CaffeinePermissionCache;
import com.agentverse.authz.infrastructure.store.InMemoryResourceStore;
import com.agentverse.security.GroupRole;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Engine and guard wired over the in-memory store and Caffeine cache, with seeding helpers
 * that write straight to the store.
 */
public final class AuthzFixture {

    public static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    public static final Duration TTL = Duration.ofSeconds(60);

    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final ResourceStore store;
    public final PermissionCache cache;
    public final AuthorizationEngine engine;
    public final MutationGuard guard;

    public AuthzFixture() {
        this(new InMemoryResourceStore(), new CaffeinePermissionCache(10_000));
    }

    public AuthzFixture(ResourceStore store, PermissionCache cache) {
        this(store, cache, Duration.ofSeconds(1), AuthorizationObserver.NOOP);
    }

    public AuthzFixture(ResourceStore store, PermissionCache cache, Duration lockTimeout,
                        AuthorizationObserver observer) {
        this.store = store;
        this.cache = cache;
        this.engine = new AuthorizationEngine(store, cache, ActionPolicy.defaults(), TTL, observer);
        this.guard = new MutationGuard(store, cache, engine, new GroupLocks(lockTimeout), clock, observer);
    }

    public Group group(String id) {
        return store.insertGroup(new Group(id, "Group " + id, "", NOW, NOW));
    }

    public Membership member(String groupId, String subjectId, GroupRole role) {
        return store.insertMembership(new Membership(subjectId, groupId, role, NOW));
    }

    public Agent agent(String id) {
        return store.insertAgent(new Agent(id, "ext-" + id, "Agent " + id, "root", NOW));
    }

    public GroupAgent link(String groupId, String agentId) {
        return store.insertGroupAgent(new GroupAgent(groupId, agentId, "root", NOW));
    }
}
