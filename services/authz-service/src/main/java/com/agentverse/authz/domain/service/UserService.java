package com.agentverse.authz.domain.service;

import com.agentverse.authz.domain.model.User;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.security.CallerIdentity;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the local user profile in step with the caller's identity claims.
 */
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final ResourceStore store;
    private final Clock clock;

    public UserService(ResourceStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Upserts the caller's profile. Writes only when the display name or email changed.
     */
    public User sync(CallerIdentity identity) {
        String name = identity.displayName() != null ? identity.displayName() : "";
        String email = identity.email() != null ? identity.email() : "";
        Optional<User> existing = store.findUser(identity.subjectId());
        if (existing.isPresent()
                && Objects.equals(existing.get().displayName(), name)
                && Objects.equals(existing.get().email(), email)) {
            return existing.get();
        }
        Instant now = clock.instant();
        Instant createdAt = existing.map(User::createdAt).orElse(now);
        User user = store.upsertUser(new User(identity.subjectId(), name, email, createdAt, now));
        log.debug("Synced profile of {}", identity.subjectId());
        return user;
    }

    public Optional<User> find(String userId) {
        return store.findUser(userId);
    }
}
