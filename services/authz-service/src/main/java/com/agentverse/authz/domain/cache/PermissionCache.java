package com.agentverse.authz.domain.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value cache of permission checks with per-entry TTL and scope invalidation.
 * <p>
 * Invalidation is the consistency mechanism; the TTL only bounds the damage of a missed
 * invalidation. Every method throws
 * {@link com.agentverse.authz.domain.error.UnavailableException} when the backing
 * store cannot be reached.
 */
public interface PermissionCache {

    /** Returns the cached value, or empty on a miss. */
    Optional<PermissionValue> get(CacheKey key);

    /**
     * Captures the current invalidation generations for the key. Must be called before
     * the store read whose result will be written back.
     */
    CacheStamp stamp(CacheKey key);

    /**
     * Stores the value unless an invalidation touching the key happened since the stamp
     * was taken.
     *
     * @return true if the value was stored
     */
    boolean putIfUnchanged(CacheKey key, PermissionValue value, Duration ttl, CacheStamp stamp);

    /**
     * Removes every entry in the scope and bumps its generation. Returns only once the
     * removal is confirmed.
     */
    void invalidate(InvalidationScope scope);

    /** Cheap liveness check, throws when the cache is unreachable. */
    void ping();
}
