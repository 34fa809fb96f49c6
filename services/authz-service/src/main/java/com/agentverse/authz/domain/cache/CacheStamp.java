package com.agentverse.authz.domain.cache;

/**
 * Invalidation generations observed for a key before its value was read from the store.
 * <p>
 * A write-back with a stamp whose generations no longer match is dropped, so a read
 * that raced with a mutation cannot re-populate the cache with pre-mutation data.
 */
public record CacheStamp(long subjectGeneration, long scopeGeneration) {
}
