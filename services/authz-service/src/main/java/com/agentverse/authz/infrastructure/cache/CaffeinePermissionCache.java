package com.agentverse.authz.infrastructure.cache;

import com.agentverse.authz.domain.cache.CacheKey;
import com.agentverse.authz.domain.cache.CacheStamp;
import com.agentverse.authz.domain.cache.InvalidationScope;
import com.agentverse.authz.domain.cache.PermissionCache;
import com.agentverse.authz.domain.cache.PermissionValue;
import com.agentverse.authz.domain.cache.ScopeType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link PermissionCache} on Caffeine, with a TTL per entry.
 *
 * <p>Scope invalidation scans the key set. Generation counters live in a plain map and are
 * never evicted, so a stamp can never match a counter that was reset. Only invalidation creates
 * a counter; taking a stamp reads an absent counter as zero.
 */
public class CaffeinePermissionCache implements PermissionCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeinePermissionCache.class);

    private final Cache<String, Entry> entries;
    private final ConcurrentMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    private record Entry(CacheKey key, PermissionValue value, Duration ttl) {
    }

    public CaffeinePermissionCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    CaffeinePermissionCache(long maximumSize, Ticker ticker) {
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<PermissionValue> get(CacheKey key) {
        return Optional.ofNullable(entries.getIfPresent(key.render())).map(Entry::value);
    }

    @Override
    public CacheStamp stamp(CacheKey key) {
        return new CacheStamp(
                currentGeneration(InvalidationScope.generationName(ScopeType.SUBJECT, key.subjectId())),
                currentGeneration(InvalidationScope.generationName(key.scopeType(), key.scopeId())));
    }

    @Override
    public boolean putIfUnchanged(CacheKey key, PermissionValue value, Duration ttl, CacheStamp stamp) {
        if (!stamp.equals(stamp(key))) {
            return false;
        }
        String rendered = key.render();
        Entry entry = new Entry(key, value, ttl);
        entries.put(rendered, entry);
        // an invalidation may have bumped the generation after the check but scanned before the put
        if (!stamp.equals(stamp(key))) {
            entries.asMap().remove(rendered, entry);
            return false;
        }
        return true;
    }

    @Override
    public void invalidate(InvalidationScope scope) {
        generation(scope.generationName()).incrementAndGet();
        int before = entries.asMap().size();
        entries.asMap().values().removeIf(entry -> scope.covers(entry.key()));
        if (log.isDebugEnabled()) {
            log.debug("Invalidated {} {} ({} entries before)", scope.type(), scope.id(), before);
        }
    }

    @Override
    public void ping() {
        entries.cleanUp();
    }

    public long estimatedSize() {
        return entries.estimatedSize();
    }

    /** Number of generation counters held; one per scope that was ever invalidated. */
    public int generationCount() {
        return generations.size();
    }

    private long currentGeneration(String name) {
        AtomicLong counter = generations.get(name);
        return counter == null ? 0L : counter.get();
    }

    private AtomicLong generation(String name) {
        return generations.computeIfAbsent(name, n -> new AtomicLong());
    }
}
