package com.agentverse.authz.infrastructure.cache;

import com.agentverse.authz.domain.cache.CacheKey;
import com.agentverse.authz.domain.cache.CacheStamp;
import com.agentverse.authz.domain.cache.InvalidationScope;
import com.agentverse.authz.domain.cache.PermissionCache;
import com.agentverse.authz.domain.cache.PermissionValue;
import com.agentverse.authz.domain.cache.ScopeType;
import com.agentverse.authz.domain.error.UnavailableException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

/**
 * {@link PermissionCache} on Redis, shared by every service instance.
 *
 * <p>Entries are JSON strings written with {@code SET ... EX}. Generation counters are plain
 * {@code INCR} keys under a separate prefix; {@link #putIfUnchanged} watches both counters of
 * the key so the write aborts if an invalidation lands in between. Scope invalidation bumps
 * the counter, then deletes the matching keys with {@code SCAN MATCH}.
 */
public class RedisPermissionCache implements PermissionCache, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisPermissionCache.class);

    static final String GENERATION_PREFIX = "authz:gen:v1:";
    private static final int SCAN_COUNT = 500;

    private final JedisPool pool;
    private final PermissionValueCodec codec;

    public RedisPermissionCache(JedisPool pool, PermissionValueCodec codec) {
        this.pool = pool;
        this.codec = codec;
    }

    @Override
    public Optional<PermissionValue> get(CacheKey key) {
        return withJedis("GET", jedis -> codec.decode(jedis.get(key.render())));
    }

    @Override
    public CacheStamp stamp(CacheKey key) {
        return withJedis("MGET", jedis -> toStamp(jedis.mget(subjectGenerationKey(key), scopeGenerationKey(key))));
    }

    @Override
    public boolean putIfUnchanged(CacheKey key, PermissionValue value, Duration ttl, CacheStamp stamp) {
        String subjectGeneration = subjectGenerationKey(key);
        String scopeGeneration = scopeGenerationKey(key);
        String payload = codec.encode(value);
        long seconds = Math.max(1, ttl.toSeconds());
        return withJedis("SET", jedis -> {
            jedis.watch(subjectGeneration, scopeGeneration);
            if (!stamp.equals(toStamp(jedis.mget(subjectGeneration, scopeGeneration)))) {
                jedis.unwatch();
                return false;
            }
            Transaction tx = jedis.multi();
            tx.setex(key.render(), seconds, payload);
            List<Object> result = tx.exec();
            return result != null && !result.isEmpty();
        });
    }

    @Override
    public void invalidate(InvalidationScope scope) {
        String pattern = pattern(scope);
        withJedis("INVALIDATE", jedis -> {
            jedis.incr(GENERATION_PREFIX + scope.generationName());
            ScanParams params = new ScanParams().match(pattern).count(SCAN_COUNT);
            String cursor = ScanParams.SCAN_POINTER_START;
            long deleted = 0;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                List<String> keys = page.getResult();
                if (!keys.isEmpty()) {
                    deleted += jedis.del(keys.toArray(new String[0]));
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            log.debug("Invalidated {} {}: {} keys", scope.type(), scope.id(), deleted);
            return null;
        });
    }

    @Override
    public void ping() {
        withJedis("PING", Jedis::ping);
    }

    @Override
    public void close() {
        pool.close();
    }

    /** Glob matching every rendered key in the scope. Ids are escaped, so they add no wildcards. */
    static String pattern(InvalidationScope scope) {
        String id = CacheKey.escape(scope.id());
        return switch (scope.type()) {
            case SUBJECT -> CacheKey.PREFIX + ":" + id + ":*";
            case GROUP, AGENT -> CacheKey.PREFIX + ":*:" + scope.type().name() + ":" + id + ":*";
        };
    }

    private static String subjectGenerationKey(CacheKey key) {
        return GENERATION_PREFIX + InvalidationScope.generationName(ScopeType.SUBJECT, key.subjectId());
    }

    private static String scopeGenerationKey(CacheKey key) {
        return GENERATION_PREFIX + InvalidationScope.generationName(key.scopeType(), key.scopeId());
    }

    private static CacheStamp toStamp(List<String> values) {
        return new CacheStamp(parse(values.get(0)), parse(values.get(1)));
    }

    private static long parse(String value) {
        return value == null ? 0L : Long.parseLong(value);
    }

    private <T> T withJedis(String command, Function<Jedis, T> work) {
        try (Jedis jedis = pool.getResource()) {
            return work.apply(jedis);
        } catch (JedisException e) {
            log.warn("Redis {} failed: {}", command, e.getMessage());
            throw new UnavailableException("Permission cache unavailable (" + command + ")", e);
        }
    }
}
