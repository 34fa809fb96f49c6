package com.agentverse.authz.config;

import com.agentverse.authz.domain.authorization.AuthorizationEngine;
import com.agentverse.authz.domain.authorization.AuthorizationObserver;
import com.agentverse.authz.domain.cache.PermissionCache;
import com.agentverse.authz.domain.mutation.GroupLocks;
import com.agentverse.authz.domain.mutation.MutationGuard;
import com.agentverse.authz.domain.policy.ActionPolicy;
import com.agentverse.authz.domain.service.AdminService;
import com.agentverse.authz.domain.service.AgentService;
import com.agentverse.authz.domain.service.GroupService;
import com.agentverse.authz.domain.service.MembershipService;
import com.agentverse.authz.domain.service.PermissionService;
import com.agentverse.authz.domain.service.UserService;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.authz.infrastructure.cache.CaffeinePermissionCache;
import com.agentverse.authz.infrastructure.cache.PermissionCacheHealthIndicator;
import com.agentverse.authz.infrastructure.cache.PermissionValueCodec;
import com.agentverse.authz.infrastructure.cache.RedisPermissionCache;
import com.agentverse.authz.infrastructure.metrics.MicrometerAuthorizationObserver;
import com.agentverse.authz.infrastructure.store.InMemoryResourceStore;
import com.agentverse.authz.infrastructure.store.InstrumentedResourceStore;
import com.agentverse.observability.MetricFactory;
import com.agentverse.observability.SpanHelper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/**
 * Wires the authorization core: store, cache, engine, guard and the domain services.
 *
 * <p>The domain classes carry no Spring annotations; every one of them is created here.
 */
@Configuration
public class AuthzConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AuthzConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SpanHelper spanHelper(ServiceProperties service) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(service.name()));
    }

    @Bean
    public AuthorizationObserver authorizationObserver(MetricFactory metricFactory) {
        return new MicrometerAuthorizationObserver(metricFactory);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService storeExecutor(AuthzProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "authz-store-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.store().threads(), threads);
    }

    @Bean
    public ResourceStore resourceStore(
            AuthzProperties properties, ExecutorService storeExecutor, SpanHelper spanHelper) {
        log.info("Using in-memory resource store (timeout {})", properties.store().timeout());
        return new InstrumentedResourceStore(
                new InMemoryResourceStore(), storeExecutor, properties.store().timeout(), spanHelper);
    }

    @Bean
    public PermissionCache permissionCache(
            AuthzProperties properties, ObjectMapper objectMapper, MetricFactory metricFactory) {
        AuthzProperties.Cache cache = properties.cache();
        if (cache.provider() == AuthzProperties.CacheProvider.REDIS) {
            AuthzProperties.Redis redis = cache.redis();
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(redis.poolSize());
            poolConfig.setTestWhileIdle(true);
            int timeoutMillis = (int) redis.timeout().toMillis();
            JedisPool pool = redis.password() == null || redis.password().isBlank()
                    ? new JedisPool(poolConfig, redis.host(), redis.port(), timeoutMillis)
                    : new JedisPool(poolConfig, redis.host(), redis.port(), timeoutMillis, redis.password());
            log.info("Using Redis permission cache at {}:{} (ttl {})", redis.host(), redis.port(), cache.ttl());
            return new RedisPermissionCache(pool, new PermissionValueCodec(objectMapper));
        }
        log.info("Using in-process permission cache (ttl {}, max {} entries)", cache.ttl(), cache.maxEntries());
        CaffeinePermissionCache local = new CaffeinePermissionCache(cache.maxEntries());
        metricFactory.gauge("authz.cache.size", "Entries in the in-process permission cache",
                local, CaffeinePermissionCache::estimatedSize);
        metricFactory.gauge("authz.cache.generations", "Generation counters of invalidated scopes",
                local, CaffeinePermissionCache::generationCount);
        return local;
    }

    @Bean
    public PermissionCacheHealthIndicator permissionCacheHealthIndicator(
            PermissionCache permissionCache, AuthzProperties properties) {
        return new PermissionCacheHealthIndicator(
                permissionCache, properties.cache().provider().name().toLowerCase(Locale.ROOT));
    }

    @Bean
    public ActionPolicy actionPolicy(AuthzProperties properties) {
        ActionPolicy policy = ActionPolicy.fromConfig(properties.policy());
        log.info("Authorization policy: {}", policy.asMap());
        return policy;
    }

    @Bean
    public AuthorizationEngine authorizationEngine(
            ResourceStore store,
            PermissionCache cache,
            ActionPolicy policy,
            AuthzProperties properties,
            AuthorizationObserver observer) {
        return new AuthorizationEngine(store, cache, policy, properties.cache().ttl(), observer);
    }

    @Bean
    public GroupLocks groupLocks(AuthzProperties properties) {
        return new GroupLocks(properties.mutation().lockTimeout());
    }

    @Bean
    public MutationGuard mutationGuard(
            ResourceStore store,
            PermissionCache cache,
            AuthorizationEngine engine,
            GroupLocks locks,
            Clock clock,
            AuthorizationObserver observer) {
        return new MutationGuard(store, cache, engine, locks, clock, observer);
    }

    @Bean
    public UserService userService(ResourceStore store, Clock clock) {
        return new UserService(store, clock);
    }

    @Bean
    public PermissionService permissionService(AuthorizationEngine engine) {
        return new PermissionService(engine);
    }

    @Bean
    public GroupService groupService(
            ResourceStore store, AuthorizationEngine engine, MutationGuard guard, Clock clock) {
        return new GroupService(store, engine, guard, clock);
    }

    @Bean
    public MembershipService membershipService(
            ResourceStore store, AuthorizationEngine engine, MutationGuard guard) {
        return new MembershipService(store, engine, guard);
    }

    @Bean
    public AgentService agentService(
            ResourceStore store, AuthorizationEngine engine, MutationGuard guard, Clock clock) {
        return new AgentService(store, engine, guard, clock);
    }

    @Bean
    public AdminService adminService(ResourceStore store, MutationGuard guard) {
        return new AdminService(store, guard);
    }
}
