package com.agentverse.authz.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Authorization settings, bound from {@code agentverse.authz.*}.
 *
 * <pre>
 * agentverse:
 *   authz:
 *     superadmin-role: agentverse-superadmin
 *     policy:
 *       manage-agents: admin
 *     cache:
 *       provider: redis
 *       ttl: 60s
 *       redis:
 *         host: redis.internal
 *     store:
 *       timeout: 2s
 *     mutation:
 *       lock-timeout: 2s
 * </pre>
 *
 * @param superadminRole role claim value that grants superadmin
 * @param policy action to minimum role overrides, applied on top of the built-in table
 */
@ConfigurationProperties(prefix = "agentverse.authz")
@Validated
public record AuthzProperties(
        @NotBlank String superadminRole,
        Map<String, String> policy,
        @Valid Cache cache,
        @Valid Store store,
        @Valid Mutation mutation,
        @Valid Cors cors) {

    public AuthzProperties {
        if (superadminRole == null || superadminRole.isBlank()) {
            superadminRole = "agentverse-superadmin";
        }
        policy = policy == null ? Map.of() : Map.copyOf(policy);
        cache = cache == null ? new Cache(null, null, 0, null) : cache;
        store = store == null ? new Store(null, 0) : store;
        mutation = mutation == null ? new Mutation(null) : mutation;
        cors = cors == null ? new Cors(null) : cors;
    }

    /** Which cache backs permission checks. */
    public enum CacheProvider {
        CAFFEINE,
        REDIS
    }

    /**
     * @param ttl safety-net expiry of every entry; invalidation is the primary mechanism
     * @param maxEntries bound of the in-process cache
     */
    public record Cache(CacheProvider provider, Duration ttl, long maxEntries, @Valid Redis redis) {

        public Cache {
            if (provider == null) {
                provider = CacheProvider.CAFFEINE;
            }
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                ttl = Duration.ofSeconds(60);
            }
            if (maxEntries <= 0) {
                maxEntries = 100_000;
            }
            if (redis == null) {
                redis = new Redis(null, 0, null, null, 0);
            }
        }
    }

    public record Redis(String host, int port, String password, Duration timeout, int poolSize) {

        public Redis {
            if (host == null || host.isBlank()) {
                host = "localhost";
            }
            if (port <= 0) {
                port = 6379;
            }
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofMillis(500);
            }
            if (poolSize <= 0) {
                poolSize = 32;
            }
        }
    }

    /**
     * @param timeout bound on every store call
     * @param threads size of the pool store calls run on
     */
    public record Store(Duration timeout, int threads) {

        public Store {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofSeconds(2);
            }
            if (threads <= 0) {
                threads = 16;
            }
        }
    }

    /** @param lockTimeout how long a mutation waits for its group lock */
    public record Mutation(Duration lockTimeout) {

        public Mutation {
            if (lockTimeout == null || lockTimeout.isNegative()) {
                lockTimeout = Duration.ofSeconds(2);
            }
        }
    }

    public record Cors(List<String> allowedOrigins) {

        public Cors {
            allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                    ? List.of("http://localhost:3000", "http://localhost:5173")
                    : List.copyOf(allowedOrigins);
        }
    }
}
