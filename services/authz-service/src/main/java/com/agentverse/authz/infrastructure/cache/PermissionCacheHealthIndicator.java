package com.agentverse.authz.infrastructure.cache;

import com.agentverse.authz.domain.cache.PermissionCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports the permission cache as DOWN when its backend cannot be reached. Authorization
 * still works in that state, but every check resolves to deny.
 */
public class PermissionCacheHealthIndicator implements HealthIndicator {

    private final PermissionCache cache;
    private final String provider;

    public PermissionCacheHealthIndicator(PermissionCache cache, String provider) {
        this.cache = cache;
        this.provider = provider;
    }

    @Override
    public Health health() {
        try {
            cache.ping();
        } catch (RuntimeException e) {
            return Health.down(e).withDetail("provider", provider).build();
        }
        Health.Builder builder = Health.up().withDetail("provider", provider);
        if (cache instanceof CaffeinePermissionCache caffeine) {
            builder.withDetail("entries", caffeine.estimatedSize());
        }
        return builder.build();
    }
}
