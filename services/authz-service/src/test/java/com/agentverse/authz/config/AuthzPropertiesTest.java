package com.agentverse.authz.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the compact-constructor defaults of {@link AuthzProperties}.
 */
@DisplayName("AuthzProperties")
class AuthzPropertiesTest {

    @Test
    @DisplayName("fills every section with defaults when nothing is configured")
    void defaults() {
        var props = new AuthzProperties(null, null, null, null, null, null);

        assertThat(props.superadminRole()).isEqualTo("agentverse-superadmin");
        assertThat(props.policy()).isEmpty();
        assertThat(props.cache().provider()).isEqualTo(AuthzProperties.CacheProvider.CAFFEINE);
        assertThat(props.cache().ttl()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.cache().maxEntries()).isEqualTo(100_000);
        assertThat(props.cache().redis().host()).isEqualTo("localhost");
        assertThat(props.cache().redis().port()).isEqualTo(6379);
        assertThat(props.store().timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.store().threads()).isEqualTo(16);
        assertThat(props.mutation().lockTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.cors().allowedOrigins()).contains("http://localhost:3000");
    }

    @Test
    @DisplayName("keeps explicit values and replaces non-positive ones")
    void explicitValues() {
        var cache = new AuthzProperties.Cache(AuthzProperties.CacheProvider.REDIS, Duration.ZERO, -1,
                new AuthzProperties.Redis("redis.internal", 0, "secret", null, 8));
        var props = new AuthzProperties("platform-admin", Map.of("list-members", "user"), cache,
                new AuthzProperties.Store(Duration.ofMillis(300), 4), null,
                new AuthzProperties.Cors(List.of("https://app.example.com")));

        assertThat(props.superadminRole()).isEqualTo("platform-admin");
        assertThat(props.policy()).containsEntry("list-members", "user");
        assertThat(props.cache().provider()).isEqualTo(AuthzProperties.CacheProvider.REDIS);
        assertThat(props.cache().ttl()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.cache().redis().host()).isEqualTo("redis.internal");
        assertThat(props.cache().redis().port()).isEqualTo(6379);
        assertThat(props.cache().redis().poolSize()).isEqualTo(8);
        assertThat(props.store().timeout()).isEqualTo(Duration.ofMillis(300));
        assertThat(props.cors().allowedOrigins()).containsExactly("https://app.example.com");
    }
}
