package com.agentverse.authz.domain.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.agentverse.authz.domain.policy.Action;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CacheKey")
class CacheKeyTest {

    @Test
    @DisplayName("renders a stable, versioned layout per kind")
    void renders() {
        assertThat(CacheKey.role("s1", "g1").render()).isEqualTo("authz:v1:s1:GROUP:g1:ROLE");
        assertThat(CacheKey.agentAction("s1", "a1", Action.ACCESS_AGENT).render())
                .isEqualTo("authz:v1:s1:AGENT:a1:AGENT_ACTION:access-agent");
        assertThat(CacheKey.visibleAgents("s1").render()).isEqualTo("authz:v1:s1:SUBJECT:s1:VISIBLE_AGENTS");
        assertThat(CacheKey.adminGroups("s1").render()).isEqualTo("authz:v1:s1:SUBJECT:s1:ADMIN_GROUPS");
    }

    @Test
    @DisplayName("equal inputs give equal keys; different actions give different keys")
    void deterministic() {
        assertThat(CacheKey.role("s1", "g1")).isEqualTo(CacheKey.role("s1", "g1"));
        assertThat(CacheKey.agentAction("s1", "a1", Action.ACCESS_AGENT).render())
                .isNotEqualTo(CacheKey.agentAction("s1", "a1", Action.MANAGE_AGENTS).render());
    }

    @Test
    @DisplayName("separators and glob characters in ids are escaped")
    void escapes() {
        assertThat(CacheKey.escape("a:b*c?[d]%\\")).isEqualTo("a%3Ab%2Ac%3F%5Bd%5D%25%5C");
        assertThat(CacheKey.role("s:1", "g1").render()).isNotEqualTo(CacheKey.role("s", "1:g1").render());
    }

    @Test
    @DisplayName("null parts are rejected")
    void nulls() {
        assertThatThrownBy(() -> CacheKey.role(null, "g1")).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("scopes cover the keys they name")
    void covers() {
        CacheKey role = CacheKey.role("s1", "g1");
        CacheKey agent = CacheKey.agentAction("s1", "a1", Action.ACCESS_AGENT);

        assertThat(InvalidationScope.subject("s1").covers(role)).isTrue();
        assertThat(InvalidationScope.subject("s1").covers(agent)).isTrue();
        assertThat(InvalidationScope.group("g1").covers(role)).isTrue();
        assertThat(InvalidationScope.group("g1").covers(agent)).isFalse();
        assertThat(InvalidationScope.agent("a1").covers(agent)).isTrue();
        assertThat(InvalidationScope.agent("g1").covers(role)).isFalse();
        assertThat(InvalidationScope.group("g1").generationName()).isEqualTo("group:g1");
    }
}
