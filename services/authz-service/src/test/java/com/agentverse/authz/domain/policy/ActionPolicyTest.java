package com.agentverse.authz.domain.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.agentverse.security.GroupRole;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ActionPolicy")
class ActionPolicyTest {

    @Nested
    @DisplayName("defaults()")
    class Defaults {

        @Test
        @DisplayName("covers every action")
        void complete() {
            assertThat(ActionPolicy.defaults().asMap()).containsOnlyKeys(Action.values());
        }

        @ParameterizedTest(name = "{0} needs {1}")
        @CsvSource({
            "VIEW_GROUP, USER",
            "READ_AGENT_VISIBILITY, USER",
            "ACCESS_AGENT, USER",
            "CREATE_AGENT, ADMIN",
            "LIST_MEMBERS, ADMIN",
            "MANAGE_MEMBERS, ADMIN",
            "MANAGE_AGENTS, ADMIN",
            "UPDATE_GROUP, ADMIN",
            "DELETE_GROUP, ADMIN"
        })
        void requirement(Action action, GroupRole role) {
            assertThat(ActionPolicy.defaults().requiredRole(action)).contains(role);
        }
    }

    @Nested
    @DisplayName("fromConfig()")
    class FromConfig {

        @Test
        @DisplayName("overrides individual entries by kebab-case name")
        void overrides() {
            ActionPolicy policy = ActionPolicy.fromConfig(Map.of("list-members", "user"));

            assertThat(policy.requiredRole(Action.LIST_MEMBERS)).contains(GroupRole.USER);
            assertThat(policy.requiredRole(Action.DELETE_GROUP)).contains(GroupRole.ADMIN);
        }

        @Test
        @DisplayName("null config yields the defaults")
        void nullConfig() {
            assertThat(ActionPolicy.fromConfig(null).asMap()).isEqualTo(ActionPolicy.defaults().asMap());
        }

        @Test
        @DisplayName("unknown action or role fails fast")
        void invalid() {
            assertThatThrownBy(() -> ActionPolicy.fromConfig(Map.of("fly", "admin")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("fly");
            assertThatThrownBy(() -> ActionPolicy.fromConfig(Map.of("view-group", "owner")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("owner");
        }
    }

    @Test
    @DisplayName("explicit table leaves other actions without a requirement")
    void explicitTable() {
        ActionPolicy policy = ActionPolicy.of(Map.of(Action.VIEW_GROUP, GroupRole.USER));

        assertThat(policy.requiredRole(Action.VIEW_GROUP)).contains(GroupRole.USER);
        assertThat(policy.requiredRole(Action.DELETE_GROUP)).isEmpty();
        assertThat(ActionPolicy.of(Map.of()).asMap()).isEmpty();
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
        "access-agent, ACCESS_AGENT",
        "ACCESS_AGENT, ACCESS_AGENT",
        "access, ACCESS_AGENT",
        "create, CREATE_AGENT",
        "' Manage-Members ', MANAGE_MEMBERS"
    })
    @DisplayName("Action.fromString accepts kebab, enum and short forms")
    void parsesActions(String raw, Action expected) {
        assertThat(Action.fromString(raw)).contains(expected);
    }

    @Test
    @DisplayName("Action.fromString rejects unknown values")
    void rejectsUnknown() {
        assertThat(Action.fromString("fly")).isEmpty();
        assertThat(Action.fromString(null)).isEmpty();
    }
}
