package com.agentverse.security;

import com.agentverse.security.testing.TestCallerIdentityFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleChecker")
class RoleCheckerTest {

    @Nested
    @DisplayName("isSuperadmin()")
    class IsSuperadmin {

        @Test
        @DisplayName("true when the superadmin claim was asserted")
        void superadminClaim() {
            assertThat(RoleChecker.isSuperadmin(TestCallerIdentityFactory.superadmin("root"))).isTrue();
        }

        @Test
        @DisplayName("false for regular callers and null identities")
        void regularCaller() {
            assertThat(RoleChecker.isSuperadmin(TestCallerIdentityFactory.user("alice"))).isFalse();
            assertThat(RoleChecker.isSuperadmin(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("hasRole()")
    class HasRole {

        @Test
        @DisplayName("ADMIN satisfies USER check via hierarchy")
        void adminSatisfiesUser() {
            assertThat(RoleChecker.hasRole(EffectiveRole.ADMIN, GroupRole.USER)).isTrue();
        }

        @Test
        @DisplayName("USER does NOT satisfy ADMIN")
        void userDoesNotSatisfyAdmin() {
            assertThat(RoleChecker.hasRole(EffectiveRole.USER, GroupRole.ADMIN)).isFalse();
        }

        @Test
        @DisplayName("null arguments never satisfy")
        void nullsNeverSatisfy() {
            assertThat(RoleChecker.hasRole(null, GroupRole.USER)).isFalse();
            assertThat(RoleChecker.hasRole(EffectiveRole.ADMIN, null)).isFalse();
        }
    }

    @Test
    @DisplayName("hasAnyRole() returns true when one requirement is met")
    void hasAnyRole() {
        assertThat(RoleChecker.hasAnyRole(EffectiveRole.USER, GroupRole.ADMIN, GroupRole.USER)).isTrue();
        assertThat(RoleChecker.hasAnyRole(EffectiveRole.NONE, GroupRole.ADMIN, GroupRole.USER)).isFalse();
    }
}
