package com.agentverse.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CallerIdentityMapper")
class CallerIdentityMapperTest {

    private static final String SUPERADMIN = "agentverse-superadmin";

    @Nested
    @DisplayName("fromClaims()")
    class FromClaims {

        @Test
        @DisplayName("prefers oid over sub and email over preferred_username")
        void prefersPrimaryClaims() {
            var identity = CallerIdentityMapper.fromClaims(Map.of(
                    "oid", "obj-1",
                    "sub", "sub-1",
                    "email", "alice@example.com",
                    "preferred_username", "alice",
                    "name", "Alice"), SUPERADMIN);

            assertThat(identity.subjectId()).isEqualTo("obj-1");
            assertThat(identity.email()).isEqualTo("alice@example.com");
            assertThat(identity.displayName()).isEqualTo("Alice");
        }

        @Test
        @DisplayName("falls back to sub and preferred_username")
        void fallsBack() {
            var identity = CallerIdentityMapper.fromClaims(Map.of(
                    "sub", "sub-1",
                    "preferred_username", "alice"), SUPERADMIN);

            assertThat(identity.subjectId()).isEqualTo("sub-1");
            assertThat(identity.email()).isEqualTo("alice");
        }

        @Test
        @DisplayName("sets superadmin only when the configured role claim is present")
        void superadminFromRoles() {
            var admin = CallerIdentityMapper.fromClaims(
                    Map.of("oid", "a", "roles", List.of("agentverse-user", SUPERADMIN)), SUPERADMIN);
            var user = CallerIdentityMapper.fromClaims(
                    Map.of("oid", "b", "roles", List.of("agentverse-user")), SUPERADMIN);

            assertThat(admin.superadmin()).isTrue();
            assertThat(user.superadmin()).isFalse();
            assertThat(user.roles()).containsExactly("agentverse-user");
        }

        @Test
        @DisplayName("accepts a comma-separated roles string")
        void rolesAsString() {
            var identity = CallerIdentityMapper.fromClaims(
                    Map.of("oid", "a", "roles", "agentverse-user, " + SUPERADMIN), SUPERADMIN);

            assertThat(identity.superadmin()).isTrue();
        }

        @Test
        @DisplayName("null claims yield an identity that fails validation")
        void nullClaims() {
            var identity = CallerIdentityMapper.fromClaims(null, SUPERADMIN);

            assertThat(identity.superadmin()).isFalse();
            assertThat(CallerIdentityValidator.isValid(identity)).isFalse();
        }
    }

    @Test
    @DisplayName("parseRoles() trims and skips empty entries")
    void parseRoles() {
        assertThat(CallerIdentityMapper.parseRoles(" a, ,b ,")).containsExactly("a", "b");
        assertThat(CallerIdentityMapper.parseRoles(null)).isEmpty();
    }
}
