package com.smartcampus.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Role, ResourceKind and Action lookups")
class RoleTest {

    @Nested
    @DisplayName("Role.fromString()")
    class RoleFromString {

        @Test
        @DisplayName("resolves every wire name")
        void resolvesWireNames() {
            for (Role role : Role.values()) {
                assertThat(Role.fromString(role.value())).contains(role);
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"superadmin", "super-admin", "SUPER_ADMIN", " super_admin "})
        @DisplayName("accepts legacy super admin spellings")
        void legacySuperAdmin(String value) {
            assertThat(Role.fromString(value)).contains(Role.SUPER_ADMIN);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "janitor", "root"})
        @DisplayName("returns empty for unknown roles")
        void unknown(String value) {
            assertThat(Role.fromString(value)).isEmpty();
        }

        @Test
        @DisplayName("returns empty for null")
        void nullValue() {
            assertThat(Role.fromString(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Role capabilities")
    class Capabilities {

        @Test
        @DisplayName("only super_admin bypasses the school boundary")
        void onlySuperAdminBypassesTenant() {
            for (Role role : Role.values()) {
                assertThat(role.bypassesTenant()).isEqualTo(role == Role.SUPER_ADMIN);
                assertThat(role.requiresTenant()).isEqualTo(role != Role.SUPER_ADMIN);
            }
        }

        @Test
        @DisplayName("only principal and admin may manage by permission")
        void managers() {
            assertThat(Role.PRINCIPAL.mayManageByPermission()).isTrue();
            assertThat(Role.ADMIN.mayManageByPermission()).isTrue();
            assertThat(Role.TEACHER.mayManageByPermission()).isFalse();
            assertThat(Role.SUPER_ADMIN.mayManageByPermission()).isFalse();
        }
    }

    @Test
    @DisplayName("ResourceKind accepts wire names and constant names")
    void resourceKindLookup() {
        assertThat(ResourceKind.fromString("fee_structure")).contains(ResourceKind.FEE_STRUCTURE);
        assertThat(ResourceKind.fromString("FEE-STRUCTURE")).contains(ResourceKind.FEE_STRUCTURE);
        assertThat(ResourceKind.fromString("spaceship")).isEmpty();
        assertThat(ResourceKind.STUDENT.managePermission()).isEqualTo("manage_students");
    }

    @Test
    @DisplayName("only READ is not a mutation")
    void actionMutation() {
        assertThat(Action.READ.isMutation()).isFalse();
        assertThat(Action.CREATE.isMutation()).isTrue();
        assertThat(Action.UPDATE.isMutation()).isTrue();
        assertThat(Action.DELETE.isMutation()).isTrue();
        assertThat(Action.fromString("Delete")).contains(Action.DELETE);
        assertThat(Action.fromString("patch")).isEmpty();
    }
}
