package com.grcplatform.security.permission;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Role")
class RoleTest {

    @Nested
    @DisplayName("implies()")
    class Implies {

        @ParameterizedTest
        @EnumSource(Role.class)
        @DisplayName("PlatformOwner implies every role")
        void platformOwnerImpliesAll(Role role) {
            assertThat(Role.PLATFORM_OWNER.implies(role)).isTrue();
        }

        @Test
        @DisplayName("TenantOwner does not imply PlatformOwner")
        void tenantOwnerNotPlatformOwner() {
            assertThat(Role.TENANT_OWNER.implies(Role.PLATFORM_OWNER)).isFalse();
        }

        @Test
        @DisplayName("other roles imply only themselves")
        void onlySelf() {
            assertThat(Role.AUDITOR.implies(Role.AUDITOR)).isTrue();
            assertThat(Role.AUDITOR.implies(Role.COMPLIANCE_OFFICER)).isFalse();
            assertThat(Role.AGENT_USER.implies(Role.TENANT_OWNER)).isFalse();
        }
    }

    @Test
    @DisplayName("fromString matches canonical names exactly")
    void fromString() {
        assertThat(Role.fromString("ComplianceOfficer")).contains(Role.COMPLIANCE_OFFICER);
        assertThat(Role.fromString("complianceofficer")).isEmpty();
        assertThat(Role.isKnown("Janitor")).isFalse();
    }
}
